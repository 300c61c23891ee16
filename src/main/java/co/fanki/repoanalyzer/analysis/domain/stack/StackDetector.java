package co.fanki.repoanalyzer.analysis.domain.stack;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Evaluates detection rules against a repository snapshot.
 *
 * <p>One generic matcher serves the three rule tables. A rule fires when
 * any of its pattern groups matches any file; firing is binary. Results
 * are the fired rule names sorted lexicographically.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StackDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            StackDetector.class);

    private final List<DetectionRule> frameworkRules;

    private final List<DetectionRule> databaseRules;

    private final List<DetectionRule> infrastructureRules;

    /**
     * Creates a detector over the built-in rule tables.
     */
    public StackDetector() {
        this(StackRules.FRAMEWORKS, StackRules.DATABASES,
                StackRules.INFRASTRUCTURE);
    }

    /**
     * Creates a detector over custom rule tables.
     *
     * @param theFrameworkRules the framework rules
     * @param theDatabaseRules the data store rules
     * @param theInfrastructureRules the infrastructure rules
     */
    public StackDetector(final List<DetectionRule> theFrameworkRules,
            final List<DetectionRule> theDatabaseRules,
            final List<DetectionRule> theInfrastructureRules) {
        this.frameworkRules = List.copyOf(Preconditions.requireNonNull(
                theFrameworkRules, "Framework rules are required"));
        this.databaseRules = List.copyOf(Preconditions.requireNonNull(
                theDatabaseRules, "Database rules are required"));
        this.infrastructureRules = List.copyOf(Preconditions.requireNonNull(
                theInfrastructureRules, "Infrastructure rules are required"));
    }

    /**
     * Detects frameworks.
     *
     * @param files the file records
     * @return sorted names of the detected frameworks
     */
    public List<String> detectFrameworks(final List<FileRecord> files) {
        return evaluate("frameworks", frameworkRules, files);
    }

    /**
     * Detects data stores.
     *
     * @param files the file records
     * @return sorted names of the detected data stores
     */
    public List<String> detectDatabases(final List<FileRecord> files) {
        return evaluate("databases", databaseRules, files);
    }

    /**
     * Detects infrastructure tooling.
     *
     * @param files the file records
     * @return sorted names of the detected tools
     */
    public List<String> detectInfrastructure(final List<FileRecord> files) {
        return evaluate("infrastructure", infrastructureRules, files);
    }

    /**
     * Evaluates a rule list against a snapshot.
     *
     * @param category the category name, for logging only
     * @param rules the rules to evaluate
     * @param files the file records
     * @return sorted names of the fired rules
     */
    public List<String> evaluate(final String category,
            final List<DetectionRule> rules, final List<FileRecord> files) {
        Preconditions.requireNonNull(rules, "Rules are required");
        Preconditions.requireNonNull(files, "Files are required");

        final SortedSet<String> detected = new TreeSet<>();
        for (final DetectionRule rule : rules) {
            for (final FileRecord file : files) {
                if (matches(rule, file)) {
                    LOG.debug("Rule {} fired on {}", rule.name(), file.path());
                    detected.add(rule.name());
                    break;
                }
            }
        }

        LOG.info("Detected {} {}: {}", detected.size(), category, detected);
        return List.copyOf(detected);
    }

    /**
     * Checks whether a rule matches a single file.
     *
     * @param rule the rule
     * @param file the file record
     * @return true if any pattern group of the rule matches the file
     */
    public boolean matches(final DetectionRule rule, final FileRecord file) {
        return matchesImports(rule, file)
                || matchesDependencies(rule, file)
                || matchesConfig(rule, file)
                || matchesFilenames(rule, file)
                || matchesExtensions(rule, file);
    }

    private boolean matchesImports(final DetectionRule rule,
            final FileRecord file) {
        if (rule.imports().isEmpty() || !file.hasContent()) {
            return false;
        }
        final String content = file.content().toLowerCase(Locale.ROOT);
        for (final String fragment : rule.imports()) {
            if (content.contains(fragment.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesDependencies(final DetectionRule rule,
            final FileRecord file) {
        if (rule.dependencyNames().isEmpty()) {
            return false;
        }
        final Optional<ManifestType> manifest = ManifestType.of(file.path());
        if (manifest.isEmpty()) {
            return false;
        }
        for (final String dependency : rule.dependencyNames()) {
            if (manifest.get().declares(file.content(), dependency)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesConfig(final DetectionRule rule,
            final FileRecord file) {
        for (final String marker : rule.configSubstrings()) {
            if (file.content().contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesFilenames(final DetectionRule rule,
            final FileRecord file) {
        for (final String fragment : rule.filenameSubstrings()) {
            if (file.path().contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesExtensions(final DetectionRule rule,
            final FileRecord file) {
        for (final String extension : rule.extensions()) {
            if (file.path().endsWith(extension)) {
                return rule.contentMarkers().isEmpty()
                        || containsAny(file.content(), rule.contentMarkers());
            }
        }
        return false;
    }

    private static boolean containsAny(final String content,
            final List<String> markers) {
        for (final String marker : markers) {
            if (content.contains(marker)) {
                return true;
            }
        }
        return false;
    }

}
