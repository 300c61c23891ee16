package co.fanki.repoanalyzer.analysis.domain.language;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file paths to languages by extension and aggregates per-repository
 * language statistics.
 *
 * <p>Extension lookup is case-insensitive. Files whose language is
 * {@link #UNKNOWN} take no part in the statistics at all, neither as a
 * language nor in the file total that percentages are computed from.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LanguageClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(
            LanguageClassifier.class);

    /** Language reported for unmapped or extension-less paths. */
    public static final String UNKNOWN = "Unknown";

    private static final Map<String, String> EXTENSIONS = buildExtensions();

    /**
     * Classifies a path by its extension.
     *
     * @param path the file path
     * @return the language name, or {@link #UNKNOWN}
     */
    public String classify(final String path) {
        if (path == null) {
            return UNKNOWN;
        }
        final int dot = path.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }
        final String extension = path.substring(dot).toLowerCase(Locale.ROOT);
        return EXTENSIONS.getOrDefault(extension, UNKNOWN);
    }

    /**
     * Aggregates language statistics over a snapshot.
     *
     * @param files the file records
     * @return the statistics, empty when no file could be classified
     */
    public LanguageStats aggregate(final List<FileRecord> files) {
        Preconditions.requireNonNull(files, "Files are required");

        final Map<String, Integer> counts = new LinkedHashMap<>();
        final Map<String, Integer> lines = new HashMap<>();
        int total = 0;

        for (final FileRecord file : files) {
            final String language = classify(file.path());
            if (UNKNOWN.equals(language)) {
                continue;
            }
            counts.merge(language, 1, Integer::sum);
            lines.merge(language, countNonBlankLines(file.content()),
                    Integer::sum);
            total++;
        }

        if (total == 0) {
            LOG.debug("No classified files among {} records", files.size());
            return LanguageStats.empty();
        }

        String primary = null;
        int best = 0;
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                primary = entry.getKey();
            }
        }

        final List<Map.Entry<String, Integer>> ordered =
                new ArrayList<>(counts.entrySet());
        ordered.sort(Map.Entry.<String, Integer>comparingByValue(
                Comparator.reverseOrder()));

        final Map<String, LanguageShare> shares = new LinkedHashMap<>();
        for (final Map.Entry<String, Integer> entry : ordered) {
            final int count = entry.getValue();
            shares.put(entry.getKey(), new LanguageShare(count,
                    lines.get(entry.getKey()), percentage(count, total)));
        }

        LOG.info("Classified {} of {} files into {} languages, primary: {}",
                total, files.size(), shares.size(), primary);

        return new LanguageStats(shares, primary, total);
    }

    static int countNonBlankLines(final String content) {
        int count = 0;
        for (final String line : content.split("\n", -1)) {
            if (!line.isBlank()) {
                count++;
            }
        }
        return count;
    }

    /** Rounds half-to-even on the exact binary value of the share. */
    private static double percentage(final int count, final int total) {
        final double share = count / (double) total * 100;
        return new BigDecimal(share)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    private static Map<String, String> buildExtensions() {
        final Map<String, String> map = new HashMap<>();
        register(map, "Python", ".py", ".pyx", ".pyi");
        register(map, "JavaScript", ".js", ".jsx", ".mjs", ".cjs");
        register(map, "TypeScript", ".ts", ".tsx");
        register(map, "Java", ".java");
        register(map, "Go", ".go");
        register(map, "Rust", ".rs");
        register(map, "C", ".c", ".h");
        register(map, "C++", ".cpp", ".cc", ".cxx", ".hpp", ".hh", ".hxx");
        register(map, "C#", ".cs");
        register(map, "HTML", ".html", ".htm");
        register(map, "CSS", ".css", ".less");
        register(map, "SCSS", ".scss", ".sass");
        register(map, "Shell", ".sh", ".bash", ".zsh");
        register(map, "YAML", ".yaml", ".yml");
        register(map, "JSON", ".json");
        register(map, "XML", ".xml");
        register(map, "TOML", ".toml");
        register(map, "Ruby", ".rb");
        register(map, "PHP", ".php");
        register(map, "Swift", ".swift");
        register(map, "Kotlin", ".kt", ".kts");
        register(map, "Scala", ".scala");
        register(map, "R", ".r");
        register(map, "SQL", ".sql");
        register(map, "Markdown", ".md", ".markdown");
        return Map.copyOf(map);
    }

    private static void register(final Map<String, String> map,
            final String language, final String... extensions) {
        for (final String extension : extensions) {
            map.put(extension, language);
        }
    }

}
