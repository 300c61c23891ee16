package co.fanki.repoanalyzer.analysis.domain.entrypoint;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Finds process entry files, framework bootstrap code and container start
 * commands.
 *
 * <p>Entry point signals:</p>
 * <ul>
 *   <li>Conventional file names per language (exact, case-sensitive);
 *       a name shared by several languages yields one candidate each,
 *       the first of which is kept</li>
 *   <li>Framework bootstrap patterns, case-insensitive; one match in a
 *       framework's group flags the file</li>
 *   <li>{@code CMD} / {@code ENTRYPOINT} lines of Dockerfiles</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EntryPointFinder {

    private static final Logger LOG = LoggerFactory.getLogger(
            EntryPointFinder.class);

    private static final String DOCKERFILE = "Dockerfile";

    private static final List<String> DOCKER_DIRECTIVES = List.of(
            "CMD", "ENTRYPOINT");

    private static final Map<String, List<String>> ENTRY_FILES =
            new LinkedHashMap<>();

    private static final Map<String, List<Pattern>> BOOTSTRAP_PATTERNS =
            new LinkedHashMap<>();

    static {
        ENTRY_FILES.put("Python", List.of("main.py", "app.py", "wsgi.py",
                "asgi.py", "run.py", "__main__.py"));
        ENTRY_FILES.put("JavaScript", List.of("index.js", "server.js",
                "app.js", "main.js"));
        ENTRY_FILES.put("TypeScript", List.of("index.ts", "server.ts",
                "app.ts", "main.ts"));
        ENTRY_FILES.put("Go", List.of("main.go"));
        ENTRY_FILES.put("Java", List.of("Main.java", "Application.java"));
        ENTRY_FILES.put("Rust", List.of("main.rs"));

        bootstrap("Flask",
                "app\\s*=\\s*Flask\\(",
                "@app\\.route\\(",
                "app\\.run\\(");
        bootstrap("FastAPI",
                "app\\s*=\\s*FastAPI\\(",
                "@app\\.get\\(",
                "@app\\.post\\(",
                "uvicorn\\.run\\(");
        bootstrap("Django",
                "DJANGO_SETTINGS_MODULE",
                "from\\s+django\\.core\\.wsgi\\s+import\\s+get_wsgi_application",
                "from\\s+django\\.core\\.asgi\\s+import\\s+get_asgi_application");
        bootstrap("Express",
                "express\\(\\)",
                "app\\.listen\\(",
                "const\\s+app\\s*=\\s*express\\(",
                "var\\s+app\\s*=\\s*express\\(");
        bootstrap("NestJS",
                "NestFactory\\.create",
                "@Module\\(",
                "bootstrap\\(\\)");
    }

    /**
     * Finds the entry points of a snapshot.
     *
     * @param files the file records
     * @return the entry points, in discovery order
     */
    public EntryPointSet findEntrypoints(final List<FileRecord> files) {
        Preconditions.requireNonNull(files, "Files are required");

        final List<ApplicationEntry> applications = new ArrayList<>();
        final List<FrameworkEntry> frameworks = new ArrayList<>();
        final List<DockerEntry> dockers = new ArrayList<>();

        for (final FileRecord file : files) {
            final String filename = file.fileName();

            for (final Map.Entry<String, List<String>> convention
                    : ENTRY_FILES.entrySet()) {
                if (convention.getValue().contains(filename)) {
                    applications.add(new ApplicationEntry(file.path(),
                            convention.getKey(), filename));
                }
            }

            for (final Map.Entry<String, List<Pattern>> group
                    : BOOTSTRAP_PATTERNS.entrySet()) {
                if (matchesAny(file.content(), group.getValue())) {
                    frameworks.add(new FrameworkEntry(file.path(),
                            group.getKey()));
                }
            }

            if (DOCKERFILE.equals(filename)
                    || file.path().contains(DOCKERFILE)) {
                for (final String command : dockerDirectives(file.content())) {
                    dockers.add(new DockerEntry(file.path(), command));
                }
            }
        }

        final EntryPointSet result = new EntryPointSet(applications,
                frameworks, dockers);

        LOG.info("Found {} application entries, {} framework entries,"
                        + " {} docker directives",
                result.applicationFiles().size(),
                result.frameworkEntrypoints().size(),
                result.dockerEntrypoints().size());

        return result;
    }

    /**
     * Extracts the start directives of a container build file.
     *
     * @param content the build file content
     * @return the trimmed directive lines, in file order
     */
    List<String> dockerDirectives(final String content) {
        final List<String> commands = new ArrayList<>();
        for (final String raw : content.split("\n")) {
            final String line = raw.trim();
            for (final String directive : DOCKER_DIRECTIVES) {
                if (line.startsWith(directive)) {
                    commands.add(line);
                }
            }
        }
        return commands;
    }

    private static boolean matchesAny(final String content,
            final List<Pattern> patterns) {
        for (final Pattern pattern : patterns) {
            if (pattern.matcher(content).find()) {
                return true;
            }
        }
        return false;
    }

    private static void bootstrap(final String framework,
            final String... regexes) {
        final List<Pattern> patterns = new ArrayList<>();
        for (final String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        BOOTSTRAP_PATTERNS.put(framework, List.copyOf(patterns));
    }

}
