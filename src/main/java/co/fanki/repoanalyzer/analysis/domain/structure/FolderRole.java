package co.fanki.repoanalyzer.analysis.domain.structure;

import java.util.List;
import java.util.Locale;

/**
 * Semantic role of a top-level repository folder.
 *
 * <p>Declaration order is the order of the name-based pass: the first
 * role owning a fragment contained in the folder name wins, so
 * {@code webapi} is a frontend folder because {@code web} is checked
 * before {@code api}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FolderRole {

    /** User interface code and static assets. */
    FRONTEND(List.of("frontend", "client", "web", "ui", "app", "public",
            "static", "assets"),
            List.of("components", "pages", "views", "styles", "hooks")),

    /** Server-side code and APIs. */
    BACKEND(List.of("backend", "server", "api", "services", "core",
            "src/api", "app/api"),
            List.of("routes", "controllers", "models", "middleware",
                    "handlers")),

    /** Configuration. */
    CONFIG(List.of("config", "configuration", "settings", "env")),

    /** Deployment and delivery. */
    INFRASTRUCTURE(List.of("infra", "infrastructure", "deploy",
            "deployment", "k8s", "kubernetes", "docker", ".github",
            ".gitlab")),

    /** Scripts, tools and utilities. */
    SCRIPTS(List.of("scripts", "bin", "tools", "utils", "utilities")),

    /** Test suites. */
    TESTS(List.of("tests", "test", "__tests__", "spec", "specs")),

    /** Documentation. */
    DOCS(List.of("docs", "documentation", "doc")),

    /** Schemas, migrations and seed data. */
    DATABASE(List.of("database", "db", "migrations", "seeds", "fixtures")),

    /** Nothing recognizable. */
    MISC(List.of());

    private final List<String> nameFragments;

    private final List<String> pathSegments;

    FolderRole(final List<String> theNameFragments) {
        this(theNameFragments, List.of());
    }

    FolderRole(final List<String> theNameFragments,
            final List<String> thePathSegments) {
        this.nameFragments = theNameFragments;
        this.pathSegments = thePathSegments;
    }

    /**
     * Returns the folder name fragments that identify this role.
     *
     * @return the name fragments
     */
    public List<String> nameFragments() {
        return nameFragments;
    }

    /**
     * Returns the nested directory names that betray this role.
     *
     * @return the convention segment names, empty for most roles
     */
    public List<String> pathSegments() {
        return pathSegments;
    }

    /**
     * Returns the role name as used in transfer objects.
     *
     * @return the lower-case role name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies a folder by name alone.
     *
     * @param folder the folder name
     * @return the first role whose fragment the lower-cased name
     *         contains, or {@link #MISC}
     */
    public static FolderRole byName(final String folder) {
        final String lower = folder.toLowerCase(Locale.ROOT);
        for (final FolderRole role : values()) {
            for (final String fragment : role.nameFragments) {
                if (lower.contains(fragment)) {
                    return role;
                }
            }
        }
        return MISC;
    }

}
