package co.fanki.repoanalyzer.analysis.domain.stack;

import java.util.Locale;
import java.util.Optional;

/**
 * Dependency manifests the stack detector knows how to read.
 *
 * <p>Python manifests are searched as plain case-insensitive text. The
 * npm manifest requires the dependency name to appear quoted, so that
 * {@code "react"} does not fire on a description mentioning react.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ManifestType {

    /** pip requirements list. */
    REQUIREMENTS("requirements.txt", false),

    /** Python project manifest. */
    PYPROJECT("pyproject.toml", false),

    /** npm package manifest. */
    PACKAGE_JSON("package.json", true);

    private final String fileName;

    private final boolean quoted;

    ManifestType(final String theFileName, final boolean isQuoted) {
        this.fileName = theFileName;
        this.quoted = isQuoted;
    }

    /**
     * Returns the manifest file name.
     *
     * @return the file name
     */
    public String fileName() {
        return fileName;
    }

    /**
     * Finds the manifest type of a path.
     *
     * <p>The path only has to contain the manifest name, so nested
     * manifests such as {@code web/package.json} count.</p>
     *
     * @param path the file path
     * @return the manifest type, empty if the path is not a manifest
     */
    public static Optional<ManifestType> of(final String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (final ManifestType type : values()) {
            if (path.contains(type.fileName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether the manifest content declares a dependency.
     *
     * @param content the manifest content
     * @param dependency the dependency name
     * @return true if the dependency is present in this manifest's form
     */
    public boolean declares(final String content, final String dependency) {
        if (quoted) {
            return content.contains("\"" + dependency + "\"")
                    || content.contains("'" + dependency + "'");
        }
        return content.toLowerCase(Locale.ROOT)
                .contains(dependency.toLowerCase(Locale.ROOT));
    }

}
