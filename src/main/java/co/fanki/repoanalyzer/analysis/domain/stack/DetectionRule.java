package co.fanki.repoanalyzer.analysis.domain.stack;

import co.fanki.repoanalyzer.shared.Preconditions;

import java.util.List;

/**
 * Declarative detection rule for one named technology.
 *
 * <p>Every group is optional. The rule fires when any group matches any
 * file; groups never combine, except that {@code contentMarkers} qualify
 * {@code extensions}: when markers are present an extension match only
 * counts if the same file also contains one of them.</p>
 *
 * @param name the technology name reported when the rule fires
 * @param imports fragments searched case-insensitively in file content
 * @param dependencyNames names searched in dependency manifests
 * @param configSubstrings case-sensitive fragments searched in content,
 *        typically connection-string schemes
 * @param filenameSubstrings fragments searched in the file path
 * @param extensions path suffixes
 * @param contentMarkers case-sensitive fragments that corroborate an
 *        extension match
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DetectionRule(
        String name,
        List<String> imports,
        List<String> dependencyNames,
        List<String> configSubstrings,
        List<String> filenameSubstrings,
        List<String> extensions,
        List<String> contentMarkers) {

    /** Validates the name and freezes the pattern groups. */
    public DetectionRule {
        Preconditions.requireNonBlank(name, "Rule name is required");
        imports = List.copyOf(imports);
        dependencyNames = List.copyOf(dependencyNames);
        configSubstrings = List.copyOf(configSubstrings);
        filenameSubstrings = List.copyOf(filenameSubstrings);
        extensions = List.copyOf(extensions);
        contentMarkers = List.copyOf(contentMarkers);
    }

    /**
     * Starts a rule with no pattern groups.
     *
     * @param name the technology name
     * @return a rule that never fires until groups are added
     */
    public static DetectionRule named(final String name) {
        return new DetectionRule(name, List.of(), List.of(), List.of(),
                List.of(), List.of(), List.of());
    }

    /**
     * Returns a copy with the given import fragments.
     *
     * @param values the import fragments
     * @return the new rule
     */
    public DetectionRule imports(final String... values) {
        return new DetectionRule(name, List.of(values), dependencyNames,
                configSubstrings, filenameSubstrings, extensions,
                contentMarkers);
    }

    /**
     * Returns a copy with the given manifest dependency names.
     *
     * @param values the dependency names
     * @return the new rule
     */
    public DetectionRule dependencies(final String... values) {
        return new DetectionRule(name, imports, List.of(values),
                configSubstrings, filenameSubstrings, extensions,
                contentMarkers);
    }

    /**
     * Returns a copy with the given connection-string markers.
     *
     * @param values the configuration fragments
     * @return the new rule
     */
    public DetectionRule config(final String... values) {
        return new DetectionRule(name, imports, dependencyNames,
                List.of(values), filenameSubstrings, extensions,
                contentMarkers);
    }

    /**
     * Returns a copy with the given path fragments.
     *
     * @param values the path fragments
     * @return the new rule
     */
    public DetectionRule filenames(final String... values) {
        return new DetectionRule(name, imports, dependencyNames,
                configSubstrings, List.of(values), extensions,
                contentMarkers);
    }

    /**
     * Returns a copy with the given path suffixes.
     *
     * @param values the suffixes
     * @return the new rule
     */
    public DetectionRule extensions(final String... values) {
        return new DetectionRule(name, imports, dependencyNames,
                configSubstrings, filenameSubstrings, List.of(values),
                contentMarkers);
    }

    /**
     * Returns a copy whose extension matches need one of these markers.
     *
     * @param values the corroborating content markers
     * @return the new rule
     */
    public DetectionRule corroboratedBy(final String... values) {
        return new DetectionRule(name, imports, dependencyNames,
                configSubstrings, filenameSubstrings, extensions,
                List.of(values));
    }

}
