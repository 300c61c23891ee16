package co.fanki.repoanalyzer.analysis.domain.graph;

import co.fanki.repoanalyzer.shared.Preconditions;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a coarse module identifier to a file of the snapshot.
 *
 * <p>Resolution tries, in order:</p>
 * <ol>
 *   <li>the identifier is itself a file path</li>
 *   <li>the identifier equals a normalized path (extension dropped,
 *       slashes turned into dots), so {@code pkg.mod} finds
 *       {@code pkg/mod.py}</li>
 *   <li>when partial matching is on, the first normalized path, in input
 *       order, that contains or ends with the identifier</li>
 * </ol>
 *
 * <p>The partial step is loose: {@code os} resolves
 * to {@code docs/hosts.md} if that file exists. Callers that need
 * precision switch it off.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ModuleResolver {

    private final Set<String> paths;

    /** Normalized path to original path; the last duplicate wins. */
    private final Map<String, String> normalized;

    private final boolean partialMatch;

    /**
     * Creates a resolver over the given snapshot paths.
     *
     * @param thePaths every file path of the snapshot, in input order
     * @param thePartialMatch whether the contains/ends-with fallback runs
     */
    public ModuleResolver(final List<String> thePaths,
            final boolean thePartialMatch) {
        Preconditions.requireNonNull(thePaths, "Paths are required");
        this.paths = new LinkedHashSet<>(thePaths);
        this.normalized = new LinkedHashMap<>();
        for (final String path : thePaths) {
            normalized.put(normalize(path), path);
        }
        this.partialMatch = thePartialMatch;
    }

    /**
     * Resolves an identifier to a snapshot file.
     *
     * @param identifier the module identifier
     * @return the resolved path, or empty if nothing matches
     */
    public Optional<String> resolve(final String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return Optional.empty();
        }
        if (paths.contains(identifier)) {
            return Optional.of(identifier);
        }
        final String exact = normalized.get(identifier);
        if (exact != null) {
            return Optional.of(exact);
        }
        if (partialMatch) {
            for (final Map.Entry<String, String> entry
                    : normalized.entrySet()) {
                final String candidate = entry.getKey();
                if (candidate.contains(identifier)
                        || candidate.endsWith(identifier)) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes a path to a dotted module name.
     *
     * @param path the file path
     * @return the path without its last extension, slashes as dots
     */
    static String normalize(final String path) {
        final int dot = path.lastIndexOf('.');
        final String stem = dot < 0 ? path : path.substring(0, dot);
        return stem.replace('/', '.');
    }

}
