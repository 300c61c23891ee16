package co.fanki.repoanalyzer.analysis.domain.entrypoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Entry points of a snapshot in discovery order.
 *
 * <p>Application and framework entries hold at most one record per path,
 * the first one discovered. Docker entries are not deduplicated because a
 * build file may carry several directives.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EntryPointSet {

    private final List<ApplicationEntry> applicationFiles;

    private final List<FrameworkEntry> frameworkEntrypoints;

    private final List<DockerEntry> dockerEntrypoints;

    /**
     * Creates an entry point set, dropping repeated paths.
     *
     * @param theApplicationFiles filename-convention matches
     * @param theFrameworkEntrypoints bootstrap-pattern matches
     * @param theDockerEntrypoints container directives
     */
    public EntryPointSet(final List<ApplicationEntry> theApplicationFiles,
            final List<FrameworkEntry> theFrameworkEntrypoints,
            final List<DockerEntry> theDockerEntrypoints) {
        this.applicationFiles = firstPerPath(theApplicationFiles,
                ApplicationEntry::path);
        this.frameworkEntrypoints = firstPerPath(theFrameworkEntrypoints,
                FrameworkEntry::path);
        this.dockerEntrypoints = List.copyOf(theDockerEntrypoints);
    }

    /**
     * Returns a set without any entry point.
     *
     * @return the empty set
     */
    public static EntryPointSet empty() {
        return new EntryPointSet(List.of(), List.of(), List.of());
    }

    /**
     * Returns the conventional entry files.
     *
     * @return unmodifiable list in discovery order
     */
    public List<ApplicationEntry> applicationFiles() {
        return applicationFiles;
    }

    /**
     * Returns the framework bootstrap files.
     *
     * @return unmodifiable list in discovery order
     */
    public List<FrameworkEntry> frameworkEntrypoints() {
        return frameworkEntrypoints;
    }

    /**
     * Returns the container start directives.
     *
     * @return unmodifiable list in discovery order
     */
    public List<DockerEntry> dockerEntrypoints() {
        return dockerEntrypoints;
    }

    /**
     * Returns application entry paths followed by framework entry paths.
     *
     * <p>A path present in both lists appears twice.</p>
     *
     * @return the combined entry paths
     */
    public List<String> entryPaths() {
        final List<String> paths = new ArrayList<>();
        applicationFiles.forEach(e -> paths.add(e.path()));
        frameworkEntrypoints.forEach(e -> paths.add(e.path()));
        return paths;
    }

    /**
     * Returns the number of application and framework entries.
     *
     * @return the entry total, docker directives excluded
     */
    public int total() {
        return applicationFiles.size() + frameworkEntrypoints.size();
    }

    /**
     * Checks whether any application or framework entry exists.
     *
     * @return true if there is at least one
     */
    public boolean hasEntries() {
        return total() > 0;
    }

    private static <T> List<T> firstPerPath(final List<T> entries,
            final Function<T, String> path) {
        final Map<String, T> unique = new LinkedHashMap<>();
        for (final T entry : entries) {
            unique.putIfAbsent(path.apply(entry), entry);
        }
        return List.copyOf(unique.values());
    }

}
