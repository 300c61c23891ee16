package co.fanki.repoanalyzer.analysis.domain;

import co.fanki.repoanalyzer.shared.Preconditions;

/**
 * Tunable thresholds for the structural inference pipeline.
 *
 * <p>Every detector receives the settings explicitly. The defaults are the
 * empirically chosen constants of the heuristics; comparisons against them
 * are always strict ("more than", never "at least") unless the name says
 * otherwise.</p>
 *
 * @param minDominantFiles a frontend or backend file count must exceed
 *        this floor to win the content-based folder vote
 * @param majorityRatio config or script files must exceed this share of
 *        a folder's files
 * @param partialImportMatch whether import resolution may fall back to
 *        the contains/ends-with match
 * @param maxEntryComponents how many entry paths the entry stage lists
 * @param minMiddlewareFolders how many middleware folders are needed
 *        before a middleware stage is added
 * @param parallel whether the independent detectors run concurrently
 * @param threads the pool size used when running concurrently
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisSettings(
        int minDominantFiles,
        double majorityRatio,
        boolean partialImportMatch,
        int maxEntryComponents,
        int minMiddlewareFolders,
        boolean parallel,
        int threads) {

    /** Validates the thresholds. */
    public AnalysisSettings {
        Preconditions.requireNonNegative(minDominantFiles,
                "Minimum dominant files must be non-negative");
        Preconditions.requireFraction(majorityRatio,
                "Majority ratio must be within [0, 1]");
        Preconditions.requirePositive(maxEntryComponents,
                "Max entry components must be positive");
        Preconditions.requirePositive(minMiddlewareFolders,
                "Min middleware folders must be positive");
        Preconditions.requirePositive(threads,
                "Thread count must be positive");
    }

    /**
     * Returns the default settings.
     *
     * @return the settings used when nothing is configured
     */
    public static AnalysisSettings defaults() {
        return new AnalysisSettings(2, 0.5, true, 5, 2, false, 4);
    }

    /**
     * Returns a copy of these settings with concurrency switched on or off.
     *
     * @param enabled whether to fan out the detectors
     * @return the adjusted settings
     */
    public AnalysisSettings withParallel(final boolean enabled) {
        return new AnalysisSettings(minDominantFiles, majorityRatio,
                partialImportMatch, maxEntryComponents,
                minMiddlewareFolders, enabled, threads);
    }

}
