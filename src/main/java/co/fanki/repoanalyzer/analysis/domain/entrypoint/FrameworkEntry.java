package co.fanki.repoanalyzer.analysis.domain.entrypoint;

/**
 * A file whose content bootstraps a known framework.
 *
 * @param path the file path
 * @param framework the framework whose bootstrap pattern matched
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FrameworkEntry(String path, String framework) {
}
