package co.fanki.repoanalyzer.analysis.domain.entrypoint;

/**
 * A container start directive, captured verbatim.
 *
 * @param path the container build file
 * @param command the trimmed directive line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DockerEntry(String path, String command) {
}
