package co.fanki.repoanalyzer.analysis.domain.entrypoint;

/**
 * A file named after a language's conventional entry file.
 *
 * @param path the file path
 * @param type the language whose convention matched
 * @param filename the bare file name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ApplicationEntry(String path, String type, String filename) {
}
