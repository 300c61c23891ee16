package co.fanki.repoanalyzer.analysis.application;

/**
 * Raw inbound file, as received over the wire.
 *
 * @param path the repository-relative path
 * @param content the decoded text content
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileInput(String path, String content) {}
