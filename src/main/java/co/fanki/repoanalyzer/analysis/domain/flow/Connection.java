package co.fanki.repoanalyzer.analysis.domain.flow;

/**
 * Labelled arrow between two stages.
 *
 * @param from the source stage id
 * @param to the target stage id
 * @param label the relationship label
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Connection(String from, String to, String label) {
}
