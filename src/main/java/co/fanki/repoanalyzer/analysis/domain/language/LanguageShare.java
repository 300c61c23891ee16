package co.fanki.repoanalyzer.analysis.domain.language;

/**
 * Per-language totals within one repository snapshot.
 *
 * @param files number of files classified under the language
 * @param lines number of non-blank lines across those files
 * @param percentage share of classified files, rounded to two decimals
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LanguageShare(int files, int lines, double percentage) {
}
