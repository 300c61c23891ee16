package co.fanki.repoanalyzer.analysis.domain.language;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Language statistics of a repository snapshot.
 *
 * <p>Languages are kept ordered by file count, highest first; equal counts
 * keep the order in which the counting pass first met them. Percentages
 * are file based and may not add up to exactly 100.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LanguageStats {

    private static final LanguageStats EMPTY =
            new LanguageStats(Map.of(), null, 0);

    private final Map<String, LanguageShare> languages;

    private final String primaryLanguage;

    private final int totalFiles;

    LanguageStats(final Map<String, LanguageShare> theLanguages,
            final String thePrimaryLanguage, final int theTotalFiles) {
        this.languages = Collections.unmodifiableMap(
                new LinkedHashMap<>(theLanguages));
        this.primaryLanguage = thePrimaryLanguage;
        this.totalFiles = theTotalFiles;
    }

    /**
     * Returns the statistics of a snapshot without classified files.
     *
     * @return the empty statistics
     */
    public static LanguageStats empty() {
        return EMPTY;
    }

    /**
     * Returns the per-language shares, most files first.
     *
     * @return unmodifiable ordered map of language name to share
     */
    public Map<String, LanguageShare> languages() {
        return languages;
    }

    /**
     * Returns the language with the most files.
     *
     * @return the primary language, or null when nothing was classified
     */
    public String primaryLanguage() {
        return primaryLanguage;
    }

    /**
     * Returns the number of classified files.
     *
     * @return the classified file count
     */
    public int totalFiles() {
        return totalFiles;
    }

    /**
     * Returns the share of a single language.
     *
     * @param language the language name
     * @return the share, or null if the language was not seen
     */
    public LanguageShare share(final String language) {
        return languages.get(language);
    }

    /**
     * Checks whether no file was classified.
     *
     * @return true if the statistics are empty
     */
    public boolean isEmpty() {
        return languages.isEmpty();
    }

}
