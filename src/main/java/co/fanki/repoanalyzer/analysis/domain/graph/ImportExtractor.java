package co.fanki.repoanalyzer.analysis.domain.graph;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Abstract strategy for pulling module identifiers out of a source file.
 *
 * <p>Each language has its own import syntax. Subclasses declare which
 * path suffixes they handle and how identifiers are read from content,
 * while this class provides the template method {@link #extract} that
 * applies them and removes duplicates.</p>
 *
 * <p>Identifiers are coarse: the top-level module or package name, never
 * a resolved path. Resolution against the snapshot is the job of
 * {@link ModuleResolver}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class ImportExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportExtractor.class);

    /**
     * Returns the language name handled by this extractor.
     *
     * @return the language (e.g., "Python")
     */
    public abstract String language();

    /**
     * Returns the path suffixes this extractor handles.
     *
     * @return the suffixes, dot included (e.g., ".py")
     */
    protected abstract List<String> suffixes();

    /**
     * Reads the raw identifiers from the file content.
     *
     * @param content the file content, never null
     * @return identifiers in discovery order, duplicates allowed
     */
    protected abstract List<String> extractIdentifiers(String content);

    /**
     * Checks if this extractor handles the given file.
     *
     * @param file the file record
     * @return true if the path ends with one of the handled suffixes
     */
    public boolean supports(final FileRecord file) {
        Preconditions.requireNonNull(file, "File is required");
        for (final String suffix : suffixes()) {
            if (file.path().endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts the distinct module identifiers a file imports.
     *
     * @param file the file record
     * @return unmodifiable set of identifiers, in discovery order
     */
    public Set<String> extract(final FileRecord file) {
        Preconditions.requireNonNull(file, "File is required");

        final Set<String> identifiers = new LinkedHashSet<>(
                extractIdentifiers(file.content()));

        LOG.debug("{} imports in {}: {}", language(), file.path(),
                identifiers);

        return Collections.unmodifiableSet(identifiers);
    }

}
