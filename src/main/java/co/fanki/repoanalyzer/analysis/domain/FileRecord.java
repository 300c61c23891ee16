package co.fanki.repoanalyzer.analysis.domain;

import co.fanki.repoanalyzer.shared.Preconditions;
import co.fanki.repoanalyzer.shared.ValueObject;

/**
 * Value object holding one repository file as handed over by ingestion.
 *
 * <p>The path uses forward slashes; its first segment is the top-level
 * folder of the file, or nothing when the file sits at the repository
 * root. Content is already decoded text and is never null.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileRecord implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final String path;

    private final String content;

    private FileRecord(final String thePath, final String theContent) {
        this.path = Preconditions.requireNonBlank(thePath,
                "File path is required");
        this.content = theContent == null ? "" : theContent;
    }

    /**
     * Creates a file record.
     *
     * @param path the repository-relative path, forward-slash separated
     * @param content the decoded text content, null is read as empty
     * @return the file record
     * @throws IllegalArgumentException if the path is null or blank
     */
    public static FileRecord of(final String path, final String content) {
        return new FileRecord(path, content);
    }

    /**
     * Returns the repository-relative path.
     *
     * @return the path
     */
    public String path() {
        return path;
    }

    /**
     * Returns the file content.
     *
     * @return the content, possibly empty
     */
    public String content() {
        return content;
    }

    /**
     * Checks whether the file has any content at all.
     *
     * @return true if the content is non-empty
     */
    public boolean hasContent() {
        return !content.isEmpty();
    }

    /**
     * Returns the bare file name (last path segment).
     *
     * @return the file name
     */
    public String fileName() {
        final int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Returns the first path segment, the folder this file belongs to.
     *
     * @return the top-level folder, empty for root files
     */
    public String topLevelFolder() {
        final int slash = path.indexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /**
     * Returns the text after the last dot of the path, dot included.
     *
     * <p>The whole path is considered, so a dot in a directory name
     * yields a bogus extension that no table maps.</p>
     *
     * @return the raw extension, empty if the path has no dot
     */
    public String extension() {
        final int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(dot);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final FileRecord that = (FileRecord) obj;
        return path.equals(that.path) && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + content.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }

}
