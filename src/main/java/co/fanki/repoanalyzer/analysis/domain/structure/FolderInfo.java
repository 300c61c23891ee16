package co.fanki.repoanalyzer.analysis.domain.structure;

/**
 * Classification of one top-level folder.
 *
 * @param role the assigned role
 * @param fileCount the number of files under the folder
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FolderInfo(FolderRole role, int fileCount) {
}
