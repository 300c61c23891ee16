package co.fanki.repoanalyzer.analysis.domain.structure;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Role assignment of every top-level folder of a snapshot, keyed and
 * iterated by folder name.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FolderClassification {

    private final SortedMap<String, FolderInfo> folders;

    /**
     * Creates a classification.
     *
     * @param theFolders folder name to classification
     */
    public FolderClassification(final Map<String, FolderInfo> theFolders) {
        this.folders = Collections.unmodifiableSortedMap(
                new TreeMap<>(theFolders));
    }

    /**
     * Returns a classification without folders.
     *
     * @return the empty classification
     */
    public static FolderClassification empty() {
        return new FolderClassification(Map.of());
    }

    /**
     * Returns every folder with its classification.
     *
     * @return unmodifiable map sorted by folder name
     */
    public SortedMap<String, FolderInfo> folders() {
        return folders;
    }

    /**
     * Returns the role of a folder.
     *
     * @param folder the folder name
     * @return the role, or null if the folder is unknown
     */
    public FolderRole roleOf(final String folder) {
        final FolderInfo info = folders.get(folder);
        return info == null ? null : info.role();
    }

    /**
     * Returns the folders holding a role, in name order.
     *
     * @param role the role
     * @return the folder names
     */
    public List<String> foldersWith(final FolderRole role) {
        return folders.entrySet().stream()
                .filter(e -> e.getValue().role() == role)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Checks whether any folder holds a role.
     *
     * @param role the role
     * @return true if at least one folder has it
     */
    public boolean hasRole(final FolderRole role) {
        return folders.values().stream().anyMatch(i -> i.role() == role);
    }

    /**
     * Returns the number of classified folders.
     *
     * @return the folder count
     */
    public int size() {
        return folders.size();
    }

    /**
     * Checks whether no folder was classified.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return folders.isEmpty();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return folders.equals(((FolderClassification) obj).folders);
    }

    @Override
    public int hashCode() {
        return folders.hashCode();
    }

}
