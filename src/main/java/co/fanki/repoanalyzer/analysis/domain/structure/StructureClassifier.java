package co.fanki.repoanalyzer.analysis.domain.structure;

import co.fanki.repoanalyzer.analysis.domain.AnalysisSettings;
import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assigns every top-level folder a {@link FolderRole}.
 *
 * <p>The folder name decides first. Only folders whose name says nothing
 * fall back to the files they hold: a nested convention directory
 * (components, controllers, ...) decides outright, otherwise extension
 * counts are compared against the thresholds of {@link AnalysisSettings}.
 * Each folder is judged on its own files only, which keeps the result
 * independent of input order.</p>
 *
 * <p>Files at the repository root belong to no folder and are skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StructureClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(
            StructureClassifier.class);

    private static final Set<String> FRONTEND_EXTENSIONS = Set.of(
            ".jsx", ".tsx", ".vue", ".svelte", ".html", ".css", ".scss",
            ".sass");

    private static final Set<String> BACKEND_EXTENSIONS = Set.of(
            ".py", ".go", ".java", ".rs", ".rb", ".php");

    private static final Set<String> CONFIG_EXTENSIONS = Set.of(
            ".yaml", ".yml", ".json", ".toml", ".ini", ".env", ".config");

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of(
            ".sh", ".bash", ".zsh", ".ps1");

    private final AnalysisSettings settings;

    /**
     * Creates a classifier.
     *
     * @param theSettings the thresholds of the content-based pass
     */
    public StructureClassifier(final AnalysisSettings theSettings) {
        this.settings = Preconditions.requireNonNull(theSettings,
                "Settings are required");
    }

    /**
     * Classifies the top-level folders of a snapshot.
     *
     * @param files the file records
     * @return the classification, sorted by folder name
     */
    public FolderClassification classifyFolders(final List<FileRecord> files) {
        Preconditions.requireNonNull(files, "Files are required");

        final Map<String, List<FileRecord>> byFolder = new TreeMap<>();
        for (final FileRecord file : files) {
            final String folder = file.topLevelFolder();
            if (!folder.isEmpty()) {
                byFolder.computeIfAbsent(folder, k -> new ArrayList<>())
                        .add(file);
            }
        }

        final Map<String, FolderInfo> result = new TreeMap<>();
        for (final Map.Entry<String, List<FileRecord>> entry
                : byFolder.entrySet()) {
            final String folder = entry.getKey();
            final List<FileRecord> folderFiles = entry.getValue();

            FolderRole role = FolderRole.byName(folder);
            if (role == FolderRole.MISC) {
                role = classifyByContent(folderFiles);
            }
            LOG.debug("Folder {} -> {} ({} files)", folder, role,
                    folderFiles.size());
            result.put(folder, new FolderInfo(role, folderFiles.size()));
        }

        LOG.info("Classified {} top-level folders", result.size());
        return new FolderClassification(result);
    }

    /**
     * Classifies a folder by the files it contains.
     *
     * @param folderFiles the files under one folder
     * @return the inferred role, {@link FolderRole#MISC} if no threshold
     *         is met
     */
    FolderRole classifyByContent(final List<FileRecord> folderFiles) {
        if (folderFiles.isEmpty()) {
            return FolderRole.MISC;
        }

        int frontend = 0;
        int backend = 0;
        int config = 0;
        int scripts = 0;
        boolean frontendSegment = false;
        boolean backendSegment = false;

        for (final FileRecord file : folderFiles) {
            final String extension = file.extension();
            if (FRONTEND_EXTENSIONS.contains(extension)) {
                frontend++;
            }
            if (BACKEND_EXTENSIONS.contains(extension)) {
                backend++;
            }
            if (CONFIG_EXTENSIONS.contains(extension)) {
                config++;
            }
            if (SCRIPT_EXTENSIONS.contains(extension)) {
                scripts++;
            }

            final String lowerPath = file.path().toLowerCase(Locale.ROOT);
            frontendSegment |= hasSegment(lowerPath,
                    FolderRole.FRONTEND.pathSegments());
            backendSegment |= hasSegment(lowerPath,
                    FolderRole.BACKEND.pathSegments());
        }

        final int floor = settings.minDominantFiles();
        if (frontendSegment || (frontend > backend && frontend > floor)) {
            return FolderRole.FRONTEND;
        }
        if (backendSegment || (backend > frontend && backend > floor)) {
            return FolderRole.BACKEND;
        }

        final double majority = folderFiles.size() * settings.majorityRatio();
        if (config > majority) {
            return FolderRole.CONFIG;
        }
        if (scripts > majority) {
            return FolderRole.SCRIPTS;
        }
        return FolderRole.MISC;
    }

    private static boolean hasSegment(final String lowerPath,
            final List<String> segments) {
        for (final String segment : segments) {
            if (lowerPath.contains("/" + segment + "/")
                    || lowerPath.endsWith("/" + segment)) {
                return true;
            }
        }
        return false;
    }

}
