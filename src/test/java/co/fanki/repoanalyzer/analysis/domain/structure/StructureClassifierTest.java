package co.fanki.repoanalyzer.analysis.domain.structure;

import co.fanki.repoanalyzer.analysis.domain.AnalysisSettings;
import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for StructureClassifier.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StructureClassifierTest {

    private final StructureClassifier classifier =
            new StructureClassifier(AnalysisSettings.defaults());

    // -- name pass ---------------------------------------------------------

    @Test
    void whenClassifying_givenFrontendFolderWithPythonFiles_shouldKeepNameRole() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("frontend/a.py", "x"),
                        FileRecord.of("frontend/b.py", "x"),
                        FileRecord.of("frontend/c.py", "x"),
                        FileRecord.of("frontend/d.py", "x")));

        assertEquals(FolderRole.FRONTEND, result.roleOf("frontend"));
        assertEquals(4, result.folders().get("frontend").fileCount());
    }

    @Test
    void whenClassifying_givenNameMatchingSeveralRoles_shouldUseRoleOrder() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("webapi/handler.go", "x"),
                        FileRecord.of("DB-Migrations/001.sql", "x"),
                        FileRecord.of("test-utils/helper.py", "x")));

        assertEquals(FolderRole.FRONTEND, result.roleOf("webapi"));
        assertEquals(FolderRole.DATABASE, result.roleOf("DB-Migrations"));
        assertEquals(FolderRole.SCRIPTS, result.roleOf("test-utils"));
    }

    @Test
    void whenClassifying_givenRootFiles_shouldSkipThem() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("README.md", "x"),
                        FileRecord.of("setup.py", "x")));

        assertTrue(result.isEmpty());
        assertNull(result.roleOf("README.md"));
    }

    // -- content pass ------------------------------------------------------

    @Test
    void whenClassifying_givenThreeComponentFiles_shouldInferFrontend() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("lib/a.tsx", "x"),
                        FileRecord.of("lib/b.tsx", "x"),
                        FileRecord.of("lib/c.css", "x")));

        assertEquals(FolderRole.FRONTEND, result.roleOf("lib"));
    }

    @Test
    void whenClassifying_givenTwoComponentFiles_shouldStayMisc() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("lib/a.tsx", "x"),
                        FileRecord.of("lib/b.tsx", "x")));

        assertEquals(FolderRole.MISC, result.roleOf("lib"));
    }

    @Test
    void whenClassifying_givenControllersDirectory_shouldInferBackend() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("pkg/http/controllers/user.txt", "x")));

        assertEquals(FolderRole.BACKEND, result.roleOf("pkg"));
    }

    @Test
    void whenClassifying_givenBothConventionDirectories_shouldPreferFrontend() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("pkg/routes/a.go", "x"),
                        FileRecord.of("pkg/b.go", "x"),
                        FileRecord.of("pkg/c.go", "x"),
                        FileRecord.of("pkg/pages/index.md", "x")));

        assertEquals(FolderRole.FRONTEND, result.roleOf("pkg"));
    }

    @Test
    void whenClassifying_givenConfigMajority_shouldInferConfig() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("pkg/a.yaml", "x"),
                        FileRecord.of("pkg/b.json", "x"),
                        FileRecord.of("pkg/c.txt", "x")));

        assertEquals(FolderRole.CONFIG, result.roleOf("pkg"));
    }

    @Test
    void whenClassifying_givenConfigExactlyHalf_shouldStayMisc() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("pkg/a.yaml", "x"),
                        FileRecord.of("pkg/c.txt", "x")));

        assertEquals(FolderRole.MISC, result.roleOf("pkg"));
    }

    @Test
    void whenClassifying_givenShellScripts_shouldInferScripts() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("hack/build.sh", "x"),
                        FileRecord.of("hack/release.sh", "x")));

        assertEquals(FolderRole.SCRIPTS, result.roleOf("hack"));
    }

    @Test
    void whenClassifying_givenLowerFloor_shouldAcceptFewerFiles() {
        final StructureClassifier lenient = new StructureClassifier(
                new AnalysisSettings(0, 0.5, true, 5, 2, false, 4));

        final FolderClassification result = lenient.classifyFolders(
                List.of(FileRecord.of("lib/a.tsx", "x")));

        assertEquals(FolderRole.FRONTEND, result.roleOf("lib"));
    }

    // -- properties --------------------------------------------------------

    @Test
    void whenClassifying_givenShuffledInput_shouldReturnSameResult() {
        final List<FileRecord> files = new ArrayList<>(List.of(
                FileRecord.of("frontend/App.jsx", "x"),
                FileRecord.of("lib/a.go", "x"),
                FileRecord.of("lib/b.go", "x"),
                FileRecord.of("lib/c.go", "x"),
                FileRecord.of("hack/run.sh", "x"),
                FileRecord.of("pkg/a.yaml", "x"),
                FileRecord.of("pkg/components/x.txt", "x"),
                FileRecord.of("docs/index.md", "x"),
                FileRecord.of("README.md", "x")));

        final FolderClassification expected = classifier.classifyFolders(
                files);
        final Random random = new Random(7);

        for (int i = 0; i < 20; i++) {
            Collections.shuffle(files, random);
            assertEquals(expected, classifier.classifyFolders(files));
        }
    }

    @Test
    void whenClassifying_givenEmptyInput_shouldReturnEmptyClassification() {
        assertTrue(classifier.classifyFolders(List.of()).isEmpty());
    }

    @Test
    void whenQueryingRoles_givenClassification_shouldListFoldersInNameOrder() {
        final FolderClassification result = classifier.classifyFolders(
                List.of(FileRecord.of("server/a.py", "x"),
                        FileRecord.of("api/b.py", "x"),
                        FileRecord.of("docs/c.md", "x")));

        assertEquals(List.of("api", "server"),
                result.foldersWith(FolderRole.BACKEND));
        assertTrue(result.hasRole(FolderRole.DOCS));
        assertEquals(3, result.size());
    }

}
