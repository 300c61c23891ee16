package co.fanki.repoanalyzer.analysis.domain.entrypoint;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for EntryPointFinder.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EntryPointFinderTest {

    private final EntryPointFinder finder = new EntryPointFinder();

    // -- application files -------------------------------------------------

    @Test
    void whenFinding_givenConventionalNames_shouldReportLanguage() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("cmd/api/main.go", "package main"),
                FileRecord.of("web/index.ts", ""),
                FileRecord.of("src/Application.java", "class Application {}"),
                FileRecord.of("src/helpers.py", "")));

        assertEquals(List.of(
                new ApplicationEntry("cmd/api/main.go", "Go", "main.go"),
                new ApplicationEntry("web/index.ts", "TypeScript", "index.ts"),
                new ApplicationEntry("src/Application.java", "Java",
                        "Application.java")),
                result.applicationFiles());
    }

    @Test
    void whenFinding_givenDifferentCase_shouldNotMatchFileName() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("Main.py", "")));

        assertTrue(result.applicationFiles().isEmpty());
    }

    // -- framework bootstraps ----------------------------------------------

    @Test
    void whenFinding_givenFlaskApp_shouldReportFrameworkEntry() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("src/app.py",
                        "from flask import Flask\napp.run()\n")));

        assertEquals(List.of(new FrameworkEntry("src/app.py", "Flask")),
                result.frameworkEntrypoints());
        assertEquals(List.of(new ApplicationEntry("src/app.py", "Python",
                "app.py")), result.applicationFiles());
    }

    @Test
    void whenFinding_givenFastApiDecorators_shouldReportFastApi() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("service/api.py",
                        "app = FastAPI()\n\n@app.get('/items')\ndef items():\n")));

        assertEquals(List.of(new FrameworkEntry("service/api.py", "FastAPI")),
                result.frameworkEntrypoints());
    }

    @Test
    void whenFinding_givenDifferentCaseInContent_shouldStillMatch() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("server/boot.js", "const app = EXPRESS();")));

        assertEquals("Express",
                result.frameworkEntrypoints().get(0).framework());
    }

    @Test
    void whenFinding_givenFileMatchingTwoFrameworks_shouldKeepFirst() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("server/odd.py",
                        "app.run(debug=True)\napp.listen(3000)\n")));

        assertEquals(List.of(new FrameworkEntry("server/odd.py", "Flask")),
                result.frameworkEntrypoints());
    }

    @Test
    void whenFinding_givenNestBootstrap_shouldReportNest() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("src/main.ts",
                        "const app = await NestFactory.create(AppModule);")));

        assertEquals(List.of(new FrameworkEntry("src/main.ts", "NestJS")),
                result.frameworkEntrypoints());
    }

    // -- docker ------------------------------------------------------------

    @Test
    void whenFinding_givenDockerfile_shouldCaptureEveryDirective() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("Dockerfile", "FROM python:3.12\n"
                        + "  ENTRYPOINT [\"python\"]\n"
                        + "CMD [\"app.py\"]\n"
                        + "CMD [\"app.py\"]\n")));

        assertEquals(List.of(
                new DockerEntry("Dockerfile", "ENTRYPOINT [\"python\"]"),
                new DockerEntry("Dockerfile", "CMD [\"app.py\"]"),
                new DockerEntry("Dockerfile", "CMD [\"app.py\"]")),
                result.dockerEntrypoints());
    }

    @Test
    void whenFinding_givenVariantDockerfilePath_shouldInspectIt() {
        final EntryPointSet result = finder.findEntrypoints(List.of(
                FileRecord.of("deploy/Dockerfile.prod", "CMD node server.js"),
                FileRecord.of("deploy/run.sh", "CMD ignored")));

        assertEquals(List.of(new DockerEntry("deploy/Dockerfile.prod",
                "CMD node server.js")), result.dockerEntrypoints());
    }

    // -- set ---------------------------------------------------------------

    @Test
    void whenBuildingSet_givenRepeatedPaths_shouldKeepFirstRecord() {
        final EntryPointSet set = new EntryPointSet(
                List.of(new ApplicationEntry("app.py", "Python", "app.py"),
                        new ApplicationEntry("app.py", "Other", "app.py")),
                List.of(new FrameworkEntry("app.py", "Flask"),
                        new FrameworkEntry("app.py", "FastAPI")),
                List.of());

        assertEquals("Python", set.applicationFiles().get(0).type());
        assertEquals(1, set.applicationFiles().size());
        assertEquals(List.of(new FrameworkEntry("app.py", "Flask")),
                set.frameworkEntrypoints());
        assertEquals(List.of("app.py", "app.py"), set.entryPaths());
        assertEquals(2, set.total());
    }

    @Test
    void whenFinding_givenEmptyInput_shouldReturnEmptySet() {
        final EntryPointSet result = finder.findEntrypoints(List.of());

        assertFalse(result.hasEntries());
        assertTrue(result.dockerEntrypoints().isEmpty());
    }

}
