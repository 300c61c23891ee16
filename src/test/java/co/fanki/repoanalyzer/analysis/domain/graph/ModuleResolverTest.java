package co.fanki.repoanalyzer.analysis.domain.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for ModuleResolver.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ModuleResolverTest {

    private final List<String> paths = List.of(
            "README", "pkg/models.py", "pkg/models_test.py", "web/index.js");

    @Test
    void whenNormalizing_givenPaths_shouldDropExtensionAndUseDots() {
        assertEquals("pkg.models", ModuleResolver.normalize("pkg/models.py"));
        assertEquals("README", ModuleResolver.normalize("README"));
        assertEquals("a.b.c.tar", ModuleResolver.normalize("a/b/c.tar.gz"));
    }

    @Test
    void whenResolving_givenExactPath_shouldReturnIt() {
        final ModuleResolver resolver = new ModuleResolver(paths, true);

        assertEquals(Optional.of("web/index.js"),
                resolver.resolve("web/index.js"));
    }

    @Test
    void whenResolving_givenDottedModule_shouldReturnNormalizedMatch() {
        final ModuleResolver resolver = new ModuleResolver(paths, true);

        assertEquals(Optional.of("pkg/models.py"),
                resolver.resolve("pkg.models"));
    }

    @Test
    void whenResolving_givenFragment_shouldReturnFirstContainingPath() {
        final ModuleResolver resolver = new ModuleResolver(paths, true);

        assertEquals(Optional.of("pkg/models.py"), resolver.resolve("models"));
    }

    @Test
    void whenResolving_givenFragmentWithoutPartialMatch_shouldBeEmpty() {
        final ModuleResolver resolver = new ModuleResolver(paths, false);

        assertEquals(Optional.empty(), resolver.resolve("models"));
    }

    @Test
    void whenResolving_givenNoMatch_shouldBeEmpty() {
        final ModuleResolver resolver = new ModuleResolver(paths, true);

        assertEquals(Optional.empty(), resolver.resolve("numpy"));
        assertEquals(Optional.empty(), resolver.resolve(""));
    }

}
