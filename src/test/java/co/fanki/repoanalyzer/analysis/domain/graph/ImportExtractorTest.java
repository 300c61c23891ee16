package co.fanki.repoanalyzer.analysis.domain.graph;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the Python and JavaScript import extractors.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImportExtractorTest {

    private final PythonImportExtractor python = new PythonImportExtractor();

    private final JavaScriptImportExtractor javascript =
            new JavaScriptImportExtractor();

    // -- python ------------------------------------------------------------

    @Test
    void whenExtracting_givenPythonImports_shouldKeepTopLevelModules() {
        final FileRecord file = FileRecord.of("svc/app.py", String.join("\n",
                "import os.path",
                "from pkg.sub import thing",
                "    import json",
                "from . import sibling",
                "import os",
                "x = 'import fake'"));

        assertEquals(Set.of("os", "pkg", "json"), python.extract(file));
    }

    @Test
    void whenExtracting_givenNonAsciiModuleNames_shouldKeepWholeName() {
        final FileRecord file = FileRecord.of("main.py", String.join("\n",
                "import módulo",
                "from café.menu import plato"));

        assertEquals(Set.of("módulo", "café"), python.extract(file));
    }

    @Test
    void whenCheckingSupport_givenPythonExtractor_shouldOnlyTakePyFiles() {
        assertTrue(python.supports(FileRecord.of("a.py", "")));
        assertFalse(python.supports(FileRecord.of("a.pyc", "")));
    }

    // -- javascript --------------------------------------------------------

    @Test
    void whenExtracting_givenJavaScriptImports_shouldKeepBarePackages() {
        final FileRecord file = FileRecord.of("web/app.tsx", String.join("\n",
                "import React from 'react';",
                "import { map } from \"lodash/fp\";",
                "const x = require('express');",
                "const lazy = import('@scope/pkg/deep');",
                "import local from './local';",
                "const abs = require('/opt/lib');"));

        assertEquals(Set.of("react", "lodash", "express", "@scope/pkg"),
                javascript.extract(file));
    }

    @Test
    void whenReducingSpecifier_givenScopeOnly_shouldKeepIt() {
        assertEquals("@scope", JavaScriptImportExtractor.packageOf("@scope"));
        assertEquals("@a/b", JavaScriptImportExtractor.packageOf("@a/b/c"));
        assertEquals("lodash", JavaScriptImportExtractor.packageOf("lodash/fp"));
    }

    @Test
    void whenCheckingSupport_givenJavaScriptExtractor_shouldTakeAllFlavours() {
        assertTrue(javascript.supports(FileRecord.of("a.js", "")));
        assertTrue(javascript.supports(FileRecord.of("a.jsx", "")));
        assertTrue(javascript.supports(FileRecord.of("a.ts", "")));
        assertTrue(javascript.supports(FileRecord.of("a.tsx", "")));
        assertFalse(javascript.supports(FileRecord.of("a.mjs", "")));
    }

}
