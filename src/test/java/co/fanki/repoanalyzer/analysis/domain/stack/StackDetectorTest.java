package co.fanki.repoanalyzer.analysis.domain.stack;

import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for StackDetector.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StackDetectorTest {

    private final StackDetector detector = new StackDetector();

    // -- frameworks --------------------------------------------------------

    @Test
    void whenDetectingFrameworks_givenFlaskAppAndRequirements_shouldFindFlask() {
        final List<String> frameworks = detector.detectFrameworks(List.of(
                FileRecord.of("src/app.py",
                        "from flask import Flask\napp.run()\n"),
                FileRecord.of("requirements.txt", "flask==2.0\n")));

        assertTrue(frameworks.contains("Flask"));
    }

    @Test
    void whenDetectingFrameworks_givenRequirementsOnly_shouldMatchIgnoringCase() {
        final List<String> frameworks = detector.detectFrameworks(List.of(
                FileRecord.of("requirements.txt", "FastAPI==0.110\n")));

        assertTrue(frameworks.contains("FastAPI"));
    }

    @Test
    void whenDetectingFrameworks_givenQuotedPackageJsonDependency_shouldMatch() {
        final List<String> frameworks = detector.detectFrameworks(List.of(
                FileRecord.of("package.json",
                        "{\"devDependencies\": {\"svelte\": \"^4.0.0\"}}")));

        assertEquals(List.of("Svelte"), frameworks);
    }

    @Test
    void whenDetectingFrameworks_givenUnquotedMentionInPackageJson_shouldNotMatch() {
        final List<String> frameworks = detector.detectFrameworks(List.of(
                FileRecord.of("package.json",
                        "{\"description\": \"ported from svelte\"}")));

        assertFalse(frameworks.contains("Svelte"));
    }

    @Test
    void whenDetectingFrameworks_givenSeveralHits_shouldReturnSortedNames() {
        final List<String> frameworks = detector.detectFrameworks(List.of(
                FileRecord.of("web/App.jsx", "import React from 'react';"),
                FileRecord.of("api/server.js",
                        "const express = require('express');")));

        assertEquals(List.of("Express", "React"), frameworks);
    }

    @Test
    void whenDetectingFrameworks_givenConventionalFileName_shouldMatchByPath() {
        final List<String> frameworks = detector.detectFrameworks(List.of(
                FileRecord.of("web/next.config.js", "")));

        assertEquals(List.of("Next.js"), frameworks);
    }

    // -- databases ---------------------------------------------------------

    @Test
    void whenDetectingDatabases_givenConnectionString_shouldFindStore() {
        final List<String> databases = detector.detectDatabases(List.of(
                FileRecord.of(".env", "DATABASE_URL=postgres://db/app\n")));

        assertEquals(List.of("PostgreSQL"), databases);
    }

    @Test
    void whenDetectingDatabases_givenUpperCaseConnectionString_shouldNotMatch() {
        final List<String> databases = detector.detectDatabases(List.of(
                FileRecord.of(".env", "DATABASE_URL=POSTGRES://DB/APP\n")));

        assertTrue(databases.isEmpty());
    }

    @Test
    void whenDetectingDatabases_givenDatabaseFile_shouldMatchByExtension() {
        final List<String> databases = detector.detectDatabases(List.of(
                FileRecord.of("data/app.sqlite3", "")));

        assertEquals(List.of("SQLite"), databases);
    }

    @Test
    void whenDetectingDatabases_givenCacheClient_shouldFindRedis() {
        final List<String> databases = detector.detectDatabases(List.of(
                FileRecord.of("worker/queue.py", "import redis\n")));

        assertEquals(List.of(StackRules.REDIS), databases);
    }

    // -- infrastructure ----------------------------------------------------

    @Test
    void whenDetectingInfrastructure_givenDockerfileAndWorkflow_shouldFindBoth() {
        final List<String> infrastructure = detector.detectInfrastructure(
                List.of(FileRecord.of("Dockerfile", "FROM python:3.12"),
                        FileRecord.of(".github/workflows/ci.yml",
                                "on: push")));

        assertEquals(List.of("Docker", "GitHub Actions"), infrastructure);
    }

    @Test
    void whenDetectingInfrastructure_givenManifestYaml_shouldFindKubernetes() {
        final List<String> infrastructure = detector.detectInfrastructure(
                List.of(FileRecord.of("ops/app.yaml",
                        "apiVersion: apps/v1\nkind: Deployment\n")));

        assertEquals(List.of("Kubernetes"), infrastructure);
    }

    @Test
    void whenDetectingInfrastructure_givenPlainYaml_shouldNotFindKubernetes() {
        final List<String> infrastructure = detector.detectInfrastructure(
                List.of(FileRecord.of("settings/app.yaml", "debug: true\n")));

        assertTrue(infrastructure.isEmpty());
    }

    // -- generic evaluation ------------------------------------------------

    @Test
    void whenEvaluating_givenCustomRule_shouldApplyTheSameMatcher() {
        final DetectionRule rule = DetectionRule.named("Celery")
                .imports("from celery")
                .dependencies("celery");

        final List<String> detected = detector.evaluate("workers",
                List.of(rule), List.of(
                        FileRecord.of("pyproject.toml",
                                "[project]\ndependencies = [\"Celery\"]")));

        assertEquals(List.of("Celery"), detected);
    }

    @Test
    void whenDetecting_givenEmptyInput_shouldReturnEmptyLists() {
        assertTrue(detector.detectFrameworks(List.of()).isEmpty());
        assertTrue(detector.detectDatabases(List.of()).isEmpty());
        assertTrue(detector.detectInfrastructure(List.of()).isEmpty());
    }

}
