package co.fanki.repoanalyzer.analysis.domain.stack;

import java.util.List;

/**
 * Static rule tables for framework, data store and infrastructure
 * detection.
 *
 * <p>Import fragments are deliberately short and loose ("pg", "react"):
 * they are substring probes over whole file contents, not parsed imports,
 * and over-reporting is accepted.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StackRules {

    private StackRules() {
    }

    /** UI rendering frameworks; they decide whether entry renders UI. */
    public static final List<String> UI_FRAMEWORKS = List.of(
            "React", "Vue", "Angular", "Next.js", "Svelte");

    /** Server-side web frameworks. */
    public static final List<String> WEB_FRAMEWORKS = List.of(
            "Flask", "Django", "FastAPI", "Express");

    /** Machine learning libraries. */
    public static final List<String> ML_FRAMEWORKS = List.of(
            "PyTorch", "TensorFlow", "Scikit-learn");

    /** Container tooling that implies orchestrated external services. */
    public static final List<String> CONTAINER_TOOLS = List.of(
            "Docker", "Kubernetes");

    /** Cache and queue store. */
    public static final String REDIS = "Redis";

    /** Search index store. */
    public static final String ELASTICSEARCH = "Elasticsearch";

    /** Frameworks, backend first, then frontend, then ML. */
    public static final List<DetectionRule> FRAMEWORKS = List.of(
            // Python backend
            DetectionRule.named("Flask")
                    .imports("flask", "from flask")
                    .filenames("app.py", "wsgi.py")
                    .dependencies("flask"),
            DetectionRule.named("Django")
                    .imports("django", "from django")
                    .filenames("manage.py", "settings.py", "wsgi.py")
                    .dependencies("django"),
            DetectionRule.named("FastAPI")
                    .imports("fastapi", "from fastapi")
                    .dependencies("fastapi"),
            DetectionRule.named("Tornado")
                    .imports("tornado", "from tornado")
                    .dependencies("tornado"),

            // JavaScript backend
            DetectionRule.named("Express")
                    .imports("express", "require('express')",
                            "require(\"express\")")
                    .dependencies("express"),
            DetectionRule.named("NestJS")
                    .imports("@nestjs", "from '@nestjs")
                    .dependencies("@nestjs/core", "@nestjs/common")
                    .filenames("nest-cli.json"),
            DetectionRule.named("Koa")
                    .imports("koa", "require('koa')", "require(\"koa\")")
                    .dependencies("koa"),
            DetectionRule.named("Hapi")
                    .imports("@hapi/hapi", "require('@hapi/hapi')")
                    .dependencies("@hapi/hapi"),

            // Frontend
            DetectionRule.named("React")
                    .imports("react", "from 'react'", "from \"react\"")
                    .dependencies("react", "react-dom"),
            DetectionRule.named("Next.js")
                    .filenames("next.config.js", "next.config.ts")
                    .dependencies("next"),
            DetectionRule.named("Vue")
                    .imports("vue", "from 'vue'", "from \"vue\"")
                    .dependencies("vue")
                    .filenames("vue.config.js"),
            DetectionRule.named("Angular")
                    .imports("@angular", "from '@angular")
                    .dependencies("@angular/core")
                    .filenames("angular.json"),
            DetectionRule.named("Svelte")
                    .dependencies("svelte")
                    .filenames("svelte.config.js"),

            // ML / data science
            DetectionRule.named("PyTorch")
                    .imports("torch", "import torch", "from torch")
                    .dependencies("torch", "pytorch"),
            DetectionRule.named("TensorFlow")
                    .imports("tensorflow", "import tensorflow",
                            "from tensorflow")
                    .dependencies("tensorflow", "tensorflow-gpu"),
            DetectionRule.named("Scikit-learn")
                    .imports("sklearn", "from sklearn")
                    .dependencies("scikit-learn"));

    /** Data stores. */
    public static final List<DetectionRule> DATABASES = List.of(
            DetectionRule.named("PostgreSQL")
                    .imports("psycopg2", "asyncpg", "pg")
                    .dependencies("psycopg2", "asyncpg", "pg")
                    .config("postgres://", "postgresql://"),
            DetectionRule.named("MySQL")
                    .imports("mysql", "pymysql", "mysqlclient")
                    .dependencies("mysql", "pymysql", "mysql-connector")
                    .config("mysql://"),
            DetectionRule.named("SQLite")
                    .imports("sqlite3", "import sqlite3")
                    .dependencies("sqlite3")
                    .extensions(".db", ".sqlite", ".sqlite3"),
            DetectionRule.named("MongoDB")
                    .imports("pymongo", "mongoose", "mongodb")
                    .dependencies("pymongo", "mongoose", "mongodb")
                    .config("mongodb://"),
            DetectionRule.named(REDIS)
                    .imports("redis", "import redis", "ioredis")
                    .dependencies("redis", "ioredis")
                    .config("redis://"),
            DetectionRule.named(ELASTICSEARCH)
                    .imports("elasticsearch", "from elasticsearch")
                    .dependencies("elasticsearch", "@elastic/elasticsearch")
                    .config("elasticsearch://"));

    /** Infrastructure and delivery tooling. */
    public static final List<DetectionRule> INFRASTRUCTURE = List.of(
            DetectionRule.named("Docker")
                    .filenames("Dockerfile", "docker-compose.yml",
                            "docker-compose.yaml", ".dockerignore"),
            DetectionRule.named("Kubernetes")
                    .filenames("k8s/", "kubernetes/", "deployment.yaml",
                            "service.yaml")
                    .extensions(".yaml", ".yml")
                    .corroboratedBy("kind: Deployment", "kind: Service",
                            "apiVersion: apps/v1"),
            DetectionRule.named("GitHub Actions")
                    .filenames(".github/workflows/"),
            DetectionRule.named("GitLab CI")
                    .filenames(".gitlab-ci.yml"),
            DetectionRule.named("Terraform")
                    .filenames(".tf")
                    .extensions(".tf"));

}
