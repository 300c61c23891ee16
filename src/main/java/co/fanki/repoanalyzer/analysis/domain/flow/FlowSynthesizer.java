package co.fanki.repoanalyzer.analysis.domain.flow;

import co.fanki.repoanalyzer.analysis.domain.AnalysisSettings;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.EntryPointSet;
import co.fanki.repoanalyzer.analysis.domain.stack.StackRules;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderClassification;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderRole;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesizes a layered execution flow from the other detectors' output.
 *
 * <p>Stages are considered in a fixed order: entry, frontend, backend,
 * middleware, database, external. Each is added only when it has
 * components, and each connection only when both ends exist. A stage
 * absent from the flow never appears in a connection.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowSynthesizer.class);

    static final String ENTRY = "entry";
    static final String FRONTEND = "frontend";
    static final String BACKEND = "backend";
    static final String MIDDLEWARE = "middleware";
    static final String DATABASE = "database";
    static final String EXTERNAL = "external";

    static final String CONTAINER_ORCHESTRATION = "Container orchestration";
    static final String REDIS_SERVICE = "Redis (caching/queue)";
    static final String ELASTICSEARCH_SERVICE = "Elasticsearch (search)";

    private final AnalysisSettings settings;

    /**
     * Creates a flow synthesizer.
     *
     * @param theSettings the analysis settings
     */
    public FlowSynthesizer(final AnalysisSettings theSettings) {
        this.settings = Preconditions.requireNonNull(theSettings,
                "Settings are required");
    }

    /**
     * Synthesizes the execution flow.
     *
     * @param entrypoints the discovered entry points
     * @param folders the folder classification
     * @param frameworks detected framework names
     * @param databases detected data store names
     * @param infrastructure detected infrastructure tool names
     * @return the execution flow, without stages when nothing applies
     */
    public ExecutionFlow synthesize(final EntryPointSet entrypoints,
            final FolderClassification folders,
            final List<String> frameworks,
            final List<String> databases,
            final List<String> infrastructure) {

        Preconditions.requireNonNull(entrypoints, "Entry points are required");
        Preconditions.requireNonNull(folders, "Folders are required");
        Preconditions.requireNonNull(frameworks, "Frameworks are required");
        Preconditions.requireNonNull(databases, "Databases are required");
        Preconditions.requireNonNull(infrastructure,
                "Infrastructure is required");

        final ExecutionFlow flow = new ExecutionFlow();

        addEntryStage(flow, entrypoints);
        addFrontendStage(flow, folders, frameworks);
        addBackendStage(flow, folders);
        addMiddlewareStage(flow, folders);
        addDatabaseStage(flow, folders, databases);
        addExternalStage(flow, databases, infrastructure);

        LOG.info("Execution flow synthesized: {} stages, {} connections",
                flow.stages().size(), flow.connections().size());

        return flow;
    }

    private void addEntryStage(final ExecutionFlow flow,
            final EntryPointSet entrypoints) {
        final List<String> entries = entrypoints.entryPaths();
        if (entries.isEmpty()) {
            return;
        }
        final int limit = Math.min(entries.size(),
                settings.maxEntryComponents());
        flow.addStage(new Stage(ENTRY, StageType.ENTRY_POINT,
                entries.subList(0, limit), "Application entry points"));
    }

    private void addFrontendStage(final ExecutionFlow flow,
            final FolderClassification folders,
            final List<String> frameworks) {
        final List<String> frontend = folders.foldersWith(FolderRole.FRONTEND);
        if (frontend.isEmpty()) {
            return;
        }
        flow.addStage(new Stage(FRONTEND, StageType.FRONTEND, frontend,
                "Frontend/UI layer"));

        if (flow.hasStage(ENTRY)
                && containsAny(frameworks, StackRules.UI_FRAMEWORKS)) {
            flow.connect(ENTRY, FRONTEND, "Renders UI");
        }
    }

    private void addBackendStage(final ExecutionFlow flow,
            final FolderClassification folders) {
        final List<String> backend = folders.foldersWith(FolderRole.BACKEND);
        if (backend.isEmpty()) {
            return;
        }
        flow.addStage(new Stage(BACKEND, StageType.BACKEND, backend,
                "Backend services and APIs"));

        if (flow.hasStage(FRONTEND)) {
            flow.connect(FRONTEND, BACKEND, "API calls");
        } else if (flow.hasStage(ENTRY)) {
            flow.connect(ENTRY, BACKEND, "Processes requests");
        }
    }

    private void addMiddlewareStage(final ExecutionFlow flow,
            final FolderClassification folders) {
        final List<String> middleware = folders.foldersWith(
                FolderRole.SCRIPTS);
        if (middleware.size() < settings.minMiddlewareFolders()) {
            return;
        }
        flow.addStage(new Stage(MIDDLEWARE, StageType.MIDDLEWARE, middleware,
                "Middleware and utilities"));

        if (flow.hasStage(BACKEND)) {
            flow.connect(BACKEND, MIDDLEWARE, "Uses utilities");
        }
    }

    private void addDatabaseStage(final ExecutionFlow flow,
            final FolderClassification folders,
            final List<String> databases) {
        final List<String> components = new ArrayList<>(
                folders.foldersWith(FolderRole.DATABASE));
        components.addAll(databases);
        if (components.isEmpty()) {
            return;
        }
        flow.addStage(new Stage(DATABASE, StageType.DATABASE, components,
                "Data persistence layer"));

        if (flow.hasStage(BACKEND)) {
            flow.connect(BACKEND, DATABASE, "Data operations");
        } else if (flow.hasStage(ENTRY)) {
            flow.connect(ENTRY, DATABASE, "Data operations");
        }
    }

    private void addExternalStage(final ExecutionFlow flow,
            final List<String> databases,
            final List<String> infrastructure) {
        final List<String> services = new ArrayList<>();
        if (containsAny(infrastructure, StackRules.CONTAINER_TOOLS)) {
            services.add(CONTAINER_ORCHESTRATION);
        }
        if (databases.contains(StackRules.REDIS)) {
            services.add(REDIS_SERVICE);
        }
        if (databases.contains(StackRules.ELASTICSEARCH)) {
            services.add(ELASTICSEARCH_SERVICE);
        }
        if (services.isEmpty()) {
            return;
        }
        flow.addStage(new Stage(EXTERNAL, StageType.EXTERNAL_SERVICES,
                services, "External services and infrastructure"));

        if (flow.hasStage(BACKEND)) {
            flow.connect(BACKEND, EXTERNAL, "External calls");
        }
    }

    private static boolean containsAny(final List<String> detected,
            final List<String> wanted) {
        for (final String name : wanted) {
            if (detected.contains(name)) {
                return true;
            }
        }
        return false;
    }

}
