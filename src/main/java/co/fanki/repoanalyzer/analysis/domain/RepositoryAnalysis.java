package co.fanki.repoanalyzer.analysis.domain;

import co.fanki.repoanalyzer.analysis.domain.entrypoint.ApplicationEntry;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.DockerEntry;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.EntryPointSet;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.FrameworkEntry;
import co.fanki.repoanalyzer.analysis.domain.flow.ExecutionFlow;
import co.fanki.repoanalyzer.analysis.domain.graph.DependencyGraph;
import co.fanki.repoanalyzer.analysis.domain.language.LanguageShare;
import co.fanki.repoanalyzer.analysis.domain.language.LanguageStats;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderClassification;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderInfo;
import co.fanki.repoanalyzer.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Result of one structural analysis run over a repository snapshot.
 *
 * <p>Holds the output of every detector plus the inferred architecture
 * pattern. Instances are produced by the analysis service and never
 * modified afterwards.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RepositoryAnalysis {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LanguageStats languages;

    private final List<String> frameworks;

    private final List<String> databases;

    private final List<String> infrastructure;

    private final FolderClassification folders;

    private final EntryPointSet entrypoints;

    private final DependencyGraph graph;

    private final ExecutionFlow flow;

    private final ArchitecturePattern architecturePattern;

    /**
     * Creates a repository analysis.
     *
     * @param theLanguages the language statistics
     * @param theFrameworks the sorted framework names
     * @param theDatabases the sorted data store names
     * @param theInfrastructure the sorted infrastructure tool names
     * @param theFolders the folder classification
     * @param theEntrypoints the entry points
     * @param theGraph the dependency graph
     * @param theFlow the execution flow
     * @param thePattern the inferred architecture pattern
     */
    public RepositoryAnalysis(final LanguageStats theLanguages,
            final List<String> theFrameworks,
            final List<String> theDatabases,
            final List<String> theInfrastructure,
            final FolderClassification theFolders,
            final EntryPointSet theEntrypoints,
            final DependencyGraph theGraph,
            final ExecutionFlow theFlow,
            final ArchitecturePattern thePattern) {
        this.languages = Preconditions.requireNonNull(theLanguages,
                "Language stats are required");
        this.frameworks = List.copyOf(theFrameworks);
        this.databases = List.copyOf(theDatabases);
        this.infrastructure = List.copyOf(theInfrastructure);
        this.folders = Preconditions.requireNonNull(theFolders,
                "Folders are required");
        this.entrypoints = Preconditions.requireNonNull(theEntrypoints,
                "Entry points are required");
        this.graph = Preconditions.requireNonNull(theGraph,
                "Graph is required");
        this.flow = Preconditions.requireNonNull(theFlow,
                "Flow is required");
        this.architecturePattern = Preconditions.requireNonNull(thePattern,
                "Architecture pattern is required");
    }

    /**
     * Returns the per-language statistics.
     *
     * @return the language statistics, never null
     */
    public LanguageStats languages() {
        return languages;
    }

    /**
     * Returns the detected frameworks.
     *
     * @return the framework names, sorted
     */
    public List<String> frameworks() {
        return frameworks;
    }

    /**
     * Returns the detected data stores.
     *
     * @return the database names, sorted
     */
    public List<String> databases() {
        return databases;
    }

    /**
     * Returns the detected infrastructure tools.
     *
     * @return the tool names, sorted
     */
    public List<String> infrastructure() {
        return infrastructure;
    }

    /**
     * Returns the role of every top-level folder.
     *
     * @return the folder classification
     */
    public FolderClassification folders() {
        return folders;
    }

    /**
     * Returns the entry points found in the snapshot.
     *
     * @return the entry point set
     */
    public EntryPointSet entrypoints() {
        return entrypoints;
    }

    /**
     * Returns the file dependency graph.
     *
     * @return the dependency graph
     */
    public DependencyGraph graph() {
        return graph;
    }

    /**
     * Returns the synthesized execution flow.
     *
     * @return the execution flow
     */
    public ExecutionFlow flow() {
        return flow;
    }

    /**
     * Returns the inferred architecture pattern.
     *
     * @return the architecture pattern
     */
    public ArchitecturePattern architecturePattern() {
        return architecturePattern;
    }

    /**
     * Builds the JSON tree of this analysis.
     *
     * @return the JSON object
     */
    public ObjectNode toJsonNode() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ObjectNode langObj = root.putObject("languages");
        langObj.put("total_files", languages.totalFiles());
        langObj.put("primary_language", languages.primaryLanguage());
        final ObjectNode perLanguage = langObj.putObject("languages");
        for (final Map.Entry<String, LanguageShare> entry
                : languages.languages().entrySet()) {
            final ObjectNode shareObj = perLanguage.putObject(entry.getKey());
            shareObj.put("files", entry.getValue().files());
            shareObj.put("lines", entry.getValue().lines());
            shareObj.put("percentage", entry.getValue().percentage());
        }

        putAll(root.putArray("frameworks"), frameworks);
        putAll(root.putArray("databases"), databases);
        putAll(root.putArray("infrastructure"), infrastructure);

        final ObjectNode foldersObj = root.putObject("folders");
        for (final Map.Entry<String, FolderInfo> entry
                : folders.folders().entrySet()) {
            final ObjectNode folderObj = foldersObj.putObject(entry.getKey());
            folderObj.put("role", entry.getValue().role().value());
            folderObj.put("file_count", entry.getValue().fileCount());
        }

        final ObjectNode entryObj = root.putObject("entrypoints");
        final ArrayNode applications = entryObj.putArray("application_files");
        for (final ApplicationEntry entry : entrypoints.applicationFiles()) {
            applications.addObject()
                    .put("path", entry.path())
                    .put("type", entry.type())
                    .put("filename", entry.filename());
        }
        final ArrayNode bootstraps = entryObj.putArray(
                "framework_entrypoints");
        for (final FrameworkEntry entry
                : entrypoints.frameworkEntrypoints()) {
            bootstraps.addObject()
                    .put("path", entry.path())
                    .put("framework", entry.framework());
        }
        final ArrayNode dockers = entryObj.putArray("docker_entrypoints");
        for (final DockerEntry entry : entrypoints.dockerEntrypoints()) {
            dockers.addObject()
                    .put("path", entry.path())
                    .put("command", entry.command());
        }

        root.set("dependency_graph", graph.toJsonNode());
        root.set("execution_flow", flow.toJsonNode());
        root.put("architecture_pattern", architecturePattern.description());

        final ObjectNode summary = root.putObject("summary");
        summary.put("total_files", languages.totalFiles());
        summary.put("total_folders", folders.size());
        summary.put("total_entrypoints", entrypoints.total());
        summary.put("graph_nodes", graph.nodeCount());
        summary.put("graph_edges", graph.edgeCount());

        return root;
    }

    /**
     * Serializes this analysis to a JSON string.
     *
     * @return the JSON representation
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (final JsonProcessingException e) {
            throw new RuntimeException(
                    "Failed to serialize RepositoryAnalysis", e);
        }
    }

    private static void putAll(final ArrayNode array,
            final List<String> values) {
        values.forEach(array::add);
    }

}
