package co.fanki.repoanalyzer.analysis.domain.graph;

import co.fanki.repoanalyzer.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rich domain object representing the file-level dependency graph of a
 * repository snapshot.
 *
 * <p>Nodes are file paths. An edge {@code a -> b} means file {@code a}
 * imports something that resolved to file {@code b}. Both directions are
 * indexed so that upstream and downstream queries are symmetric: {@code b}
 * is upstream of {@code a} exactly when {@code a} is downstream of
 * {@code b}.</p>
 *
 * <p>Self-loops are never stored. Query results are sorted ascending so
 * that two graphs built from the same files compare equal regardless of
 * input order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** All file paths seen, in insertion order. */
    private final Set<String> nodes;

    /** Maps a file to the files it imports (outgoing edges). */
    private final Map<String, Set<String>> edges;

    /** Maps a file to the files importing it (incoming edges). */
    private final Map<String, Set<String>> reverseEdges;

    /**
     * Creates an empty dependency graph.
     */
    public DependencyGraph() {
        this.nodes = new LinkedHashSet<>();
        this.edges = new HashMap<>();
        this.reverseEdges = new HashMap<>();
    }

    /**
     * Adds a node to the graph. Adding an existing node is a no-op.
     *
     * @param path the file path
     */
    public void addNode(final String path) {
        Preconditions.requireNonBlank(path, "Node path is required");
        nodes.add(path);
    }

    /**
     * Adds an import edge, registering both endpoints as nodes.
     *
     * <p>An edge from a file to itself is ignored.</p>
     *
     * @param from the importing file
     * @param to the imported file
     */
    public void addEdge(final String from, final String to) {
        Preconditions.requireNonBlank(from, "From path is required");
        Preconditions.requireNonBlank(to, "To path is required");

        if (from.equals(to)) {
            return;
        }

        nodes.add(from);
        nodes.add(to);
        edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        reverseEdges.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
    }

    /**
     * Returns the files the given file imports.
     *
     * @param path the file to query
     * @return sorted unmodifiable list, empty for unknown files
     */
    public List<String> upstream(final String path) {
        return sorted(edges.get(path));
    }

    /**
     * Returns the files that import the given file.
     *
     * @param path the file to query
     * @return sorted unmodifiable list, empty for unknown files
     */
    public List<String> downstream(final String path) {
        return sorted(reverseEdges.get(path));
    }

    /**
     * Returns every node of the graph.
     *
     * @return sorted unmodifiable list of file paths
     */
    public List<String> nodes() {
        return sorted(nodes);
    }

    /**
     * Checks if the given file is a node of this graph.
     *
     * @param path the file path
     * @return true if the file is a node
     */
    public boolean contains(final String path) {
        return nodes.contains(path);
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of distinct edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        int count = 0;
        for (final Set<String> targets : edges.values()) {
            count += targets.size();
        }
        return count;
    }

    /**
     * Returns the adjacency of every file with outgoing edges.
     *
     * @return sorted map of file to its sorted upstream list
     */
    public Map<String, List<String>> adjacency() {
        final Map<String, List<String>> result = new TreeMap<>();
        for (final Map.Entry<String, Set<String>> entry : edges.entrySet()) {
            result.put(entry.getKey(), sorted(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Builds the JSON tree of this graph.
     *
     * <p>Shape: {@code {"nodes": [...], "edges": {"a.py": ["b.py"]}}}.
     * Only files with outgoing edges appear under {@code edges}.</p>
     *
     * @return the JSON object
     */
    public ObjectNode toJsonNode() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode nodesArray = root.putArray("nodes");
        nodes().forEach(nodesArray::add);

        final ObjectNode edgesObj = root.putObject("edges");
        for (final Map.Entry<String, List<String>> entry
                : adjacency().entrySet()) {
            final ArrayNode targets = edgesObj.putArray(entry.getKey());
            entry.getValue().forEach(targets::add);
        }
        return root;
    }

    /**
     * Serializes this graph to a JSON string.
     *
     * @return the JSON representation
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (final JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize DependencyGraph",
                    e);
        }
    }

    /**
     * Deserializes a graph from its JSON string.
     *
     * @param json the JSON representation
     * @return the rebuilt graph
     */
    public static DependencyGraph fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");

        try {
            final JsonNode root = MAPPER.readTree(json);
            final DependencyGraph graph = new DependencyGraph();

            final JsonNode nodesNode = root.get("nodes");
            if (nodesNode != null && nodesNode.isArray()) {
                for (final JsonNode node : nodesNode) {
                    graph.addNode(node.asText());
                }
            }

            final JsonNode edgesNode = root.get("edges");
            if (edgesNode != null && edgesNode.isObject()) {
                final var fields = edgesNode.fields();
                while (fields.hasNext()) {
                    final var entry = fields.next();
                    for (final JsonNode target : entry.getValue()) {
                        graph.addEdge(entry.getKey(), target.asText());
                    }
                }
            }
            return graph;

        } catch (final JsonProcessingException e) {
            throw new RuntimeException(
                    "Failed to deserialize DependencyGraph", e);
        }
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final DependencyGraph that = (DependencyGraph) obj;
        return nodes.equals(that.nodes) && adjacency().equals(that.adjacency());
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + adjacency().hashCode();
    }

    @Override
    public String toString() {
        return "DependencyGraph{nodes=" + nodes.size()
                + ", edges=" + edgeCount() + "}";
    }

    private static List<String> sorted(final Set<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        final List<String> result = new ArrayList<>(values);
        Collections.sort(result);
        return Collections.unmodifiableList(result);
    }

}
