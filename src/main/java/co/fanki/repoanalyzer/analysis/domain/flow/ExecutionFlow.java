package co.fanki.repoanalyzer.analysis.domain.flow;

import co.fanki.repoanalyzer.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered stages of a repository plus the connections between them.
 *
 * <p>Stage ids are unique. A connection may only reference stages that
 * were added before it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExecutionFlow {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Stage> stages = new ArrayList<>();

    private final List<Connection> connections = new ArrayList<>();

    /**
     * Appends a stage.
     *
     * @param stage the stage
     * @throws IllegalArgumentException if a stage with the same id exists
     */
    public void addStage(final Stage stage) {
        Preconditions.requireNonNull(stage, "Stage is required");
        Preconditions.require(stage(stage.id()).isEmpty(),
                "Duplicate stage id: " + stage.id());
        stages.add(stage);
    }

    /**
     * Appends a connection between two existing stages.
     *
     * @param from the source stage id
     * @param to the target stage id
     * @param label the relationship label
     * @throws IllegalArgumentException if either stage is unknown
     */
    public void connect(final String from, final String to,
            final String label) {
        Preconditions.require(stage(from).isPresent(),
                "Unknown source stage: " + from);
        Preconditions.require(stage(to).isPresent(),
                "Unknown target stage: " + to);
        connections.add(new Connection(from, to, label));
    }

    /**
     * Finds a stage by id.
     *
     * @param id the stage id
     * @return the stage, if present
     */
    public Optional<Stage> stage(final String id) {
        return stages.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    /**
     * Checks whether a stage with the given id exists.
     *
     * @param id the stage id
     * @return true if present
     */
    public boolean hasStage(final String id) {
        return stage(id).isPresent();
    }

    /**
     * Returns the stages of this flow.
     *
     * @return the stages, in insertion order
     */
    public List<Stage> stages() {
        return Collections.unmodifiableList(stages);
    }

    /**
     * Returns the connections between stages.
     *
     * @return the connections, in insertion order
     */
    public List<Connection> connections() {
        return Collections.unmodifiableList(connections);
    }

    /**
     * Builds the JSON tree of this flow.
     *
     * @return {@code {"stages": [...], "connections": [...]}}
     */
    public ObjectNode toJsonNode() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode stagesArray = root.putArray("stages");
        for (final Stage stage : stages) {
            final ObjectNode stageObj = stagesArray.addObject();
            stageObj.put("id", stage.id());
            stageObj.put("type", stage.type().value());
            final ArrayNode components = stageObj.putArray("components");
            stage.components().forEach(components::add);
            stageObj.put("description", stage.description());
        }

        final ArrayNode connectionsArray = root.putArray("connections");
        for (final Connection connection : connections) {
            final ObjectNode connObj = connectionsArray.addObject();
            connObj.put("from", connection.from());
            connObj.put("to", connection.to());
            connObj.put("label", connection.label());
        }
        return root;
    }

    /**
     * Serializes this flow to a JSON string.
     *
     * @return the JSON representation
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (final JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize ExecutionFlow", e);
        }
    }

}
