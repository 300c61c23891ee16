package co.fanki.repoanalyzer.analysis.domain.flow;

import co.fanki.repoanalyzer.shared.Preconditions;

import java.util.List;

/**
 * One layer of the execution flow.
 *
 * @param id the stage identifier, unique within a flow
 * @param type the stage kind
 * @param components folder names, file paths or service labels
 * @param description a fixed human-readable description
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Stage(String id, StageType type, List<String> components,
        String description) {

    /** Validates and copies the components. */
    public Stage {
        Preconditions.requireNonBlank(id, "Stage id is required");
        Preconditions.requireNonNull(type, "Stage type is required");
        components = List.copyOf(Preconditions.requireNonNull(components,
                "Stage components are required"));
        description = description == null ? "" : description;
    }

}
