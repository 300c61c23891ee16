package co.fanki.repoanalyzer.analysis.domain;

import co.fanki.repoanalyzer.analysis.domain.stack.StackRules;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderClassification;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderRole;

import java.util.List;

/**
 * Coarse architecture label of a repository.
 *
 * <p>Inferred from folder roles and detected frameworks. The constants
 * are listed in evaluation order; the first one whose condition holds
 * wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ArchitecturePattern {

    /**
     * Frontend and backend folders with a component UI framework.
     */
    FULL_STACK("Full-stack web application (Frontend + Backend)"),

    /**
     * Frontend and backend folders otherwise.
     */
    CLIENT_SERVER("Client-Server architecture"),

    /**
     * Backend and database folders with a server-side web framework.
     */
    BACKEND_API_WITH_DATABASE("Backend API service with database"),

    /**
     * Backend and database folders otherwise.
     */
    BACKEND_APPLICATION("Backend application"),

    /**
     * Backend folder with a server-side web framework.
     */
    WEB_API("Web API/Microservice"),

    /**
     * Frontend folder only.
     */
    FRONTEND_APPLICATION("Frontend application"),

    /**
     * A machine learning library is in use.
     */
    MACHINE_LEARNING("Machine Learning / Data Science project"),

    /**
     * Nothing more specific applies.
     */
    MODULAR("Modular application");

    /** Component UI frameworks that make a full-stack application. */
    private static final List<String> COMPONENT_UI = List.of(
            "React", "Vue", "Angular");

    private final String description;

    ArchitecturePattern(final String theDescription) {
        this.description = theDescription;
    }

    /**
     * Returns the human-readable label of this pattern.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Infers the architecture pattern of a repository.
     *
     * @param folders the folder classification
     * @param frameworks the detected framework names
     * @return the first matching pattern, {@link #MODULAR} as fallback
     */
    public static ArchitecturePattern infer(
            final FolderClassification folders,
            final List<String> frameworks) {

        final boolean frontend = folders.hasRole(FolderRole.FRONTEND);
        final boolean backend = folders.hasRole(FolderRole.BACKEND);
        final boolean database = folders.hasRole(FolderRole.DATABASE);
        final boolean web = containsAny(frameworks,
                StackRules.WEB_FRAMEWORKS);

        if (frontend && backend) {
            return containsAny(frameworks, COMPONENT_UI)
                    ? FULL_STACK : CLIENT_SERVER;
        }
        if (backend && database) {
            return web ? BACKEND_API_WITH_DATABASE : BACKEND_APPLICATION;
        }
        if (backend && web) {
            return WEB_API;
        }
        if (frontend) {
            return FRONTEND_APPLICATION;
        }
        if (containsAny(frameworks, StackRules.ML_FRAMEWORKS)) {
            return MACHINE_LEARNING;
        }
        return MODULAR;
    }

    private static boolean containsAny(final List<String> detected,
            final List<String> wanted) {
        return wanted.stream().anyMatch(detected::contains);
    }

}
