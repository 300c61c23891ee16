package co.fanki.repoanalyzer.analysis.domain.flow;

/**
 * Kinds of execution flow stage.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum StageType {

    ENTRY_POINT("entry_point"),
    FRONTEND("frontend"),
    BACKEND("backend"),
    MIDDLEWARE("middleware"),
    DATABASE("database"),
    EXTERNAL_SERVICES("external_services");

    private final String value;

    StageType(final String theValue) {
        this.value = theValue;
    }

    /**
     * Returns the wire name of this stage type.
     *
     * @return the snake-case value
     */
    public String value() {
        return value;
    }

}
