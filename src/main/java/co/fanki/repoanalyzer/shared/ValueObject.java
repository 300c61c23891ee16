package co.fanki.repoanalyzer.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the analysis model.
 *
 * <p>Value objects are immutable and compared by their attributes, never
 * by identity. Implementations validate their state in the constructor
 * and override equals() and hashCode() over all attributes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
