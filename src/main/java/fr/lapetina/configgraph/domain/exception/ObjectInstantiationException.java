package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

import java.util.List;

/**
 * Wraps a failure raised while constructing a section's target type.
 */
public final class ObjectInstantiationException extends ConfigGraphException {

    private final String sectionName;
    private final String provenance;

    public ObjectInstantiationException(String sectionName, String provenance, String message,
                                        List<String> path, Throwable cause) {
        super(ErrorType.INSTANTIATION, "Can not create '" + sectionName + "' from "
                + provenance + ": " + message, path, cause);
        this.sectionName = sectionName;
        this.provenance = provenance;
    }

    public String getSectionName() {
        return sectionName;
    }

    public String getProvenance() {
        return provenance;
    }
}
