package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

import java.util.List;

/**
 * Thrown when a directive references a section, option or type that is
 * absent from the merged configuration.
 */
public final class MissingSectionException extends ConfigGraphException {

    private final String missingName;

    public MissingSectionException(String missingName, String message, List<String> referencingChain) {
        super(ErrorType.MISSING_SECTION, message, referencingChain, null);
        this.missingName = missingName;
    }

    public static MissingSectionException section(String name, List<String> referencingChain) {
        return new MissingSectionException(name, "No such section: '" + name + "'", referencingChain);
    }

    public static MissingSectionException type(String typeId, String section, List<String> referencingChain) {
        return new MissingSectionException(typeId,
                "No registered type '" + typeId + "' for section '" + section + "'", referencingChain);
    }

    public String getMissingName() {
        return missingName;
    }
}
