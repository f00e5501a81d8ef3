package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

/**
 * Thrown when a directive prefix is recognized but its parameter syntax
 * cannot be parsed. The directive parser recovers from it by returning the
 * literal string.
 */
public final class MalformedDirectiveException extends ConfigGraphException {

    private final String rawValue;

    public MalformedDirectiveException(String rawValue, String reason) {
        super(ErrorType.MALFORMED_DIRECTIVE, "Malformed directive '" + rawValue + "': " + reason);
        this.rawValue = rawValue;
    }

    public MalformedDirectiveException(String rawValue, String reason, Throwable cause) {
        super(ErrorType.MALFORMED_DIRECTIVE, "Malformed directive '" + rawValue + "': " + reason, cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
