package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

/**
 * Thrown when a sandboxed {@code eval:} expression can not be parsed or
 * evaluated.
 */
public final class ExpressionException extends ConfigGraphException {

    public ExpressionException(String message) {
        super(ErrorType.EXPRESSION, message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(ErrorType.EXPRESSION, message, cause);
    }
}
