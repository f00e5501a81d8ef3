package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

import java.util.List;

/**
 * Base class of all resolution failures.
 *
 * Carries the error category and, where known, the chain of sections that
 * led to the failure (outermost first).
 */
public class ConfigGraphException extends RuntimeException {

    private final ErrorType errorType;
    private final List<String> sectionPath;

    public ConfigGraphException(ErrorType errorType, String message) {
        this(errorType, message, List.of(), null);
    }

    public ConfigGraphException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, List.of(), cause);
    }

    public ConfigGraphException(ErrorType errorType, String message, List<String> sectionPath, Throwable cause) {
        super(message + formatPath(sectionPath), cause);
        this.errorType = errorType;
        this.sectionPath = sectionPath != null ? List.copyOf(sectionPath) : List.of();
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Sections being resolved when the failure occurred, outermost first.
     */
    public List<String> getSectionPath() {
        return sectionPath;
    }

    static String formatPath(List<String> path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        return " (path: " + String.join(" -> ", path) + ")";
    }
}
