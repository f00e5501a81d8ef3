package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

import java.util.List;

/**
 * Thrown when a configuration source can not be loaded, or its paths or
 * values can not be substituted.
 */
public final class ImportResolutionException extends ConfigGraphException {

    private final String entryName;

    public ImportResolutionException(String entryName, String message) {
        super(ErrorType.IMPORT_RESOLUTION, message(entryName, message));
        this.entryName = entryName;
    }

    public ImportResolutionException(String entryName, String message, Throwable cause) {
        super(ErrorType.IMPORT_RESOLUTION, message(entryName, message), cause);
        this.entryName = entryName;
    }

    public ImportResolutionException(String entryName, String message, List<String> path) {
        super(ErrorType.IMPORT_RESOLUTION, message(entryName, message), path, null);
        this.entryName = entryName;
    }

    private static String message(String entryName, String message) {
        return entryName == null ? message : "Import '" + entryName + "': " + message;
    }

    public String getEntryName() {
        return entryName;
    }
}
