package fr.lapetina.configgraph.domain.model;

/**
 * Error taxonomy for configuration resolution.
 */
public enum ErrorType {
    /** Unparsable directive syntax; recovered by falling back to the literal */
    MALFORMED_DIRECTIVE,

    /** A directive references a section or type that does not exist */
    MISSING_SECTION,

    /** A section transitively references itself while resolving */
    CYCLIC_DEPENDENCY,

    /** The target type's construction failed */
    INSTANTIATION,

    /** A configuration source could not be loaded or substituted */
    IMPORT_RESOLUTION,

    /** A sandboxed expression could not be evaluated */
    EXPRESSION
}
