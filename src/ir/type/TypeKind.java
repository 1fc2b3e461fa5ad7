package ir.type;

public enum TypeKind {
    INTEGER,
    // floating point
    HALF,
    FLOAT,
    DOUBLE,
    // others
    VOID,
    LABEL,
    METADATA,
    POINTER,
    ARRAY,
    STRUCT,
    FUNC
}
