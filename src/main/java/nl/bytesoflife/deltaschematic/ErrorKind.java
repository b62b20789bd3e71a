package nl.bytesoflife.deltaschematic;

/**
 * Classifies every failure a schematic operation can report. Callers branch on the kind
 * rather than on exception types.
 */
public enum ErrorKind {
    PARSE_ERROR,
    FILE_NOT_FOUND,
    LIBRARY_NOT_FOUND,
    SYMBOL_NOT_FOUND,
    ANCHOR_NOT_FOUND,
    REFERENCE_NOT_FOUND,
    STRUCTURAL_INVARIANT_VIOLATION,
    IO_ERROR,
    INVALID_ARGUMENT;

    public boolean isNotFound() {
        return switch (this) {
            case FILE_NOT_FOUND, LIBRARY_NOT_FOUND, SYMBOL_NOT_FOUND,
                 ANCHOR_NOT_FOUND, REFERENCE_NOT_FOUND -> true;
            default -> false;
        };
    }
}
