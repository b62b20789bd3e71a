package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;

/**
 * A {@code Library:Symbol} key, split at the first colon.
 */
public record LibraryId(String library, String symbol) {

    public static LibraryId parse(String libId) {
        int colon = libId == null ? -1 : libId.indexOf(':');
        if (colon <= 0 || colon == libId.length() - 1) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT,
                    "Invalid lib_id '" + libId + "', expected Library:Symbol");
        }
        return new LibraryId(libId.substring(0, colon), libId.substring(colon + 1));
    }

    @Override
    public String toString() {
        return library + ":" + symbol;
    }
}
