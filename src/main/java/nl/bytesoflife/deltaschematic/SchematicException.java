package nl.bytesoflife.deltaschematic;

public class SchematicException extends RuntimeException {

    private final ErrorKind kind;

    public SchematicException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchematicException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
