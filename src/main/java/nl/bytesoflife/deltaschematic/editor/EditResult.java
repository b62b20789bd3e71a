package nl.bytesoflife.deltaschematic.editor;

import nl.bytesoflife.deltaschematic.ErrorKind;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one editor request. Failures carry the {@link ErrorKind} of the exception that
 * aborted the request.
 */
public class EditResult {

    private final boolean success;
    private final String message;
    private final ErrorKind errorKind;
    private final Map<String, Object> details = new LinkedHashMap<>();
    private String filePath;

    private EditResult(boolean success, String message, ErrorKind errorKind) {
        this.success = success;
        this.message = message;
        this.errorKind = errorKind;
    }

    public static EditResult ok(String message) {
        return new EditResult(true, message, null);
    }

    public static EditResult failure(ErrorKind kind, String message) {
        return new EditResult(false, message, kind);
    }

    public EditResult withDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public EditResult withFilePath(Path path) {
        this.filePath = path == null ? null : path.toString();
        return this;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getFilePath() {
        return filePath;
    }

    /** Null on success. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    public Object getDetail(String key) {
        return details.get(key);
    }

    @Override
    public String toString() {
        return success
                ? "EditResult[ok: " + message + "]"
                : "EditResult[" + errorKind + ": " + message + "]";
    }
}
