package nl.bytesoflife.deltaschematic.model;

/**
 * The {@code (instances (project ... (path ...)))} descriptor linking a placed symbol to
 * its project and sheet path.
 */
public record InstancePath(String projectName, String path, String reference, int unit) {
}
