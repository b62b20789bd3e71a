package nl.bytesoflife.deltaschematic.export;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs KiCad's command line tool to convert schematics. The conversion itself happens
 * out of process.
 */
public class SchematicExporter {

    private static final Logger log = LoggerFactory.getLogger(SchematicExporter.class);

    public static final String DEFAULT_EXECUTABLE = "kicad-cli";

    private String executable = DEFAULT_EXECUTABLE;

    public SchematicExporter withExecutable(String executable) {
        this.executable = executable;
        return this;
    }

    public String getExecutable() {
        return executable;
    }

    List<String> buildPdfCommand(Path schematic, Path output) {
        return List.of(executable, "sch", "export", "pdf", "--output", output.toString(), schematic.toString());
    }

    public ExportResult exportPdf(Path schematic, Path output) {
        if (!Files.isRegularFile(schematic)) {
            throw new SchematicException(ErrorKind.FILE_NOT_FOUND, "Schematic not found: " + schematic);
        }
        List<String> command = buildPdfCommand(schematic, output);
        log.debug("Running {}", command);

        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            String stderr = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.error("{} exited with {}: {}", executable, exitCode, stderr);
            } else {
                log.info("Exported {} to {}", schematic, output);
            }
            return new ExportResult(exitCode == 0, exitCode, stderr);
        } catch (IOException e) {
            throw new SchematicException(ErrorKind.IO_ERROR,
                    "Failed to run " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchematicException(ErrorKind.IO_ERROR, "Interrupted while running " + executable, e);
        }
    }

    public record ExportResult(boolean success, int exitCode, String message) {
    }
}
