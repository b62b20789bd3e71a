package nl.bytesoflife.deltaschematic;

import nl.bytesoflife.deltaschematic.library.SymbolLibraryResolver;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared test data under src/test/resources.
 */
public final class Fixtures {

    public static final Path SCHEMATICS = Path.of("src/test/resources/schematics");
    public static final Path SYMBOLS = Path.of("src/test/resources/symbols");

    /** R1, R2 (Device:R) and C1 (Device:C), one wire, one label; both templates cached. */
    public static final Path THREE_COMPONENTS = SCHEMATICS.resolve("three_components.kicad_sch");

    public static final String PROJECT_UUID = "6f1c8d2e-3a4b-4c5d-8e9f-0a1b2c3d4e5f";

    private Fixtures() {
    }

    public static SymbolLibraryResolver resolver() {
        return new SymbolLibraryResolver(SYMBOLS);
    }

    public static SchematicDocument threeComponents() {
        return SchematicDocument.load(THREE_COMPONENTS);
    }

    public static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path copyInto(Path dir, Path fixture) {
        try {
            return Files.copy(fixture, dir.resolve(fixture.getFileName()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
