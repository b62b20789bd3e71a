package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.Fixtures;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SchematicTemplates;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.parser.SNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolLibraryResolverTest {

    private final SymbolLibraryResolver resolver = Fixtures.resolver();

    @Test
    void resolvesSymbolWithPins() {
        SymbolDefinition resistor = resolver.resolve("Device:R");
        assertEquals("Device:R", resistor.getLibId());
        assertEquals(List.of("1", "2"), resistor.getPinNumbers());

        SymbolDefinition ground = resolver.resolve("power:GND");
        assertEquals(List.of("1"), ground.getPinNumbers());
    }

    @Test
    void reportsMissingSymbolAndLibrary() {
        SchematicException symbol = assertThrows(SchematicException.class, () -> resolver.resolve("Device:Nope"));
        assertEquals(ErrorKind.SYMBOL_NOT_FOUND, symbol.getKind());

        SchematicException library = assertThrows(SchematicException.class, () -> resolver.resolve("Missing:R"));
        assertEquals(ErrorKind.LIBRARY_NOT_FOUND, library.getKind());
    }

    @Test
    void rejectsMalformedLibraryId() {
        for (String bad : new String[]{"Device", ":R", "Device:", ""}) {
            SchematicException e = assertThrows(SchematicException.class, () -> resolver.resolve(bad));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind(), bad);
        }
        assertEquals(new LibraryId("Connector", "Conn_01x02:Alt"), LibraryId.parse("Connector:Conn_01x02:Alt"));
    }

    @Test
    void searchPathsAreTriedInOrder(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("Device.kicad_sym"),
                "(kicad_symbol_lib (symbol \"R\" (symbol \"R_1_1\" (pin passive line (number \"9\")))))");
        SymbolLibraryResolver shadowing = new SymbolLibraryResolver(dir, Fixtures.SYMBOLS);

        assertEquals(List.of("9"), shadowing.resolve("Device:R").getPinNumbers());
        assertEquals(List.of("1"), shadowing.resolve("power:+5V").getPinNumbers());
    }

    @Test
    void customExtension(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("Mine.lib"), "(kicad_symbol_lib (symbol \"X\"))");
        SymbolLibraryResolver custom = new SymbolLibraryResolver(dir).withExtension("lib");
        assertTrue(custom.resolve("Mine:X").getPins().isEmpty());
    }

    @Test
    void ensureCachedIsIdempotent() {
        SchematicDocument doc = SchematicTemplates.newSchematic();

        assertTrue(resolver.ensureCached(doc, "Device:C"));
        String once = doc.serialize(true);
        assertTrue(resolver.ensureCached(doc, "Device:C"));

        assertEquals(once, doc.serialize(true));
        List<SNode.SList> cached = doc.requireLibSymbols().findAll("symbol");
        assertEquals(1, cached.size());
        assertEquals("Device:C", cached.get(0).atomValue(1));
    }

    @Test
    void alreadyCachedSymbolIsNotReadFromDisk() {
        SchematicDocument doc = Fixtures.threeComponents();
        String before = doc.serialize(true);

        assertTrue(new SymbolLibraryResolver().ensureCached(doc, "Device:C"));
        assertEquals(before, doc.serialize(true));
    }

    @Test
    void ensureCachedWithoutLibSymbolsChangesNothing() {
        SchematicDocument doc = SchematicDocument.parse("(kicad_sch (version 20231120))");
        String before = doc.serialize(true);

        assertFalse(resolver.ensureCached(doc, "Device:R"));
        assertEquals(before, doc.serialize(true));
    }

    @Test
    void ensureCachedUnknownSymbolChangesNothing() {
        SchematicDocument doc = SchematicTemplates.newSchematic();
        String before = doc.serialize(true);

        assertFalse(resolver.ensureCached(doc, "Device:Nope"));
        assertFalse(resolver.ensureCached(doc, "Nope:R"));
        assertEquals(before, doc.serialize(true));
    }
}
