package nl.bytesoflife.deltaschematic.delete;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.Fixtures;
import nl.bytesoflife.deltaschematic.SchematicException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextDeletionStrategyTest {

    private final TextDeletionStrategy strategy = new TextDeletionStrategy();

    private static final String SPLIT_LAYOUT = """
            (
              kicad_sch
              (
                version
                20231120
              )
              (
                lib_symbols
                (
                  symbol
                  "Device:C"
                  (
                    property
                    "Reference"
                    "C"
                  )
                )
              )
              (
                symbol
                (
                  lib_id
                  "Device:C"
                )
                (
                  property
                  "Reference"
                  "C1"
                )
              )
              (
                symbol
                (
                  lib_id
                  "Device:R"
                )
                (
                  property
                  "Reference"
                  "R1"
                )
              )
              (
                wire
                (
                  uuid
                  "w1"
                )
              )
            )
            """;

    @Test
    void deletesOnlyTheInstanceBlock() {
        String original = Fixtures.read(Fixtures.THREE_COMPONENTS);

        DeletionResult result = strategy.deleteInstances(original, Set.of("C1"));

        int blockStart = original.indexOf("\t(symbol\n\t\t(lib_id \"Device:C\")");
        int blockEnd = original.indexOf("\t(sheet_instances");
        assertTrue(blockStart > 0 && blockEnd > blockStart);
        assertEquals(original.substring(0, blockStart) + original.substring(blockEnd), result.content());
        assertEquals(List.of("C1"), result.deletedReferences());
        assertEquals(TextDeletionStrategy.NAME, result.strategy());
        assertTrue(result.content().contains("(symbol \"Device:C\""));
    }

    @Test
    void libraryTemplatesAreNeverCandidates() {
        String original = Fixtures.read(Fixtures.THREE_COMPONENTS);
        DeletionResult result = strategy.deleteInstances(original, Set.of("C", "R"));
        assertEquals(original, result.content());
        assertTrue(result.deletedReferences().isEmpty());
    }

    @Test
    void handlesSplitLayout() {
        DeletionResult result = strategy.deleteInstances(SPLIT_LAYOUT, Set.of("C1"));

        assertEquals(List.of("C1"), result.deletedReferences());
        assertFalse(result.content().contains("\"C1\""));
        assertTrue(result.content().contains("\"R1\""));
        assertTrue(result.content().contains("\"Device:C\""));
        assertEquals(2, countOf(result.content(), "\"Device:C\"") + countOf(result.content(), "\"Device:R\""));
    }

    @Test
    void deletesConnectionsInBothLayouts() {
        DeletionResult inline = strategy.deleteConnections(Fixtures.read(Fixtures.THREE_COMPONENTS));
        assertEquals(2, inline.removedBlocks());
        assertFalse(inline.content().contains("(wire"));
        assertFalse(inline.content().contains("(label"));
        assertEquals(3, countOf(inline.content(), "(lib_id"));

        DeletionResult split = strategy.deleteConnections(SPLIT_LAYOUT);
        assertEquals(1, split.removedBlocks());
        assertFalse(split.content().contains("wire"));
    }

    @Test
    void deletesEveryLabelKind() {
        String content = String.join("\n",
                "(kicad_sch (version 20231120)",
                "\t(junction (at 1 1) (uuid \"j\"))",
                "\t(global_label \"VCC\" (at 0 0 0)",
                "\t\t(uuid \"g\")",
                "\t)",
                "\t(hierarchical_label \"CLK (in)\" (at 0 0 0) (uuid \"h\"))",
                "\t(text \"note\" (at 0 0 0))",
                ")",
                "");
        DeletionResult result = strategy.deleteConnections(content);
        assertEquals(3, result.removedBlocks());
        assertEquals("(kicad_sch (version 20231120)\n\t(text \"note\" (at 0 0 0))\n)\n", result.content());
    }

    @Test
    void truncatedBlockFailsLoudly() {
        String original = Fixtures.read(Fixtures.THREE_COMPONENTS);
        String truncated = original.substring(0, original.indexOf("(reference \"C1\")"));

        SchematicException e = assertThrows(SchematicException.class,
                () -> strategy.deleteInstances(truncated, Set.of("R1")));
        assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
    }

    @Test
    void balanceIgnoresQuotedParentheses() {
        assertEquals(1, TextDeletionStrategy.balance("(property \"Value\" \"10k (1%)\""));
        assertEquals(0, TextDeletionStrategy.balance("(text \"a \\\") b\")"));
        assertEquals(-2, TextDeletionStrategy.balance("\t\t))"));
    }

    @Test
    void extractsReferenceInAllForms() {
        assertEquals("R1", TextDeletionStrategy.extractReference(
                List.of("(symbol", "(property \"Reference\" \"R1\" (at 0 0 0))", ")")));
        assertEquals("Q\"1", TextDeletionStrategy.extractReference(
                List.of("(symbol", "(property \"Reference\" \"Q\\\"1\"", ")")));
        assertEquals("U2", TextDeletionStrategy.extractReference(
                List.of("(symbol", "(property \"Reference\"", "\"U2\"", ")")));
        assertEquals("U3", TextDeletionStrategy.extractReference(
                List.of("(", "symbol", "(", "property", "\"Reference\"", "\"U3\"", ")", ")")));
        assertNull(TextDeletionStrategy.extractReference(
                List.of("(", "symbol", "(", "property", "\"Value\"", "\"U3\"", ")", ")")));
    }

    private static int countOf(String haystack, String needle) {
        int count = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }
}
