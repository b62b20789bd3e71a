package nl.bytesoflife.deltaschematic.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionWriterTest {

    private final SExpressionWriter writer = new SExpressionWriter();
    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void compactForm() {
        SNode.SList node = SNode.list("at", 100.0, 25.4, 0);
        assertEquals("(at 100 25.4 0)", writer.write(node, false));
    }

    @Test
    void prettyFormKeepsLeafListsInline() {
        SNode.SList node = SNode.list("property", "Reference", "R1",
                SNode.list("at", 1.5, 2, 0),
                SNode.list("effects", SNode.list("hide", true)));
        String expected = """
                (property "Reference" "R1"
                \t(at 1.5 2 0)
                \t(effects
                \t\t(hide yes)
                \t)
                )
                """;
        assertEquals(expected, writer.write(node, true));
    }

    @Test
    void quotesAndEscapesStrings() {
        SNode.SList node = SNode.list("text", "a \"b\"\n\\c");
        assertEquals("(text \"a \\\"b\\\"\\n\\\\c\")", writer.write(node, false));
    }

    @Test
    void formatsNumbersLikeKicad() {
        assertEquals("0", SNode.formatNumber(-0.0));
        assertEquals("0", SNode.formatNumber(0.00001));
        assertEquals("125.4", SNode.formatNumber(100 + 25.4));
        assertEquals("-5.08", SNode.formatNumber(-5.08));
        assertEquals("1.2346", SNode.formatNumber(1.23456));
    }

    @Test
    void roundTripIsStructurallyEqual() {
        String source = """
                (kicad_sch (version 20231120) (generator "eeschema")
                  (lib_symbols (symbol "Device:R" (pin passive line (at 0 3.81 270) (number "1"))))
                  (symbol (lib_id "Device:R") (at 100 100 0)
                    (property "Value" "10k (1%)" (at 0 0 0))
                    (instances (project "" (path "/abc" (reference "R1") (unit 1)))))
                  (sheet_instances (path "/" (page "1"))))
                """;
        List<SNode> parsed = parser.parse(source);
        for (boolean pretty : new boolean[]{true, false}) {
            List<SNode> reparsed = parser.parse(writer.write(parsed, pretty));
            assertEquals(parsed, reparsed);
        }
    }

    @Test
    void builtTreeSurvivesRoundTrip() {
        SNode.SList tree = SNode.list("kicad_sch",
                SNode.list("version", 20231120),
                SNode.list("text", "say \"hi\"\nC:\\path\\", SNode.list("at", SNode.number(-12.7), 0.5, 180)),
                SNode.list("label", "", SNode.list("fields_autoplaced", true)),
                SNode.list("property", "Value", "a\\\"b",
                        SNode.list("effects", SNode.list("font", SNode.list("size", 1.27, 1.27)), SNode.symbol("hide"))));
        for (boolean pretty : new boolean[]{true, false}) {
            List<SNode> reparsed = parser.parse(writer.write(tree, pretty));
            assertEquals(List.of(tree), reparsed, pretty ? "pretty" : "compact");
        }
    }

    @Test
    void rejectsNonBareSymbols() {
        assertThrows(IllegalArgumentException.class, () -> SNode.symbol("two words"));
        assertThrows(IllegalArgumentException.class, () -> SNode.symbol(""));
    }
}
