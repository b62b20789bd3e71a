package nl.bytesoflife.deltaschematic.layout;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.Fixtures;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LayoutEngineTest {

    private final LayoutEngine layout = new LayoutEngine();

    private static SchematicDocument withSymbolsAt(double... xy) {
        StringBuilder sb = new StringBuilder("(kicad_sch (lib_symbols)");
        for (int i = 0; i < xy.length; i += 2) {
            sb.append(" (symbol (lib_id \"Device:R\") (at ").append(xy[i]).append(' ').append(xy[i + 1])
                    .append(" 0) (property \"Reference\" \"R").append(i / 2 + 1).append("\"))");
        }
        return SchematicDocument.parse(sb.append(')').toString());
    }

    private static void assertNear(Coordinate expected, Coordinate actual) {
        assertEquals(0, expected.distance(actual), 1e-9, () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void occupiedCellsRoundHalfToEven() {
        SchematicDocument doc = withSymbolsAt(5, 0, 15, 10, 25, 25);
        Set<GridCell> cells = layout.occupiedCells(doc, 10);
        assertEquals(Set.of(new GridCell(0, 0), new GridCell(2, 1), new GridCell(2, 2)), cells);
    }

    @Test
    void nextFreeScansRowByRow() {
        SchematicDocument doc = withSymbolsAt(0, 0, 50.8, 0);
        Coordinate free = layout.gridNextFree(doc, 0, 0, 50.8);
        assertEquals(new Coordinate(101.6, 0), free);
    }

    @Test
    void nextFreeSkipsToNextRowWhenFull() {
        double[] xy = new double[LayoutEngine.SEARCH_WINDOW * 2];
        for (int col = 0; col < LayoutEngine.SEARCH_WINDOW; col++) {
            xy[col * 2] = col * 10;
        }
        Coordinate free = layout.gridNextFree(withSymbolsAt(xy), 0, 0, 10);
        assertEquals(new Coordinate(0, 10), free);
    }

    @Test
    void nextFreeNeverReturnsOccupiedCell() {
        SchematicDocument doc = Fixtures.threeComponents();
        Set<GridCell> occupied = layout.occupiedCells(doc, 50);
        Coordinate free = layout.gridNextFree(doc, 2, 2, 50);
        assertFalse(occupied.contains(new GridCell((int) Math.rint(free.x / 50), (int) Math.rint(free.y / 50))));
        assertEquals(new Coordinate(200, 100), free);
    }

    @Test
    void nextFreeStaysInWindowAtLargestColumn() {
        SchematicDocument doc = withSymbolsAt(Integer.MAX_VALUE, 0);
        Coordinate free = layout.gridNextFree(doc, Integer.MAX_VALUE, 0, 1);
        assertEquals(new Coordinate(Integer.MAX_VALUE + 1.0, 0), free);
    }

    @Test
    void fullWindowFallsBackToOrigin() {
        int n = LayoutEngine.SEARCH_WINDOW;
        double[] xy = new double[n * n * 2];
        int i = 0;
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                xy[i++] = col;
                xy[i++] = row;
            }
        }
        assertEquals(new Coordinate(0, 0), layout.gridNextFree(withSymbolsAt(xy), 0, 0, 1));
    }

    @Test
    void relativeToAnchor() {
        SchematicDocument doc = withSymbolsAt(100, 100);
        assertNear(new Coordinate(125.4, 100),
                layout.relativePosition(doc, "R1", Direction.fromName("right"), 25.4));
        assertNear(new Coordinate(90, 90),
                layout.relativePosition(doc, "R1", Direction.fromName("above-left"), 10));
        assertNear(new Coordinate(100, 110),
                layout.relativePosition(doc, "R1", Direction.fromName("BELOW"), 10));
    }

    @Test
    void missingAnchor() {
        SchematicException e = assertThrows(SchematicException.class,
                () -> layout.relativePosition(withSymbolsAt(), "R1", Direction.RIGHT, 10));
        assertEquals(ErrorKind.ANCHOR_NOT_FOUND, e.getKind());
    }

    @Test
    void directionNames() {
        assertEquals(Direction.BELOW_RIGHT, Direction.fromName("below_right"));
        SchematicException e = assertThrows(SchematicException.class, () -> Direction.fromName("up"));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }

    @Test
    void groupLayoutIsRowMajor() {
        List<Coordinate> positions = layout.groupLayout(7, 100, 100, 25.4, 5);
        assertEquals(7, positions.size());
        assertNear(new Coordinate(100, 100), positions.get(0));
        assertNear(new Coordinate(201.6, 100), positions.get(4));
        assertNear(new Coordinate(100, 125.4), positions.get(5));
        assertNear(new Coordinate(125.4, 125.4), positions.get(6));
    }

    @Test
    void rejectsNonPositiveParameters() {
        assertThrows(SchematicException.class, () -> layout.groupLayout(3, 0, 0, 10, 0));
        assertThrows(SchematicException.class, () -> layout.gridNextFree(withSymbolsAt(), 0, 0, 0));
    }
}
