package nl.bytesoflife.deltaschematic.layout;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.Position;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Position helpers for placing symbols: next free grid cell, offsets from an anchor
 * symbol and row-major group layout.
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    public static final int SEARCH_WINDOW = 20;
    public static final double DEFAULT_CELL_SIZE = 50.8;
    public static final double DEFAULT_DISTANCE = 25.4;

    /**
     * Cells occupied by the document's symbols. A symbol occupies the cell its anchor
     * rounds to, using half-to-even rounding.
     */
    public Set<GridCell> occupiedCells(SchematicDocument document, double cellSize) {
        requirePositive(cellSize, "cellSize");
        Set<GridCell> occupied = new HashSet<>();
        for (SymbolInstance instance : document.getSymbolInstances()) {
            Position at = instance.getPosition();
            occupied.add(new GridCell((long) Math.rint(at.x() / cellSize), (long) Math.rint(at.y() / cellSize)));
        }
        return occupied;
    }

    /**
     * First unoccupied cell in the {@value #SEARCH_WINDOW} x {@value #SEARCH_WINDOW} window
     * starting at the origin cell, scanning row by row. Falls back to the origin cell when
     * the whole window is taken.
     */
    public Coordinate gridNextFree(SchematicDocument document, int originCol, int originRow, double cellSize) {
        Set<GridCell> occupied = occupiedCells(document, cellSize);
        for (int dy = 0; dy < SEARCH_WINDOW; dy++) {
            long row = (long) originRow + dy;
            for (int dx = 0; dx < SEARCH_WINDOW; dx++) {
                long col = (long) originCol + dx;
                if (!occupied.contains(new GridCell(col, row))) {
                    return new Coordinate(col * cellSize, row * cellSize);
                }
            }
        }

        log.warn("All {} cells from ({}, {}) are occupied, using the origin cell",
                SEARCH_WINDOW * SEARCH_WINDOW, originCol, originRow);
        return new Coordinate(originCol * cellSize, originRow * cellSize);
    }

    public Coordinate relativePosition(SchematicDocument document, String anchorReference,
                                       Direction direction, double distance) {
        SymbolInstance anchor = document.findInstance(anchorReference).orElseThrow(() ->
                new SchematicException(ErrorKind.ANCHOR_NOT_FOUND,
                        "Anchor component " + anchorReference + " not found"));
        Position at = anchor.getPosition();
        return new Coordinate(at.x() + direction.getDx() * distance, at.y() + direction.getDy() * distance);
    }

    /**
     * Row-major positions for {@code count} components, {@code columns} per row. Existing
     * symbols are not taken into account.
     */
    public List<Coordinate> groupLayout(int count, double startX, double startY, double spacing, int columns) {
        if (columns <= 0) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "columns must be positive, got " + columns);
        }
        List<Coordinate> positions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int col = i % columns;
            int row = i / columns;
            positions.add(new Coordinate(startX + col * spacing, startY + row * spacing));
        }
        return positions;
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, name + " must be positive, got " + value);
        }
    }
}
