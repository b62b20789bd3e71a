package nl.bytesoflife.deltaschematic.layout;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;

/**
 * Compass direction in schematic coordinates, where y grows downwards. Diagonals are not
 * normalised: both axes move by the full distance.
 */
public enum Direction {
    RIGHT("right", 1, 0),
    LEFT("left", -1, 0),
    BELOW("below", 0, 1),
    ABOVE("above", 0, -1),
    BELOW_RIGHT("below-right", 1, 1),
    BELOW_LEFT("below-left", -1, 1),
    ABOVE_RIGHT("above-right", 1, -1),
    ABOVE_LEFT("above-left", -1, -1);

    private final String name;
    private final int dx;
    private final int dy;

    Direction(String name, int dx, int dy) {
        this.name = name;
        this.dx = dx;
        this.dy = dy;
    }

    public String getName() {
        return name;
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    public static Direction fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase().replace('_', '-');
            for (Direction direction : values()) {
                if (direction.name.equals(normalized)) {
                    return direction;
                }
            }
        }
        throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "Unknown direction: " + name);
    }
}
