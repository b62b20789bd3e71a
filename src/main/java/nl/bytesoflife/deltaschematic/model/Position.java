package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

/**
 * Anchor of a placed element in schematic millimetres, with rotation in degrees.
 */
public record Position(double x, double y, double rotation) {

    public static Position of(Coordinate coordinate, double rotation) {
        return new Position(coordinate.x, coordinate.y, rotation);
    }

    static Position fromAt(SNode.SList at) {
        return new Position(at.numberAt(1, 0), at.numberAt(2, 0), at.numberAt(3, 0));
    }

    public Coordinate toCoordinate() {
        return new Coordinate(x, y);
    }

    public SNode.SList toAt() {
        return SNode.list("at", x, y, rotation);
    }
}
