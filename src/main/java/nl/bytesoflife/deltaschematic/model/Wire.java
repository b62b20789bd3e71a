package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

public record Wire(Coordinate start, Coordinate end, String uuid) {

    public static final String TAG = "wire";

    public SNode.SList toNode() {
        return SNode.list(TAG,
                SNode.list("pts",
                        SNode.list("xy", start.x, start.y),
                        SNode.list("xy", end.x, end.y)),
                SNode.list("stroke",
                        SNode.list("width", 0),
                        SNode.list("type", SNode.symbol("default"))),
                SNode.list("uuid", uuid));
    }

    static Wire fromNode(SNode.SList node) {
        List<SNode.SList> points = node.find("pts").map(pts -> pts.findAll("xy")).orElse(List.of());
        Coordinate start = points.isEmpty() ? new Coordinate(0, 0) : toCoordinate(points.get(0));
        Coordinate end = points.size() < 2 ? start : toCoordinate(points.get(points.size() - 1));
        return new Wire(start, end, node.childValue("uuid").orElse(""));
    }

    private static Coordinate toCoordinate(SNode.SList xy) {
        return new Coordinate(xy.numberAt(1, 0), xy.numberAt(2, 0));
    }
}
