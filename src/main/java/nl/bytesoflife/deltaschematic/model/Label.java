package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

public record Label(LabelKind kind, String text, Coordinate position, double rotation, String uuid) {

    public static final double FONT_SIZE = 1.27;

    public SNode.SList toNode() {
        return SNode.list(kind.getTag(),
                text,
                SNode.list("at", position.x, position.y, rotation),
                SNode.list("fields_autoplaced", true),
                SNode.list("effects",
                        SNode.list("font", SNode.list("size", FONT_SIZE, FONT_SIZE)),
                        SNode.list("justify", SNode.symbol("left"), SNode.symbol("bottom"))),
                SNode.list("uuid", uuid));
    }

    static Label fromNode(LabelKind kind, SNode.SList node) {
        Position at = node.find("at").map(Position::fromAt).orElse(new Position(0, 0, 0));
        return new Label(kind, node.atomValue(1), at.toCoordinate(), at.rotation(),
                node.childValue("uuid").orElse(""));
    }
}
