package nl.bytesoflife.deltaschematic.connection;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.LabelKind;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.Wire;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds wires and net labels. Both are plain graphical primitives; no connectivity is
 * computed.
 */
public class ConnectionEditor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionEditor.class);

    public Wire addWire(SchematicDocument document, Coordinate start, Coordinate end) {
        Wire wire = new Wire(new Coordinate(start.x, start.y), new Coordinate(end.x, end.y), document.newUuid());
        document.insertBeforeSheetInstances(wire.toNode());
        log.info("Added wire from ({}, {}) to ({}, {}) (uuid {})", start.x, start.y, end.x, end.y, wire.uuid());
        return wire;
    }

    public Label addLabel(SchematicDocument document, String text, Coordinate position, LabelKind kind) {
        if (text == null || text.isEmpty()) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "Label text is required");
        }
        Label label = new Label(kind, text, new Coordinate(position.x, position.y), 0, document.newUuid());
        document.insertBeforeSheetInstances(label.toNode());
        log.info("Added {} '{}' at ({}, {})", kind.getTag(), text, position.x, position.y);
        return label;
    }
}
