package nl.bytesoflife.deltaschematic.placement;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.InstanceFlags;
import org.locationtech.jts.geom.Coordinate;

/**
 * Everything needed to place one symbol. Built fluently; only the library id, reference
 * and value are mandatory.
 */
public class PlacementRequest {

    private final String libId;
    private final String reference;
    private final String value;
    private double x;
    private double y;
    private double rotation;
    private int unit = 1;
    private String footprint = "";
    private String datasheet = "";
    private InstanceFlags flags = InstanceFlags.defaults();
    private boolean fieldsAutoplaced = true;

    public PlacementRequest(String libId, String reference, String value) {
        if (libId == null || libId.isBlank()) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "lib_id is required");
        }
        if (reference == null || reference.isBlank()) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "reference is required");
        }
        this.libId = libId;
        this.reference = reference;
        this.value = value == null ? "" : value;
    }

    public PlacementRequest at(double x, double y) {
        this.x = x;
        this.y = y;
        return this;
    }

    public PlacementRequest at(Coordinate position) {
        return at(position.x, position.y);
    }

    /**
     * A copy of this request placed at {@code position}. This request is left as it is.
     */
    public PlacementRequest copyAt(Coordinate position) {
        PlacementRequest copy = new PlacementRequest(libId, reference, value);
        copy.rotation = rotation;
        copy.unit = unit;
        copy.footprint = footprint;
        copy.datasheet = datasheet;
        copy.flags = flags;
        copy.fieldsAutoplaced = fieldsAutoplaced;
        return copy.at(position);
    }

    public PlacementRequest withRotation(double rotation) {
        this.rotation = rotation;
        return this;
    }

    public PlacementRequest withUnit(int unit) {
        if (unit < 1) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "unit must be >= 1, got " + unit);
        }
        this.unit = unit;
        return this;
    }

    public PlacementRequest withFootprint(String footprint) {
        this.footprint = footprint == null ? "" : footprint;
        return this;
    }

    public PlacementRequest withDatasheet(String datasheet) {
        this.datasheet = datasheet == null ? "" : datasheet;
        return this;
    }

    public PlacementRequest withFlags(InstanceFlags flags) {
        this.flags = flags;
        return this;
    }

    public PlacementRequest withFieldsAutoplaced(boolean fieldsAutoplaced) {
        this.fieldsAutoplaced = fieldsAutoplaced;
        return this;
    }

    public String getLibId() { return libId; }
    public String getReference() { return reference; }
    public String getValue() { return value; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getRotation() { return rotation; }
    public int getUnit() { return unit; }
    public String getFootprint() { return footprint; }
    public String getDatasheet() { return datasheet; }
    public InstanceFlags getFlags() { return flags; }
    public boolean isFieldsAutoplaced() { return fieldsAutoplaced; }

    @Override
    public String toString() {
        return "PlacementRequest{" + reference + " " + libId + " at (" + x + ", " + y + ")}";
    }
}
