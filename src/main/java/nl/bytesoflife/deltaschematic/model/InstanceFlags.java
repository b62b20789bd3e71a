package nl.bytesoflife.deltaschematic.model;

public record InstanceFlags(boolean excludeFromSim, boolean inBom, boolean onBoard, boolean dnp) {

    public static InstanceFlags defaults() {
        return new InstanceFlags(false, true, true, false);
    }
}
