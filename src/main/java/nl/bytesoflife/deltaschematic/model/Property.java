package nl.bytesoflife.deltaschematic.model;

public record Property(String name, String value, Position position, boolean hidden) {

    public boolean isVisible() {
        return !hidden;
    }
}
