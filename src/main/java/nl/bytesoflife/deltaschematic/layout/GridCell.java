package nl.bytesoflife.deltaschematic.layout;

public record GridCell(long col, long row) {
}
