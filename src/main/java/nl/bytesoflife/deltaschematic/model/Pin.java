package nl.bytesoflife.deltaschematic.model;

public record Pin(String number, String name) {
}
