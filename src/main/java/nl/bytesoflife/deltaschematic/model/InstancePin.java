package nl.bytesoflife.deltaschematic.model;

public record InstancePin(String number, String uuid) {
}
