package nl.bytesoflife.deltaschematic.circuit;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.connection.ConnectionEditor;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.LabelKind;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.model.Wire;
import nl.bytesoflife.deltaschematic.parser.SNode;
import nl.bytesoflife.deltaschematic.placement.ComponentPlacer;
import nl.bytesoflife.deltaschematic.placement.PlacementRequest;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Places a two-resistor voltage divider between a supply and ground symbol, wires it and
 * labels the VCC, VOUT and GND nets.
 * <pre>
 *   VCC       (x, y - 20)
 *   R_upper   (x, y)        rotated 90
 *   R_lower   (x, y + 20)   rotated 90
 *   GND       (x, y + 40)
 *   VOUT tap  (x + 15, y + 10)
 * </pre>
 */
public class VoltageDividerBuilder {

    private static final Logger log = LoggerFactory.getLogger(VoltageDividerBuilder.class);

    public static final String RESISTOR = "Device:R";
    public static final String SUPPLY = "power:+5V";
    public static final String GROUND = "power:GND";
    public static final String RESISTOR_FOOTPRINT = "Resistor_SMD:R_0603_1608Metric";

    /** Half the body length of a resistor symbol, where the wires attach. */
    private static final double PIN_OFFSET = 5;

    private double inputVoltage = 5;
    private double outputVoltage = 3;
    private double x = 120;
    private double y = 80;
    private double upperKOhm = 10;
    private Double lowerKOhm;

    public VoltageDividerBuilder withInputVoltage(double volts) {
        this.inputVoltage = volts;
        return this;
    }

    public VoltageDividerBuilder withOutputVoltage(double volts) {
        this.outputVoltage = volts;
        return this;
    }

    public VoltageDividerBuilder at(double x, double y) {
        this.x = x;
        this.y = y;
        return this;
    }

    public VoltageDividerBuilder withUpperResistor(double kOhm) {
        this.upperKOhm = kOhm;
        return this;
    }

    /**
     * Fix the lower resistor instead of deriving it from the voltages.
     */
    public VoltageDividerBuilder withLowerResistor(double kOhm) {
        this.lowerKOhm = kOhm;
        return this;
    }

    public VoltageDivider build(SchematicDocument document, ComponentPlacer placer, ConnectionEditor connections) {
        validate();
        double lower = lowerKOhm != null ? lowerKOhm : outputVoltage * upperKOhm / (inputVoltage - outputVoltage);
        String suffix = "_" + (int) x + "_" + (int) y;

        Coordinate vcc = new Coordinate(x, y - 20);
        Coordinate upper = new Coordinate(x, y);
        Coordinate lowerPos = new Coordinate(x, y + 20);
        Coordinate gnd = new Coordinate(x, y + 40);
        Coordinate tap = new Coordinate(x + 15, y + 10);

        List<SymbolInstance> components = new ArrayList<>();
        components.add(placer.place(document, new PlacementRequest(SUPPLY, "#PWR_VCC" + suffix,
                "+" + SNode.formatNumber(inputVoltage) + "V").at(vcc)));
        components.add(placer.place(document, new PlacementRequest(RESISTOR, "R_upper" + suffix,
                SNode.formatNumber(upperKOhm) + "k").at(upper).withRotation(90).withFootprint(RESISTOR_FOOTPRINT)));
        components.add(placer.place(document, new PlacementRequest(RESISTOR, "R_lower" + suffix,
                String.format(Locale.US, "%.1fk", lower)).at(lowerPos).withRotation(90).withFootprint(RESISTOR_FOOTPRINT)));
        components.add(placer.place(document, new PlacementRequest(GROUND, "#PWR_GND" + suffix, "GND").at(gnd)));

        List<Wire> wires = new ArrayList<>();
        wires.add(connections.addWire(document, vcc, new Coordinate(upper.x, upper.y - PIN_OFFSET)));
        wires.add(connections.addWire(document, new Coordinate(upper.x, upper.y + PIN_OFFSET),
                new Coordinate(lowerPos.x, lowerPos.y - PIN_OFFSET)));
        wires.add(connections.addWire(document, new Coordinate(lowerPos.x, lowerPos.y + PIN_OFFSET), gnd));
        wires.add(connections.addWire(document, new Coordinate(upper.x, upper.y + PIN_OFFSET), tap));

        List<Label> labels = new ArrayList<>();
        labels.add(connections.addLabel(document, "VCC", new Coordinate(vcc.x + 5, vcc.y), LabelKind.LOCAL));
        labels.add(connections.addLabel(document, "VOUT", new Coordinate(tap.x + 5, tap.y), LabelKind.LOCAL));
        labels.add(connections.addLabel(document, "GND", new Coordinate(gnd.x + 5, gnd.y), LabelKind.LOCAL));

        double calculated = Math.round(inputVoltage * lower / (upperKOhm + lower) * 100.0) / 100.0;
        log.info("Created voltage divider {}V -> {}V (R_upper={}k, R_lower={}k) at ({}, {})",
                inputVoltage, calculated, upperKOhm, lower, x, y);
        return new VoltageDivider(inputVoltage, outputVoltage, calculated, upperKOhm, lower,
                components, wires, labels);
    }

    private void validate() {
        if (inputVoltage <= 0 || outputVoltage <= 0) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "Voltages must be positive");
        }
        if (lowerKOhm == null && outputVoltage >= inputVoltage) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT,
                    "Output voltage " + outputVoltage + "V must be below input voltage " + inputVoltage + "V");
        }
        if (upperKOhm <= 0 || (lowerKOhm != null && lowerKOhm <= 0)) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "Resistor values must be positive");
        }
    }

    public record VoltageDivider(double inputVoltage, double outputVoltage, double calculatedOutput,
                                 double upperKOhm, double lowerKOhm,
                                 List<SymbolInstance> components, List<Wire> wires, List<Label> labels) {
    }
}
