package nl.bytesoflife.deltaschematic.circuit;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.Fixtures;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.connection.ConnectionEditor;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.Position;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SchematicTemplates;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.placement.ComponentPlacer;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VoltageDividerBuilderTest {

    private final ComponentPlacer placer = new ComponentPlacer(Fixtures.resolver());
    private final ConnectionEditor connections = new ConnectionEditor();

    @Test
    void buildsDefaultDivider() {
        SchematicDocument doc = SchematicTemplates.newSchematic();

        VoltageDividerBuilder.VoltageDivider divider = new VoltageDividerBuilder()
                .build(doc, placer, connections);

        assertEquals(15.0, divider.lowerKOhm(), 1e-9);
        assertEquals(3.0, divider.calculatedOutput(), 1e-9);

        List<SymbolInstance> components = doc.getSymbolInstances();
        assertEquals(List.of("#PWR_VCC_120_80", "R_upper_120_80", "R_lower_120_80", "#PWR_GND_120_80"),
                components.stream().map(SymbolInstance::getReference).toList());
        assertEquals(List.of("+5V", "10k", "15.0k", "GND"),
                components.stream().map(SymbolInstance::getValue).toList());
        assertEquals(List.of("power:+5V", "Device:R", "Device:R", "power:GND"),
                components.stream().map(SymbolInstance::getLibId).toList());

        SymbolInstance upper = components.get(1);
        assertEquals(new Position(120, 80, 90), upper.getPosition());
        assertEquals(VoltageDividerBuilder.RESISTOR_FOOTPRINT, upper.getProperty("Footprint").orElseThrow().value());
        assertEquals(new Position(120, 120, 0), components.get(3).getPosition());
        assertEquals(2, upper.getPins().size());
    }

    @Test
    void wiresAndLabels() {
        SchematicDocument doc = SchematicTemplates.newSchematic();
        new VoltageDividerBuilder().at(50, 50).build(doc, placer, connections);

        assertEquals(4, doc.getWires().size());
        assertEquals(new Coordinate(50, 30), doc.getWires().get(0).start());
        assertEquals(new Coordinate(50, 45), doc.getWires().get(0).end());
        assertEquals(new Coordinate(65, 60), doc.getWires().get(3).end());

        List<Label> labels = doc.getLabels();
        assertEquals(List.of("VCC", "VOUT", "GND"), labels.stream().map(Label::text).toList());
        assertEquals(new Coordinate(70, 60), labels.get(1).position());
    }

    @Test
    void explicitLowerResistor() {
        SchematicDocument doc = SchematicTemplates.newSchematic();
        VoltageDividerBuilder.VoltageDivider divider = new VoltageDividerBuilder()
                .withInputVoltage(12)
                .withUpperResistor(10)
                .withLowerResistor(4.7)
                .build(doc, placer, connections);

        assertEquals(3.84, divider.calculatedOutput(), 1e-9);
        assertEquals("4.7k", doc.findInstance("R_lower_120_80").orElseThrow().getValue());
        assertEquals("+12V", doc.findInstance("#PWR_VCC_120_80").orElseThrow().getValue());
    }

    @Test
    void rejectsImpossibleDivider() {
        SchematicDocument doc = SchematicTemplates.newSchematic();
        SchematicException e = assertThrows(SchematicException.class, () -> new VoltageDividerBuilder()
                .withInputVoltage(3.3).withOutputVoltage(5).build(doc, placer, connections));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
        assertTrue(doc.getSymbolInstances().isEmpty());

        assertThrows(SchematicException.class, () -> new VoltageDividerBuilder()
                .withUpperResistor(0).build(doc, placer, connections));
    }
}
