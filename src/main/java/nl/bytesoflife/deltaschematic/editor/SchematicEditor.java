package nl.bytesoflife.deltaschematic.editor;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.circuit.VoltageDividerBuilder;
import nl.bytesoflife.deltaschematic.connection.ConnectionEditor;
import nl.bytesoflife.deltaschematic.delete.DeletionResult;
import nl.bytesoflife.deltaschematic.delete.DeletionStrategy;
import nl.bytesoflife.deltaschematic.delete.SchematicDeleter;
import nl.bytesoflife.deltaschematic.export.SchematicExporter;
import nl.bytesoflife.deltaschematic.layout.Direction;
import nl.bytesoflife.deltaschematic.layout.LayoutEngine;
import nl.bytesoflife.deltaschematic.library.SymbolLibraryResolver;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.LabelKind;
import nl.bytesoflife.deltaschematic.model.Position;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SchematicTemplates;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.model.Wire;
import nl.bytesoflife.deltaschematic.placement.ComponentPlacer;
import nl.bytesoflife.deltaschematic.placement.PlacementRequest;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point for schematic edits. Every request loads the file, applies one change and
 * writes the result, to {@code output} when given and back to the input file otherwise.
 * A failed request leaves the files untouched and reports the failure through
 * {@link EditResult#getErrorKind()}.
 */
public class SchematicEditor {

    private static final Logger log = LoggerFactory.getLogger(SchematicEditor.class);

    private final ComponentPlacer placer;
    private final LayoutEngine layout = new LayoutEngine();
    private final ConnectionEditor connections = new ConnectionEditor();
    private final DeletionStrategy deleter;
    private final SchematicExporter exporter;

    public SchematicEditor(SymbolLibraryResolver resolver) {
        this(resolver, new SchematicDeleter(), new SchematicExporter());
    }

    public SchematicEditor(SymbolLibraryResolver resolver, DeletionStrategy deleter, SchematicExporter exporter) {
        this.placer = new ComponentPlacer(resolver);
        this.deleter = deleter;
        this.exporter = exporter;
    }

    public EditResult createSchematic(Path file) {
        log.info("Creating schematic {}", file);
        try {
            if (Files.exists(file)) {
                throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "File already exists: " + file);
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            SchematicTemplates.newSchematic().save(file);
            return EditResult.ok("Created schematic " + file.getFileName()).withFilePath(file);
        } catch (IOException e) {
            return fail("createSchematic", new SchematicException(ErrorKind.IO_ERROR,
                    "Failed to create directories for " + file, e));
        } catch (SchematicException e) {
            return fail("createSchematic", e);
        }
    }

    public EditResult addSymbol(Path file, PlacementRequest request, Path output) {
        return edit("addSymbol", file, output, document -> placed(placer.place(document, request)));
    }

    /**
     * Places the symbol in the first free grid cell, scanning from the given origin cell.
     * The request's own position is ignored.
     */
    public EditResult addSymbolAuto(Path file, PlacementRequest request, int originCol, int originRow,
                                    double cellSize, Path output) {
        return edit("addSymbolAuto", file, output, document -> {
            Coordinate position = layout.gridNextFree(document, originCol, originRow, cellSize);
            return placed(placer.place(document, request.copyAt(position)));
        });
    }

    public EditResult addSymbolRelative(Path file, PlacementRequest request, String anchorReference,
                                        String direction, double distance, Path output) {
        return edit("addSymbolRelative", file, output, document -> {
            Coordinate position = layout.relativePosition(document, anchorReference,
                    Direction.fromName(direction), distance);
            return placed(placer.place(document, request.copyAt(position)))
                    .withDetail("anchor", anchorReference);
        });
    }

    /**
     * Lays out the requests row by row and inserts them together. All instance nodes are
     * built before the first one is inserted.
     */
    public EditResult addSymbolGroup(Path file, List<PlacementRequest> requests, double startX, double startY,
                                     double spacing, int columns, Path output) {
        return edit("addSymbolGroup", file, output, document -> {
            List<Coordinate> positions = layout.groupLayout(requests.size(), startX, startY, spacing, columns);
            List<PlacementRequest> positioned = new ArrayList<>(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                positioned.add(requests.get(i).copyAt(positions.get(i)));
            }
            List<SymbolInstance> instances = placer.createInstances(document, positioned);
            List<String> references = new ArrayList<>(instances.size());
            for (SymbolInstance instance : instances) {
                document.insertBeforeSheetInstances(instance.getNode());
                references.add(instance.getReference());
            }
            return EditResult.ok("Added " + instances.size() + " components")
                    .withDetail("count", instances.size())
                    .withDetail("references", references);
        });
    }

    public EditResult addWire(Path file, Coordinate start, Coordinate end, Path output) {
        return edit("addWire", file, output, document -> {
            Wire wire = connections.addWire(document, start, end);
            return EditResult.ok("Added wire")
                    .withDetail("uuid", wire.uuid());
        });
    }

    public EditResult addLabel(Path file, String text, Coordinate position, String kind, Path output) {
        return edit("addLabel", file, output, document -> {
            Label label = connections.addLabel(document, text, position, LabelKind.fromName(kind));
            return EditResult.ok("Added " + label.kind().getTag() + " '" + text + "'")
                    .withDetail("uuid", label.uuid());
        });
    }

    public EditResult deleteSymbol(Path file, String reference, Path output) {
        return rewrite("deleteSymbol", file, output, content -> {
            DeletionResult result = deleter.deleteInstances(content, Set.of(reference));
            if (result.deletedReferences().isEmpty()) {
                throw new SchematicException(ErrorKind.REFERENCE_NOT_FOUND,
                        "Component " + reference + " not found");
            }
            return result;
        }, result -> EditResult.ok("Deleted component " + reference)
                .withDetail("deleted_count", result.removedBlocks()));
    }

    /**
     * Deletes every listed reference that exists. Missing references are reported, not
     * treated as an error.
     */
    public EditResult deleteSymbols(Path file, Collection<String> references, Path output) {
        Set<String> wanted = new LinkedHashSet<>(references);
        return rewrite("deleteSymbols", file, output, content -> deleter.deleteInstances(content, wanted),
                result -> {
                    List<String> missing = new ArrayList<>(wanted);
                    missing.removeAll(result.deletedReferences());
                    return EditResult.ok("Deleted " + result.deletedReferences().size() + " components")
                            .withDetail("deleted_count", result.deletedReferences().size())
                            .withDetail("deleted", result.deletedReferences())
                            .withDetail("not_found", missing);
                });
    }

    public EditResult deleteAllConnections(Path file, Path output) {
        return rewrite("deleteAllConnections", file, output, deleter::deleteConnections,
                result -> EditResult.ok("Deleted " + result.removedBlocks() + " wires, junctions and labels")
                        .withDetail("deleted_count", result.removedBlocks()));
    }

    public EditResult listSymbols(Path file) {
        return read("listSymbols", file, document -> {
            List<Map<String, Object>> symbols = new ArrayList<>();
            for (SymbolInstance instance : document.getSymbolInstances()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("reference", instance.getReference());
                entry.put("value", instance.getValue());
                entry.put("lib_id", instance.getLibId());
                entry.put("footprint", instance.getProperty(SymbolInstance.FOOTPRINT).map(Property::value).orElse(""));
                entry.put("position", positionOf(instance.getPosition()));
                symbols.add(entry);
            }
            return EditResult.ok("Found " + symbols.size() + " components")
                    .withDetail("count", symbols.size())
                    .withDetail("symbols", symbols);
        });
    }

    public EditResult getSymbolProperties(Path file, String reference) {
        return read("getSymbolProperties", file, document -> {
            SymbolInstance instance = requireInstance(document, reference);
            Map<String, String> properties = new LinkedHashMap<>();
            for (Property property : instance.getProperties().values()) {
                properties.put(property.name(), property.value());
            }
            return EditResult.ok("Properties of " + reference)
                    .withDetail("reference", reference)
                    .withDetail("lib_id", instance.getLibId())
                    .withDetail("uuid", instance.getUuid())
                    .withDetail("position", positionOf(instance.getPosition()))
                    .withDetail("properties", properties);
        });
    }

    public EditResult updateSymbolProperty(Path file, String reference, String name, String value, Path output) {
        return edit("updateSymbolProperty", file, output, document -> {
            SymbolInstance instance = requireInstance(document, reference);
            String previous = instance.getProperty(name).map(Property::value).orElse(null);
            instance.setPropertyValue(name, value);
            return EditResult.ok("Set " + name + " of " + reference + " to '" + value + "'")
                    .withDetail("previous", previous);
        });
    }

    public EditResult createVoltageDivider(Path file, VoltageDividerBuilder builder, Path output) {
        return edit("createVoltageDivider", file, output, document -> {
            VoltageDividerBuilder.VoltageDivider divider = builder.build(document, placer, connections);
            return EditResult.ok("Created voltage divider")
                    .withDetail("r_upper_k", divider.upperKOhm())
                    .withDetail("r_lower_k", divider.lowerKOhm())
                    .withDetail("calculated_output", divider.calculatedOutput())
                    .withDetail("components", divider.components().stream().map(SymbolInstance::getReference).toList());
        });
    }

    public EditResult exportPdf(Path file, Path output) {
        log.info("Exporting {} to {}", file, output);
        try {
            SchematicExporter.ExportResult result = exporter.exportPdf(file, output);
            if (!result.success()) {
                return EditResult.failure(ErrorKind.IO_ERROR,
                                "Export failed with exit code " + result.exitCode() + ": " + result.message())
                        .withDetail("exit_code", result.exitCode());
            }
            return EditResult.ok("Exported to " + output.getFileName()).withFilePath(output);
        } catch (SchematicException e) {
            return fail("exportPdf", e);
        }
    }

    private EditResult edit(String operation, Path file, Path output, Function<SchematicDocument, EditResult> change) {
        Path target = output != null ? output : file;
        log.debug("{} on {}", operation, file);
        try {
            SchematicDocument document = SchematicDocument.load(file);
            EditResult result = change.apply(document);
            document.save(target);
            log.info("{}: {}", operation, result.getMessage());
            return result.withFilePath(target);
        } catch (SchematicException e) {
            return fail(operation, e);
        }
    }

    private EditResult rewrite(String operation, Path file, Path output,
                               Function<String, DeletionResult> change, Function<DeletionResult, EditResult> report) {
        Path target = output != null ? output : file;
        log.debug("{} on {}", operation, file);
        try {
            DeletionResult deletion = change.apply(readContent(file));
            SchematicDocument.writeAtomically(target, deletion.content());
            EditResult result = report.apply(deletion).withDetail("strategy", deletion.strategy());
            log.info("{}: {}", operation, result.getMessage());
            return result.withFilePath(target);
        } catch (SchematicException e) {
            return fail(operation, e);
        }
    }

    private EditResult read(String operation, Path file, Function<SchematicDocument, EditResult> query) {
        try {
            return query.apply(SchematicDocument.load(file)).withFilePath(file);
        } catch (SchematicException e) {
            return fail(operation, e);
        }
    }

    private static EditResult fail(String operation, SchematicException e) {
        log.error("{} failed ({}): {}", operation, e.getKind(), e.getMessage());
        return EditResult.failure(e.getKind(), e.getMessage());
    }

    private static EditResult placed(SymbolInstance instance) {
        return EditResult.ok("Added component " + instance.getReference())
                .withDetail("reference", instance.getReference())
                .withDetail("uuid", instance.getUuid())
                .withDetail("position", positionOf(instance.getPosition()));
    }

    private static SymbolInstance requireInstance(SchematicDocument document, String reference) {
        return document.findInstance(reference)
                .orElseThrow(() -> new SchematicException(ErrorKind.REFERENCE_NOT_FOUND,
                        "Component " + reference + " not found"));
    }

    private static Map<String, Double> positionOf(Position position) {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("x", position.x());
        map.put("y", position.y());
        map.put("rotation", position.rotation());
        return map;
    }

    private static String readContent(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SchematicException(ErrorKind.FILE_NOT_FOUND, "Schematic not found: " + file, e);
        } catch (IOException e) {
            throw new SchematicException(ErrorKind.IO_ERROR, "Failed to read " + file, e);
        }
    }
}
