package nl.bytesoflife.deltaschematic.placement;

import nl.bytesoflife.deltaschematic.library.SymbolLibraryResolver;
import nl.bytesoflife.deltaschematic.model.InstanceFlags;
import nl.bytesoflife.deltaschematic.model.Position;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.parser.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds complete symbol instance nodes: library cache entry, properties, pins with fresh
 * identifiers and the project instance path.
 */
public class ComponentPlacer {

    private static final Logger log = LoggerFactory.getLogger(ComponentPlacer.class);

    public static final double REFERENCE_OFFSET_Y = -5.08;
    public static final double VALUE_OFFSET_Y = -2.54;
    public static final String EMPTY_DATASHEET = "~";

    private final SymbolLibraryResolver resolver;
    private final ProjectUuidResolver projectUuidResolver;

    public ComponentPlacer(SymbolLibraryResolver resolver) {
        this(resolver, new ProjectUuidResolver());
    }

    public ComponentPlacer(SymbolLibraryResolver resolver, ProjectUuidResolver projectUuidResolver) {
        this.resolver = resolver;
        this.projectUuidResolver = projectUuidResolver;
    }

    /**
     * Creates the instance node without inserting it. The library definition is cached
     * into the document as a side effect when it can be resolved; when it cannot, the
     * instance is built without pins.
     */
    public SymbolInstance createInstance(SchematicDocument document, PlacementRequest request) {
        return createInstance(document, request, projectUuidResolver.resolve(document));
    }

    /**
     * Creates instance nodes for a batch without inserting them. All of them share one
     * project UUID, also when the document has no instances yet.
     */
    public List<SymbolInstance> createInstances(SchematicDocument document, List<PlacementRequest> requests) {
        String projectUuid = projectUuidResolver.resolve(document);
        List<SymbolInstance> instances = new ArrayList<>(requests.size());
        for (PlacementRequest request : requests) {
            instances.add(createInstance(document, request, projectUuid));
        }
        return instances;
    }

    private SymbolInstance createInstance(SchematicDocument document, PlacementRequest request, String projectUuid) {
        String libId = request.getLibId();
        if (!resolver.ensureCached(document, libId)) {
            log.warn("Could not add {} to {}, placing {} without pin data",
                    libId, SchematicDocument.LIB_SYMBOLS, request.getReference());
        }

        List<String> pinNumbers = document.findCachedSymbol(libId)
                .map(node -> SymbolDefinition.fromNode(libId, node).getPinNumbers())
                .orElse(List.of());

        double x = request.getX();
        double y = request.getY();
        InstanceFlags flags = request.getFlags();

        SNode.SList symbol = SNode.list(SymbolInstance.TAG,
                SNode.list("lib_id", libId),
                SNode.list("at", x, y, request.getRotation()),
                SNode.list("unit", request.getUnit()),
                SNode.list("exclude_from_sim", flags.excludeFromSim()),
                SNode.list("in_bom", flags.inBom()),
                SNode.list("on_board", flags.onBoard()),
                SNode.list("dnp", flags.dnp()),
                SNode.list("fields_autoplaced", request.isFieldsAutoplaced()),
                SNode.list("uuid", document.newUuid()));

        for (SNode.SList property : buildProperties(request)) {
            symbol.add(property);
        }
        for (String number : pinNumbers) {
            symbol.add(SNode.list("pin", number, SNode.list("uuid", document.newUuid())));
        }
        symbol.add(SNode.list("instances",
                SNode.list("project", "",
                        SNode.list("path", "/" + projectUuid,
                                SNode.list("reference", request.getReference()),
                                SNode.list("unit", request.getUnit())))));

        log.debug("Built {} ({}) with {} pins under project {}",
                request.getReference(), libId, pinNumbers.size(), projectUuid);
        return new SymbolInstance(symbol);
    }

    /**
     * Creates the instance and inserts it at the document's canonical insertion point.
     */
    public SymbolInstance place(SchematicDocument document, PlacementRequest request) {
        SymbolInstance instance = createInstance(document, request);
        int index = document.insertBeforeSheetInstances(instance.getNode());
        log.info("Added component {} ({}) at ({}, {}) at position {}",
                request.getReference(), request.getLibId(), request.getX(), request.getY(), index);
        return instance;
    }

    private List<SNode.SList> buildProperties(PlacementRequest request) {
        double x = request.getX();
        double y = request.getY();
        String footprint = request.getFootprint();
        String datasheet = request.getDatasheet().isEmpty() ? EMPTY_DATASHEET : request.getDatasheet();

        List<SNode.SList> properties = new ArrayList<>(4);
        properties.add(SymbolInstance.newProperty(SymbolInstance.REFERENCE, request.getReference(),
                new Position(x, y + REFERENCE_OFFSET_Y, 0), false, null));
        properties.add(SymbolInstance.newProperty(SymbolInstance.VALUE, request.getValue(),
                new Position(x, y + VALUE_OFFSET_Y, 0), false, null));
        properties.add(SymbolInstance.newProperty(SymbolInstance.FOOTPRINT, footprint,
                new Position(x, y, 0), true, footprint.isEmpty() ? null : "bottom"));
        properties.add(SymbolInstance.newProperty(SymbolInstance.DATASHEET, datasheet,
                new Position(x, y, 0), true, null));
        return properties;
    }
}
