package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.parser.SNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view over a placed {@code (symbol ...)} node. Reads go straight to the node and
 * writes modify it in place, so a view obtained from a document edits that document.
 */
public class SymbolInstance {

    public static final String TAG = "symbol";
    public static final String REFERENCE = "Reference";
    public static final String VALUE = "Value";
    public static final String FOOTPRINT = "Footprint";
    public static final String DATASHEET = "Datasheet";

    private final SNode.SList node;

    public SymbolInstance(SNode.SList node) {
        if (!node.hasTag(TAG)) {
            throw new IllegalArgumentException("Not a symbol node: " + node.tag());
        }
        this.node = node;
    }

    public SNode.SList getNode() {
        return node;
    }

    public String getLibId() {
        return node.childValue("lib_id").orElse("");
    }

    public String getUuid() {
        return node.childValue("uuid").orElse("");
    }

    public Position getPosition() {
        return node.find("at").map(Position::fromAt).orElse(new Position(0, 0, 0));
    }

    public int getUnit() {
        return (int) node.find("unit").map(u -> u.numberAt(1, 1)).orElse(1.0).doubleValue();
    }

    public InstanceFlags getFlags() {
        return new InstanceFlags(
                flag("exclude_from_sim", false),
                flag("in_bom", true),
                flag("on_board", true),
                flag("dnp", false));
    }

    private boolean flag(String tag, boolean fallback) {
        return node.childValue(tag).map("yes"::equals).orElse(fallback);
    }

    public String getReference() {
        return getProperty(REFERENCE).map(Property::value).orElse("");
    }

    public String getValue() {
        return getProperty(VALUE).map(Property::value).orElse("");
    }

    public Optional<Property> getProperty(String name) {
        return Optional.ofNullable(getProperties().get(name));
    }

    /**
     * All properties in file order.
     */
    public Map<String, Property> getProperties() {
        Map<String, Property> properties = new LinkedHashMap<>();
        for (SNode.SList property : node.findAll("property")) {
            String name = property.atomValue(1);
            Position at = property.find("at").map(Position::fromAt).orElse(getPosition());
            properties.putIfAbsent(name, new Property(name, property.atomValue(2), at, isHidden(property)));
        }
        return Collections.unmodifiableMap(properties);
    }

    private static boolean isHidden(SNode.SList property) {
        if (property.childValue("hide").map("yes"::equals).orElse(false)) {
            return true;
        }
        Optional<SNode.SList> effects = property.find("effects");
        if (effects.isEmpty()) return false;
        for (SNode child : effects.get().children()) {
            if (child instanceof SNode.SAtom atom && !atom.quoted() && "hide".equals(atom.value())) {
                return true;
            }
            if (child instanceof SNode.SList list && list.hasTag("hide")) {
                return list.children().size() < 2 || "yes".equals(list.atomValue(1));
            }
        }
        return false;
    }

    /**
     * Sets a property value. Changing the Reference also rewrites the reference of every
     * instance path. A property that does not exist yet is added hidden at the symbol's
     * anchor.
     */
    public void setPropertyValue(String name, String value) {
        Optional<SNode.SList> existing = findPropertyNode(name);
        if (existing.isPresent()) {
            List<SNode> children = existing.get().children();
            if (children.size() > 2) {
                children.set(2, SNode.string(value));
            } else {
                children.add(SNode.string(value));
            }
        } else {
            Position at = getPosition();
            insertAfterLastProperty(newProperty(name, value, new Position(at.x(), at.y(), 0), true, null));
        }
        if (REFERENCE.equals(name)) {
            for (SNode.SList path : instancePathNodes()) {
                path.find("reference").ifPresent(ref -> ref.children().set(1, SNode.string(value)));
            }
        }
    }

    private Optional<SNode.SList> findPropertyNode(String name) {
        for (SNode.SList property : node.findAll("property")) {
            if (name.equals(property.atomValue(1))) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    private void insertAfterLastProperty(SNode.SList property) {
        List<SNode> children = node.children();
        int index = -1;
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof SNode.SList list
                    && (list.hasTag("property") || list.hasTag("uuid"))) {
                index = i;
            }
        }
        children.add(index < 0 ? children.size() : index + 1, property);
    }

    public List<InstancePin> getPins() {
        List<InstancePin> pins = new ArrayList<>();
        for (SNode.SList pin : node.findAll("pin")) {
            pins.add(new InstancePin(pin.atomValue(1), pin.childValue("uuid").orElse("")));
        }
        return pins;
    }

    public List<InstancePath> getInstancePaths() {
        List<InstancePath> result = new ArrayList<>();
        for (SNode.SList project : node.find("instances").map(i -> i.findAll("project")).orElse(List.of())) {
            for (SNode.SList path : project.findAll("path")) {
                result.add(new InstancePath(
                        project.atomValue(1),
                        path.atomValue(1),
                        path.childValue("reference").orElse(""),
                        (int) path.find("unit").map(u -> u.numberAt(1, 1)).orElse(1.0).doubleValue()));
            }
        }
        return result;
    }

    private List<SNode.SList> instancePathNodes() {
        List<SNode.SList> paths = new ArrayList<>();
        node.find("instances").ifPresent(instances -> {
            for (SNode.SList project : instances.findAll("project")) {
                paths.addAll(project.findAll("path"));
            }
        });
        return paths;
    }

    /**
     * Builds a {@code (property ...)} node with the 1.27mm font KiCad uses for fields.
     */
    public static SNode.SList newProperty(String name, String value, Position at, boolean hidden, String justify) {
        SNode.SList effects = SNode.list("effects", SNode.list("font", SNode.list("size", 1.27, 1.27)));
        if (justify != null) {
            effects.add(SNode.list("justify", SNode.symbol(justify)));
        }
        if (hidden) {
            effects.add(SNode.list("hide", true));
        }
        return SNode.list("property", name, value, at.toAt(), effects);
    }

    @Override
    public String toString() {
        return "SymbolInstance{" + getReference() + " " + getLibId() + " at " + getPosition() + "}";
    }
}
