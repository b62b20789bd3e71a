package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.parser.SNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable symbol template keyed by its library id ({@code Library:Symbol}).
 */
public final class SymbolDefinition {

    private final String libId;
    private final SNode.SList node;
    private final List<Pin> pins;

    private SymbolDefinition(String libId, SNode.SList node, List<Pin> pins) {
        this.libId = libId;
        this.node = node;
        this.pins = pins;
    }

    public static SymbolDefinition fromNode(String libId, SNode.SList node) {
        SNode.SList copy = node.copy();
        return new SymbolDefinition(libId, copy, Collections.unmodifiableList(extractPins(copy)));
    }

    /**
     * Collects the pins of every unit in document order, one entry per pin number.
     * Alternate body styles repeat pin numbers and are folded into the first occurrence.
     */
    static List<Pin> extractPins(SNode.SList symbol) {
        Map<String, Pin> byNumber = new LinkedHashMap<>();
        Deque<SNode.SList> stack = new ArrayDeque<>();
        stack.push(symbol);
        while (!stack.isEmpty()) {
            SNode.SList current = stack.pop();
            if (current != symbol && current.hasTag("pin")) {
                Pin pin = toPin(current);
                if (pin != null) {
                    byNumber.putIfAbsent(pin.number(), pin);
                }
                continue;
            }
            List<SNode> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) instanceof SNode.SList child) {
                    stack.push(child);
                }
            }
        }
        return new ArrayList<>(byNumber.values());
    }

    private static Pin toPin(SNode.SList pin) {
        String name = pin.childValue("name").orElse("");
        String number = pin.childValue("number").orElse(null);
        if (number == null) {
            // Instance-style pin: (pin "1" (uuid ...))
            for (int i = 1; i < pin.children().size(); i++) {
                if (pin.children().get(i) instanceof SNode.SAtom atom && atom.quoted()) {
                    number = atom.value();
                    break;
                }
            }
        }
        return number == null || number.isEmpty() ? null : new Pin(number, name);
    }

    public String getLibId() {
        return libId;
    }

    public String getSymbolName() {
        int colon = libId.indexOf(':');
        return colon < 0 ? libId : libId.substring(colon + 1);
    }

    public List<Pin> getPins() {
        return pins;
    }

    public List<String> getPinNumbers() {
        return pins.stream().map(Pin::number).toList();
    }

    public SNode.SList getNode() {
        return node.copy();
    }

    /**
     * Copy of the definition named by its full library id, as stored in a schematic's
     * {@code lib_symbols} section.
     */
    public SNode.SList toCacheNode() {
        SNode.SList copy = node.copy();
        if (copy.children().size() > 1) {
            copy.children().set(1, SNode.string(libId));
        } else {
            copy.children().add(SNode.string(libId));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "SymbolDefinition{libId=" + libId + ", pins=" + pins.size() + "}";
    }
}
