package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;

import java.util.Map;

public enum LabelKind {
    LOCAL("label"),
    GLOBAL("global_label"),
    HIERARCHICAL("hierarchical_label");

    private static final Map<String, LabelKind> NAMES = Map.ofEntries(
            Map.entry("label", LOCAL),
            Map.entry("local", LOCAL),
            Map.entry("global_label", GLOBAL),
            Map.entry("global", GLOBAL),
            Map.entry("hierarchical_label", HIERARCHICAL),
            Map.entry("hierarchical", HIERARCHICAL)
    );

    private final String tag;

    LabelKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static LabelKind fromName(String name) {
        LabelKind kind = name == null ? null : NAMES.get(name.toLowerCase());
        if (kind == null) {
            throw new SchematicException(ErrorKind.INVALID_ARGUMENT, "Unknown label type: " + name);
        }
        return kind;
    }

    public static LabelKind fromTag(String tag) {
        for (LabelKind kind : values()) {
            if (kind.tag.equals(tag)) return kind;
        }
        return null;
    }
}
