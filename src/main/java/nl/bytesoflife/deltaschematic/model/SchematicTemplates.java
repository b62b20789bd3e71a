package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.parser.SNode;

import java.util.UUID;

/**
 * Factory for new schematic documents.
 */
public class SchematicTemplates {

    public static final int FILE_VERSION = 20231120;
    public static final String GENERATOR = "eeschema";
    public static final String GENERATOR_VERSION = "8.0";

    private SchematicTemplates() {
    }

    /**
     * Blank A4 sheet with an empty {@code lib_symbols} cache and the root sheet instance.
     */
    public static SchematicDocument newSchematic() {
        SNode.SList root = SNode.list(SchematicDocument.ROOT_TAG,
                SNode.list("version", FILE_VERSION),
                SNode.list("generator", GENERATOR),
                SNode.list("generator_version", GENERATOR_VERSION),
                SNode.list("uuid", UUID.randomUUID().toString()),
                SNode.list("paper", "A4"),
                SNode.list(SchematicDocument.LIB_SYMBOLS),
                SNode.list(SchematicDocument.SHEET_INSTANCES,
                        SNode.list("path", "/", SNode.list("page", "1"))));
        return new SchematicDocument(root);
    }
}
