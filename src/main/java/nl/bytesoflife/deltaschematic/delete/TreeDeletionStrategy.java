package nl.bytesoflife.deltaschematic.delete;

import nl.bytesoflife.deltaschematic.model.SchematicDocument;

import java.util.List;
import java.util.Set;

/**
 * Deletes through the parsed document model and re-serializes the whole file.
 */
public class TreeDeletionStrategy implements DeletionStrategy {

    public static final String NAME = "tree";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DeletionResult deleteInstances(String content, Set<String> references) {
        SchematicDocument document = SchematicDocument.parse(content);
        List<String> removed = document.removeInstances(references);
        return new DeletionResult(document.serialize(true), removed, removed.size(), NAME);
    }

    @Override
    public DeletionResult deleteConnections(String content) {
        SchematicDocument document = SchematicDocument.parse(content);
        int removed = document.removeConnections();
        return new DeletionResult(document.serialize(true), List.of(), removed, NAME);
    }
}
