package nl.bytesoflife.deltaschematic.delete;

import java.util.List;

/**
 * @param content           the file content after deletion
 * @param deletedReferences references of removed symbols, in file order (empty for connections)
 * @param removedBlocks     number of removed top-level elements
 * @param strategy          name of the strategy that produced the result
 */
public record DeletionResult(String content, List<String> deletedReferences, int removedBlocks, String strategy) {

    public DeletionResult {
        deletedReferences = List.copyOf(deletedReferences);
    }
}
