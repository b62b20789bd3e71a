package nl.bytesoflife.deltaschematic.delete;

import java.util.Set;

/**
 * Removes elements from schematic file content. Implementations take and return the full
 * file text so they can be swapped for one another.
 */
public interface DeletionStrategy {

    String getName();

    /**
     * Removes every placed symbol whose Reference is in {@code references}. Library
     * templates in {@code lib_symbols} are never removed.
     */
    DeletionResult deleteInstances(String content, Set<String> references);

    /**
     * Removes all wires, junctions and labels.
     */
    DeletionResult deleteConnections(String content);
}
