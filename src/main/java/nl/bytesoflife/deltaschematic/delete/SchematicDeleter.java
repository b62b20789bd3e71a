package nl.bytesoflife.deltaschematic.delete;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.function.Function;

/**
 * Deletes with a primary strategy and retries with a fallback when the primary cannot
 * parse the file. By default the tree strategy is primary and the line-based text
 * strategy is the fallback.
 */
public class SchematicDeleter implements DeletionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SchematicDeleter.class);

    private final DeletionStrategy primary;
    private final DeletionStrategy fallback;

    public SchematicDeleter() {
        this(new TreeDeletionStrategy(), new TextDeletionStrategy());
    }

    public SchematicDeleter(DeletionStrategy primary, DeletionStrategy fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public String getName() {
        return primary.getName() + "+" + fallback.getName();
    }

    @Override
    public DeletionResult deleteInstances(String content, Set<String> references) {
        return withFallback(strategy -> strategy.deleteInstances(content, references));
    }

    @Override
    public DeletionResult deleteConnections(String content) {
        return withFallback(strategy -> strategy.deleteConnections(content));
    }

    private DeletionResult withFallback(Function<DeletionStrategy, DeletionResult> operation) {
        try {
            return operation.apply(primary);
        } catch (SchematicException e) {
            if (e.getKind() != ErrorKind.PARSE_ERROR) {
                throw e;
            }
            log.warn("{} deletion failed to parse the file ({}), retrying with {}",
                    primary.getName(), e.getMessage(), fallback.getName());
            return operation.apply(fallback);
        }
    }
}
