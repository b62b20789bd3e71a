package nl.bytesoflife.deltaschematic.placement;

import nl.bytesoflife.deltaschematic.model.InstancePath;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the project UUID that instance paths of a schematic are rooted at.
 * <p>
 * The first path in document order that contains a UUID wins, even when a schematic mixes
 * paths from different projects.
 */
public class ProjectUuidResolver {

    static final Pattern PATH_UUID = Pattern.compile(
            "/([0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12})");

    public Optional<String> find(SchematicDocument document) {
        for (SymbolInstance instance : document.getSymbolInstances()) {
            for (InstancePath path : instance.getInstancePaths()) {
                Matcher m = PATH_UUID.matcher(path.path());
                if (m.find()) {
                    return Optional.of(m.group(1));
                }
            }
        }
        return Optional.empty();
    }

    public String resolve(SchematicDocument document) {
        return find(document).orElseGet(() -> UUID.randomUUID().toString());
    }
}
