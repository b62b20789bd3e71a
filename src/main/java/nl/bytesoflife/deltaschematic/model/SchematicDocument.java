package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.parser.SExpressionParser;
import nl.bytesoflife.deltaschematic.parser.SExpressionWriter;
import nl.bytesoflife.deltaschematic.parser.SNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A parsed {@code .kicad_sch} file. Wraps the root {@code (kicad_sch ...)} list, exposes
 * its sections and owns the rule for where new content goes: every element added to a
 * schematic is inserted immediately before the terminal {@code sheet_instances} section.
 */
public class SchematicDocument {

    public static final String ROOT_TAG = "kicad_sch";
    public static final String LIB_SYMBOLS = "lib_symbols";
    public static final String SHEET_INSTANCES = "sheet_instances";
    public static final String JUNCTION = "junction";

    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final SNode.SList root;
    private Set<String> knownUuids;

    public SchematicDocument(SNode.SList root) {
        if (!root.hasTag(ROOT_TAG)) {
            throw new SchematicException(ErrorKind.STRUCTURAL_INVARIANT_VIOLATION,
                    "Root element is '" + root.tag() + "', expected '" + ROOT_TAG + "'");
        }
        if (root.findAll(LIB_SYMBOLS).size() > 1) {
            throw new SchematicException(ErrorKind.STRUCTURAL_INVARIANT_VIOLATION,
                    "Schematic contains more than one " + LIB_SYMBOLS + " section");
        }
        this.root = root;
    }

    public static SchematicDocument parse(String content) {
        List<SNode> nodes = new SExpressionParser().parse(content);
        if (nodes.size() != 1 || !(nodes.get(0) instanceof SNode.SList list)) {
            throw new SchematicException(ErrorKind.STRUCTURAL_INVARIANT_VIOLATION,
                    "Expected a single root list, found " + nodes.size() + " top-level expressions");
        }
        return new SchematicDocument(list);
    }

    public static SchematicDocument load(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            throw new SchematicException(ErrorKind.FILE_NOT_FOUND, "Schematic not found: " + path, e);
        } catch (IOException e) {
            throw new SchematicException(ErrorKind.IO_ERROR, "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes through a temporary file in the target directory that is then moved over the
     * target. An existing target keeps its POSIX permissions; new files get {@code rw-r--r--}.
     */
    public void save(Path path) {
        writeAtomically(path, serialize(true));
    }

    public static void writeAtomically(Path path, String content) {
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            if (POSIX) {
                Files.setPosixFilePermissions(tmp, Files.exists(target)
                        ? Files.getPosixFilePermissions(target)
                        : DEFAULT_PERMISSIONS);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new SchematicException(ErrorKind.IO_ERROR, "Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    public String serialize(boolean prettyPrint) {
        return new SExpressionWriter().write(root, prettyPrint);
    }

    public SNode.SList getRoot() {
        return root;
    }

    public Optional<SNode.SList> locateSection(String tag) {
        return root.find(tag);
    }

    public SNode.SList requireLibSymbols() {
        return locateSection(LIB_SYMBOLS).orElseThrow(() -> new SchematicException(
                ErrorKind.STRUCTURAL_INVARIANT_VIOLATION, "Schematic has no " + LIB_SYMBOLS + " section"));
    }

    public Optional<SNode.SList> findCachedSymbol(String libId) {
        return locateSection(LIB_SYMBOLS).flatMap(lib -> {
            for (SNode.SList symbol : lib.findAll(SymbolInstance.TAG)) {
                if (libId.equals(symbol.atomValue(1))) {
                    return Optional.of(symbol);
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Inserts a top-level node before {@code sheet_instances}, or appends it when the
     * section is absent.
     *
     * @return the index the node was inserted at
     */
    public int insertBeforeSheetInstances(SNode.SList node) {
        List<SNode> children = root.children();
        int index = children.size();
        for (int i = 1; i < children.size(); i++) {
            if (children.get(i) instanceof SNode.SList list && list.hasTag(SHEET_INSTANCES)) {
                index = i;
                break;
            }
        }
        children.add(index, node);
        if (knownUuids != null) {
            collectUuids(node, knownUuids);
        }
        return index;
    }

    public List<SymbolInstance> getSymbolInstances() {
        List<SymbolInstance> instances = new ArrayList<>();
        for (SNode.SList symbol : root.findAll(SymbolInstance.TAG)) {
            instances.add(new SymbolInstance(symbol));
        }
        return instances;
    }

    public Optional<SymbolInstance> findInstance(String reference) {
        for (SymbolInstance instance : getSymbolInstances()) {
            if (reference.equals(instance.getReference())) {
                return Optional.of(instance);
            }
        }
        return Optional.empty();
    }

    public List<Wire> getWires() {
        List<Wire> wires = new ArrayList<>();
        for (SNode.SList node : root.findAll(Wire.TAG)) {
            wires.add(Wire.fromNode(node));
        }
        return wires;
    }

    public List<Label> getLabels() {
        List<Label> labels = new ArrayList<>();
        for (SNode child : root.children()) {
            if (child instanceof SNode.SList list) {
                LabelKind kind = LabelKind.fromTag(list.tag());
                if (kind != null) {
                    labels.add(Label.fromNode(kind, list));
                }
            }
        }
        return labels;
    }

    /**
     * Removes every placed symbol whose Reference is in the given set. Library templates
     * live inside {@code lib_symbols} and are never candidates.
     *
     * @return references of the removed instances, in document order
     */
    public List<String> removeInstances(Collection<String> references) {
        List<String> removed = new ArrayList<>();
        Iterator<SNode> it = root.children().iterator();
        while (it.hasNext()) {
            if (it.next() instanceof SNode.SList list && list.hasTag(SymbolInstance.TAG)) {
                String reference = new SymbolInstance(list).getReference();
                if (references.contains(reference)) {
                    it.remove();
                    removed.add(reference);
                }
            }
        }
        return removed;
    }

    /**
     * Removes all wires, junctions and labels of any kind.
     *
     * @return number of removed nodes
     */
    public int removeConnections() {
        int removed = 0;
        Iterator<SNode> it = root.children().iterator();
        while (it.hasNext()) {
            if (it.next() instanceof SNode.SList list && isConnection(list.tag())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public static boolean isConnection(String tag) {
        return Wire.TAG.equals(tag) || JUNCTION.equals(tag) || LabelKind.fromTag(tag) != null;
    }

    /**
     * Mints a random UUID that does not occur anywhere in the document yet.
     */
    public String newUuid() {
        if (knownUuids == null) {
            knownUuids = collectUuids();
        }
        String uuid;
        do {
            uuid = UUID.randomUUID().toString();
        } while (!knownUuids.add(uuid));
        return uuid;
    }

    public Set<String> collectUuids() {
        Set<String> uuids = new HashSet<>();
        collectUuids(root, uuids);
        return uuids;
    }

    private static void collectUuids(SNode.SList start, Set<String> uuids) {
        Deque<SNode.SList> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            SNode.SList current = stack.pop();
            if (current.hasTag("uuid") && current.children().size() > 1) {
                uuids.add(current.atomValue(1));
            }
            for (SNode child : current.children()) {
                if (child instanceof SNode.SList list) {
                    stack.push(list);
                }
            }
        }
    }
}
