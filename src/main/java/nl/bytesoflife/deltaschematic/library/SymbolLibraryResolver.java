package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.ErrorKind;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.parser.SExpressionParser;
import nl.bytesoflife.deltaschematic.parser.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@code Library:Symbol} ids against {@code .kicad_sym} files in a configured
 * list of directories and copies definitions into a schematic's {@code lib_symbols}
 * cache.
 */
public class SymbolLibraryResolver {

    private static final Logger log = LoggerFactory.getLogger(SymbolLibraryResolver.class);

    public static final String DEFAULT_EXTENSION = ".kicad_sym";

    private final List<Path> searchPaths;
    private String extension = DEFAULT_EXTENSION;
    private final Map<String, SNode.SList> parsedLibraries = new HashMap<>();

    public SymbolLibraryResolver(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(searchPaths);
    }

    public SymbolLibraryResolver(Path... searchPaths) {
        this(List.of(searchPaths));
    }

    /**
     * Override the library file extension (default {@value #DEFAULT_EXTENSION}).
     */
    public SymbolLibraryResolver withExtension(String extension) {
        this.extension = extension.startsWith(".") ? extension : "." + extension;
        return this;
    }

    public List<Path> getSearchPaths() {
        return Collections.unmodifiableList(searchPaths);
    }

    public SymbolDefinition resolve(String libId) {
        LibraryId id = LibraryId.parse(libId);
        SNode.SList library = loadLibrary(id.library());

        for (SNode.SList symbol : library.findAll(SymbolInstance.TAG)) {
            if (id.symbol().equals(symbol.atomValue(1))) {
                log.debug("Resolved {} from library {}", libId, id.library());
                return SymbolDefinition.fromNode(libId, symbol);
            }
        }
        throw new SchematicException(ErrorKind.SYMBOL_NOT_FOUND,
                "Symbol " + id.symbol() + " not found in library " + id.library());
    }

    /**
     * Makes sure the document caches the definition for {@code libId}. Never throws:
     * any failure is logged and reported as {@code false} with the document untouched,
     * so placement can continue without pin data.
     *
     * @return true if the definition was already cached or has been added
     */
    public boolean ensureCached(SchematicDocument document, String libId) {
        try {
            SNode.SList libSymbols = document.requireLibSymbols();
            if (document.findCachedSymbol(libId).isPresent()) {
                log.debug("Symbol {} already in {}", libId, SchematicDocument.LIB_SYMBOLS);
                return true;
            }
            SymbolDefinition definition = resolve(libId);
            libSymbols.add(definition.toCacheNode());
            log.info("Added {} to {}", libId, SchematicDocument.LIB_SYMBOLS);
            return true;
        } catch (SchematicException e) {
            log.warn("Could not cache symbol {} ({}): {}", libId, e.getKind(), e.getMessage());
            return false;
        }
    }

    /**
     * Forget parsed library files, e.g. after they changed on disk.
     */
    public void clearCache() {
        parsedLibraries.clear();
    }

    private SNode.SList loadLibrary(String libraryName) {
        SNode.SList cached = parsedLibraries.get(libraryName);
        if (cached != null) {
            return cached;
        }

        Path file = findLibraryFile(libraryName);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchematicException(ErrorKind.IO_ERROR,
                    "Failed to read library " + file + ": " + e.getMessage(), e);
        }

        List<SNode> nodes = new SExpressionParser().parse(content);
        if (nodes.isEmpty() || !(nodes.get(0) instanceof SNode.SList root)) {
            throw new SchematicException(ErrorKind.LIBRARY_NOT_FOUND, "Library file " + file + " is empty");
        }
        parsedLibraries.put(libraryName, root);
        log.debug("Parsed library {} from {}", libraryName, file);
        return root;
    }

    private Path findLibraryFile(String libraryName) {
        List<Path> tried = new ArrayList<>();
        for (Path dir : searchPaths) {
            Path candidate = dir.resolve(libraryName + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            tried.add(candidate);
        }
        throw new SchematicException(ErrorKind.LIBRARY_NOT_FOUND,
                "Library file not found for " + libraryName + " (searched " + tried + ")");
    }
}
