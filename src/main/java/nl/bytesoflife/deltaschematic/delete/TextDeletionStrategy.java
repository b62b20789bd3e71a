package nl.bytesoflife.deltaschematic.delete;

import nl.bytesoflife.deltaschematic.model.SchematicDocument;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.parser.SExpressionParser.ParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deletes elements by scanning the file line by line, without parsing it. Retained lines
 * are copied byte for byte.
 * <p>
 * Two layouts of a block start are recognised:
 * <pre>
 *   (symbol (lib_id "Device:R") ...        inline
 *
 *   (                                      split
 *     symbol
 * </pre>
 * A block ends on the line where its parenthesis balance returns to zero. Everything
 * inside {@code lib_symbols} is copied verbatim.
 */
public class TextDeletionStrategy implements DeletionStrategy {

    public static final String NAME = "text";

    private static final Pattern INLINE_REFERENCE =
            Pattern.compile("property\\s+\"Reference\"\\s+\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern REFERENCE_KEY_ONLY =
            Pattern.compile("\\(?property\\s+\"Reference\"\\s*$");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DeletionResult deleteInstances(String content, Set<String> references) {
        List<String> deleted = new ArrayList<>();
        String result = scan(content, SymbolInstance.TAG::equals, block -> {
            String reference = extractReference(block);
            if (reference != null && references.contains(reference)) {
                deleted.add(reference);
                return true;
            }
            return false;
        });
        return new DeletionResult(result, deleted, deleted.size(), NAME);
    }

    @Override
    public DeletionResult deleteConnections(String content) {
        int[] removed = {0};
        String result = scan(content, SchematicDocument::isConnection, block -> {
            removed[0]++;
            return true;
        });
        return new DeletionResult(result, List.of(), removed[0], NAME);
    }

    private String scan(String content, Predicate<String> blockTag, Predicate<List<String>> drop) {
        String[] lines = content.split("\n", -1);
        List<String> output = new ArrayList<>(lines.length);

        boolean inLibSymbols = false;
        int libSymbolsDepth = 0;
        int depth = 0;

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            String stripped = line.strip();

            if (!inLibSymbols && opensLibSymbols(stripped)) {
                inLibSymbols = true;
                // In the split layout the "(" of the section was on the previous line
                libSymbolsDepth = stripped.equals(SchematicDocument.LIB_SYMBOLS) ? depth - 1 : depth;
            }
            if (inLibSymbols) {
                output.add(line);
                depth += balance(line);
                if (depth <= libSymbolsDepth) {
                    inLibSymbols = false;
                }
                i++;
                continue;
            }

            String tag = blockStartTag(lines, i);
            if (tag != null && blockTag.test(tag)) {
                int end = findBlockEnd(lines, i);
                List<String> block = Arrays.asList(lines).subList(i, end + 1);
                if (!drop.test(block)) {
                    output.addAll(block);
                }
                i = end + 1;
                continue;
            }

            output.add(line);
            depth += balance(line);
            i++;
        }
        return String.join("\n", output);
    }

    private static boolean opensLibSymbols(String stripped) {
        return stripped.equals(SchematicDocument.LIB_SYMBOLS)
                || startsWithTag(stripped, SchematicDocument.LIB_SYMBOLS);
    }

    /**
     * Tag of the block starting at line {@code i}, or null if no block starts there.
     */
    static String blockStartTag(String[] lines, int i) {
        String stripped = lines[i].strip();
        if (stripped.equals("(")) {
            if (i + 1 < lines.length) {
                String next = lines[i + 1].strip();
                if (!next.isEmpty() && next.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_')) {
                    return next;
                }
            }
            return null;
        }
        if (stripped.length() > 1 && stripped.charAt(0) == '(') {
            int end = 1;
            while (end < stripped.length()) {
                char c = stripped.charAt(end);
                if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"') break;
                end++;
            }
            return end > 1 ? stripped.substring(1, end) : null;
        }
        return null;
    }

    private static boolean startsWithTag(String stripped, String tag) {
        if (!stripped.startsWith("(" + tag)) return false;
        int next = tag.length() + 1;
        if (next == stripped.length()) return true;
        char c = stripped.charAt(next);
        return Character.isWhitespace(c) || c == '(' || c == ')';
    }

    private static int findBlockEnd(String[] lines, int start) {
        int balance = 0;
        for (int j = start; j < lines.length; j++) {
            balance += balance(lines[j]);
            if (balance == 0) {
                return j;
            }
            if (balance < 0) {
                throw new ParseException("Block starting on line " + (start + 1)
                        + " closes more lists than it opens on line " + (j + 1), offsetOf(lines, j));
            }
        }
        throw new ParseException("Block starting on line " + (start + 1)
                + " is not closed before the end of the file", offsetOf(lines, start));
    }

    /**
     * Open minus close parentheses on a line, ignoring those inside quoted strings.
     */
    static int balance(String line) {
        int balance = 0;
        boolean inString = false;
        for (int k = 0; k < line.length(); k++) {
            char c = line.charAt(k);
            if (inString) {
                if (c == '\\') {
                    k++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '(') {
                balance++;
            } else if (c == ')') {
                balance--;
            }
        }
        return balance;
    }

    /**
     * Finds the Reference property value in either the inline form
     * {@code (property "Reference" "R1" ...} or the split form where
     * {@code property}, {@code "Reference"} and {@code "R1"} are on separate lines.
     */
    static String extractReference(List<String> block) {
        boolean afterProperty = false;
        boolean afterKey = false;
        for (String line : block) {
            String stripped = line.strip();
            if (stripped.isEmpty()) continue;

            Matcher inline = INLINE_REFERENCE.matcher(stripped);
            if (inline.find()) {
                return unescape(inline.group(1));
            }
            if (afterKey) {
                if (isQuoted(stripped)) {
                    return unescape(stripped.substring(1, stripped.length() - 1));
                }
                afterKey = false;
            }
            if (REFERENCE_KEY_ONLY.matcher(stripped).find()) {
                afterKey = true;
                afterProperty = false;
                continue;
            }
            if (afterProperty) {
                afterKey = stripped.equals("\"Reference\"");
                afterProperty = false;
                continue;
            }
            afterProperty = stripped.equals("property") || stripped.equals("(property");
        }
        return null;
    }

    private static boolean isQuoted(String s) {
        return s.length() >= 2 && s.charAt(0) == '"' && s.charAt(s.length() - 1) == '"';
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        for (int k = 0; k < s.length(); k++) {
            char c = s.charAt(k);
            if (c == '\\' && k + 1 < s.length()) {
                k++;
                c = s.charAt(k);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static int offsetOf(String[] lines, int lineIndex) {
        int offset = 0;
        for (int k = 0; k < lineIndex; k++) {
            offset += lines[k].length() + 1;
        }
        return offset;
    }
}
