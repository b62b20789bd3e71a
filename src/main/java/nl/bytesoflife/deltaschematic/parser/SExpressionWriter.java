package nl.bytesoflife.deltaschematic.parser;

import java.util.List;

/**
 * Serializes {@link SNode} trees. The pretty form follows the layout KiCad itself writes:
 * tab indentation, lists without nested lists on one line, and the closing parenthesis
 * of a multi-line list on its own line.
 */
public class SExpressionWriter {

    public String write(SNode node, boolean prettyPrint) {
        return write(List.of(node), prettyPrint);
    }

    public String write(List<SNode> nodes, boolean prettyPrint) {
        StringBuilder sb = new StringBuilder();
        for (SNode node : nodes) {
            if (prettyPrint) {
                writePretty(node, 0, sb);
                sb.append('\n');
            } else {
                if (sb.length() > 0) sb.append(' ');
                sb.append(node);
            }
        }
        return sb.toString();
    }

    private void writePretty(SNode node, int depth, StringBuilder sb) {
        indent(depth, sb);
        if (node instanceof SNode.SAtom atom) {
            sb.append(atom);
            return;
        }
        SNode.SList list = (SNode.SList) node;
        if (!hasNestedList(list)) {
            sb.append(list);
            return;
        }

        sb.append('(');
        List<SNode> children = list.children();
        int i = 0;
        // Tag and leading atoms stay on the opening line
        while (i < children.size() && children.get(i) instanceof SNode.SAtom atom) {
            if (i > 0) sb.append(' ');
            sb.append(atom);
            i++;
        }
        for (; i < children.size(); i++) {
            sb.append('\n');
            writePretty(children.get(i), depth + 1, sb);
        }
        sb.append('\n');
        indent(depth, sb);
        sb.append(')');
    }

    private static boolean hasNestedList(SNode.SList list) {
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList) return true;
        }
        return false;
    }

    private static void indent(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append('\t');
        }
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
