package nl.bytesoflife.deltaschematic.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A node of a parsed S-expression: either an atom or a list. Lists are mutable so a
 * parsed document can be edited in place.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    /**
     * Deep copy. Lists are copied recursively, atoms are immutable and shared.
     */
    SNode copy();

    static SAtom symbol(String value) {
        return new SAtom(value, false);
    }

    static SAtom string(String value) {
        return new SAtom(value, true);
    }

    static SAtom number(double value) {
        return new SAtom(formatNumber(value), false);
    }

    static SAtom yesNo(boolean value) {
        return symbol(value ? "yes" : "no");
    }

    /**
     * Builds a list whose first child is the bare tag. Items may be nodes, strings
     * (written quoted), numbers or booleans (written as yes/no).
     */
    static SList list(String tag, Object... items) {
        List<SNode> children = new ArrayList<>(items.length + 1);
        children.add(symbol(tag));
        for (Object item : items) {
            if (item instanceof SNode node) {
                children.add(node);
            } else if (item instanceof String s) {
                children.add(string(s));
            } else if (item instanceof Number n) {
                children.add(number(n.doubleValue()));
            } else if (item instanceof Boolean b) {
                children.add(yesNo(b));
            } else {
                throw new IllegalArgumentException("Unsupported S-expression item: " + item);
            }
        }
        return new SList(children);
    }

    /**
     * Formats a coordinate the way KiCad writes them: at most four decimals, no trailing
     * zeros and no negative zero.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    static boolean isBareToken(String value) {
        if (value == null || value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    record SAtom(String value, boolean quoted) implements SNode {

        public SAtom {
            if (value == null) {
                throw new IllegalArgumentException("Atom value must not be null");
            }
            if (!quoted && !isBareToken(value)) {
                throw new IllegalArgumentException("Not a bare token: '" + value + "'");
            }
        }

        public boolean isNumber() {
            if (quoted) return false;
            try {
                Double.parseDouble(value);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }

        public double asDouble() {
            return Double.parseDouble(value);
        }

        @Override
        public SAtom copy() {
            return this;
        }

        @Override
        public String toString() {
            return quoted ? SExpressionWriter.quote(value) : value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public String tag() {
            if (children.isEmpty()) return "";
            SNode first = children.get(0);
            if (first instanceof SAtom atom && !atom.quoted()) {
                return atom.value();
            }
            return "";
        }

        public boolean hasTag(String tag) {
            return tag().equals(tag);
        }

        public String atomValue(int index) {
            if (index >= children.size()) return "";
            SNode node = children.get(index);
            if (node instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public double numberAt(int index, double fallback) {
            if (index >= children.size()) return fallback;
            if (children.get(index) instanceof SAtom atom && atom.isNumber()) {
                return atom.asDouble();
            }
            return fallback;
        }

        public Optional<SList> find(String tag) {
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        public List<SList> findAll(String tag) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    result.add(list);
                }
            }
            return result;
        }

        /**
         * Value of the first atom of the child list with the given tag, e.g.
         * {@code childValue("uuid")} on {@code (wire ... (uuid "x"))} returns {@code x}.
         */
        public Optional<String> childValue(String tag) {
            return find(tag).map(list -> list.atomValue(1));
        }

        public void add(SNode node) {
            children.add(node);
        }

        @Override
        public SList copy() {
            List<SNode> copied = new ArrayList<>(children.size());
            for (SNode child : children) {
                copied.add(child.copy());
            }
            return new SList(copied);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
