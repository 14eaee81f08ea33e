package io.github.eutro.rvsdg.term;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the {@code (let name term)} forms written by {@link TermPrinter}.
 * <p>
 * A bare symbol that names an earlier binding stands for that binding's term. Line comments start with {@code ;}.
 */
public final class TermParser {
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
    private static final Pattern FLOAT = Pattern.compile("-?([0-9]+\\.[0-9]*([eE][-+]?[0-9]+)?|[0-9]+[eE][-+]?[0-9]+|NaN|Infinity)");

    private final String text;
    private int pos = 0;
    private final Map<String, Term> bindings = new LinkedHashMap<>();

    private TermParser(String text) {
        this.text = text;
    }

    /**
     * Parse a sequence of bindings.
     *
     * @param text The text.
     * @return Every binding, including shared subterms, in the order they appear.
     * @throws TermFormatException If the text is malformed.
     */
    public static Map<String, Term> parse(String text) {
        TermParser parser = new TermParser(text);
        while (parser.skipSpace()) {
            parser.let();
        }
        return parser.bindings;
    }

    /**
     * Parse a single term, with no bindings in scope.
     *
     * @param text The text.
     * @return The term.
     * @throws TermFormatException If the text is malformed.
     */
    public static Term parseTerm(String text) {
        TermParser parser = new TermParser(text);
        Term term = parser.term();
        if (parser.skipSpace()) throw parser.error("Trailing input");
        return term;
    }

    private TermFormatException error(String message) {
        int line = 1;
        int col = 1;
        for (int i = 0; i < pos && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return new TermFormatException(String.format("%s at %d:%d", message, line, col));
    }

    private boolean skipSpace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ';') {
                while (pos < text.length() && text.charAt(pos) != '\n') pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else {
                return true;
            }
        }
        return false;
    }

    private void expect(char c) {
        if (!skipSpace() || text.charAt(pos) != c) throw error("Expected '" + c + "'");
        pos++;
    }

    private void let() {
        expect('(');
        if (!"let".equals(atom())) throw error("Expected let");
        String name = atom();
        if (bindings.containsKey(name)) throw error("Duplicate binding " + name);
        Term term = term();
        expect(')');
        bindings.put(name, term);
    }

    private String atom() {
        if (!skipSpace()) throw error("Unexpected end of input");
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';') break;
            pos++;
        }
        if (start == pos) throw error("Expected an atom");
        return text.substring(start, pos);
    }

    private Term term() {
        if (!skipSpace()) throw error("Unexpected end of input");
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            String head = atom();
            List<Term> args = new ArrayList<>();
            while (true) {
                if (!skipSpace()) throw error("Unclosed list");
                if (text.charAt(pos) == ')') break;
                args.add(term());
            }
            pos++;
            return Term.app(head, args);
        } else if (c == '"') {
            return Term.str(string());
        } else if (c == ')') {
            throw error("Unexpected ')'");
        }
        String atom = atom();
        Term bound = bindings.get(atom);
        if (bound != null) return bound;
        if (INTEGER.matcher(atom).matches()) {
            try {
                return Term.num(Long.parseLong(atom));
            } catch (NumberFormatException e) {
                throw error("Integer out of range: " + atom);
            }
        }
        if (FLOAT.matcher(atom).matches()) return Term.flt(Double.parseDouble(atom));
        return Term.sym(atom);
    }

    private String string() {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= text.length()) throw error("Unclosed string");
            char c = text.charAt(pos++);
            if (c == '"') return sb.toString();
            if (c == '\\') {
                if (pos >= text.length()) throw error("Unclosed string");
                c = text.charAt(pos++);
            }
            sb.append(c);
        }
    }
}
