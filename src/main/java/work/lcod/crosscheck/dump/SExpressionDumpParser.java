package work.lcod.crosscheck.dump;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.crosscheck.mapping.CandidateKind;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

/**
 * Parser for {@code tree-sitter parse} output:
 * <pre>
 * (source_file [0, 0] - [7, 0]
 *   (class_declaration [4, 0] - [6, 1]
 *     (type_identifier [4, 6] - [4, 14])))
 * </pre>
 * Position annotations are stripped before tokenizing. Barewords in child position
 * (field labels such as {@code name:}) carry no structure and are skipped.
 */
public final class SExpressionDumpParser implements DumpParser {
    private static final Pattern POSITION = Pattern.compile("\\[\\d+,\\s*\\d+\\]\\s*-\\s*\\[\\d+,\\s*\\d+\\]");
    private static final String OPEN = "(";
    private static final String CLOSE = ")";

    @Override
    public Dialect dialect() {
        return Dialect.CANDIDATE;
    }

    @Override
    public Node parse(String text) {
        String cleaned = text == null ? "" : POSITION.matcher(text).replaceAll("");
        List<String> tokens = tokenize(cleaned);
        if (tokens.isEmpty()) {
            return Node.leaf(CandidateKind.SOURCE_FILE.grammarName());
        }
        var cursor = new Cursor(tokens);
        Node root = parseTerm(cursor);
        if (cursor.hasNext()) {
            throw malformed(cursor.position, "unexpected '" + cursor.peek() + "' after the top-level term");
        }
        return root;
    }

    static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char ch = text.charAt(i);
            if (ch == '(' || ch == ')') {
                tokens.add(String.valueOf(ch));
                i++;
            } else if (Character.isWhitespace(ch)) {
                i++;
            } else {
                int start = i;
                while (i < length && !isDelimiter(text.charAt(i))) {
                    i++;
                }
                tokens.add(text.substring(start, i));
            }
        }
        return tokens;
    }

    private static boolean isDelimiter(char ch) {
        return ch == '(' || ch == ')' || Character.isWhitespace(ch);
    }

    private Node parseTerm(Cursor cursor) {
        if (!cursor.hasNext()) {
            throw malformed(cursor.position, "expected '(' but reached end of input");
        }
        if (!OPEN.equals(cursor.peek())) {
            throw malformed(cursor.position, "expected '(' but found '" + cursor.peek() + "'");
        }
        cursor.advance();
        if (!cursor.hasNext() || OPEN.equals(cursor.peek()) || CLOSE.equals(cursor.peek())) {
            throw malformed(cursor.position, "'(' is not followed by a node name");
        }
        String name = cursor.next();

        var children = new ArrayList<Node>();
        while (cursor.hasNext() && !CLOSE.equals(cursor.peek())) {
            if (OPEN.equals(cursor.peek())) {
                children.add(parseTerm(cursor));
            } else {
                cursor.advance();
            }
        }
        if (!cursor.hasNext()) {
            throw malformed(cursor.position, "unclosed '(" + name + "'");
        }
        cursor.advance();
        return new Node(name, children);
    }

    private static MalformedDumpException malformed(int position, String message) {
        return new MalformedDumpException(Dialect.CANDIDATE, position, message);
    }

    private static final class Cursor {
        private final List<String> tokens;
        private int position;

        Cursor(List<String> tokens) {
            this.tokens = tokens;
        }

        boolean hasNext() {
            return position < tokens.size();
        }

        String peek() {
            return tokens.get(position);
        }

        String next() {
            return tokens.get(position++);
        }

        void advance() {
            position++;
        }
    }
}
