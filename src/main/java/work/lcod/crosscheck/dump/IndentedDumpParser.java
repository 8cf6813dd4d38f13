package work.lcod.crosscheck.dump;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.crosscheck.mapping.ReferenceKind;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

/**
 * Parser for JetBrains PSI text dumps:
 * <pre>
 * KtFile: BabySteps.kt
 *   PACKAGE_DIRECTIVE
 *     PsiElement(package)('package')
 *     REFERENCE_EXPRESSION
 *       PsiElement(IDENTIFIER)('foo')
 * </pre>
 * Only composite (UPPER_SNAKE_CASE) lines become nodes; terminal, whitespace, comment,
 * error and empty-list lines are noise.
 */
public final class IndentedDumpParser implements DumpParser {
    private static final Pattern ROOT = Pattern.compile("^([A-Za-z][A-Za-z0-9_]*):(\\s.*)?$");
    private static final Pattern COMPOSITE = Pattern.compile("^[A-Z][A-Z0-9_]*$");
    private static final List<String> NOISE_PREFIXES = List.of(
        "PsiElement(",
        "PsiWhiteSpace(",
        "PsiComment(",
        "PsiErrorElement",
        "<empty list>"
    );

    @Override
    public Dialect dialect() {
        return Dialect.REFERENCE;
    }

    @Override
    public Node parse(String text) {
        List<Line> lines = classify(text == null ? "" : text);
        if (lines.isEmpty()) {
            return Node.leaf(ReferenceKind.KT_FILE.dumpName());
        }
        Line first = lines.get(0);
        if (!first.root()) {
            throw new MalformedDumpException(Dialect.REFERENCE, first.number(),
                "expected a '<RootType>: <name>' line before '" + first.name() + "'");
        }

        var root = new Builder(first.name(), first.depth());
        Deque<Builder> stack = new ArrayDeque<>();
        stack.push(root);
        for (int i = 1; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.root()) {
                throw new MalformedDumpException(Dialect.REFERENCE, line.number(),
                    "second root line '" + line.name() + "'");
            }
            if (line.depth() <= root.depth) {
                throw new MalformedDumpException(Dialect.REFERENCE, line.number(),
                    "invalid indentation jump: '" + line.name() + "' is not nested under the root");
            }
            while (stack.size() > 1 && stack.peek().depth >= line.depth()) {
                stack.pop();
            }
            var child = new Builder(line.name(), line.depth());
            stack.peek().children.add(child);
            stack.push(child);
        }
        return root.build();
    }

    private static List<Line> classify(String text) {
        var result = new ArrayList<Line>();
        String[] raw = text.split("\\R", -1);
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i];
            if (line.isBlank()) {
                continue;
            }
            String trimmed = line.strip();
            if (isNoise(trimmed)) {
                continue;
            }
            int depth = indentation(line, i + 1);
            var rootMatch = ROOT.matcher(trimmed);
            if (rootMatch.matches()) {
                result.add(new Line(i + 1, depth, rootMatch.group(1), true));
            } else if (COMPOSITE.matcher(trimmed).matches()) {
                result.add(new Line(i + 1, depth, trimmed, false));
            }
        }
        return result;
    }

    private static boolean isNoise(String trimmed) {
        for (String prefix : NOISE_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static int indentation(String line, int number) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            if (line.charAt(count) != ' ') {
                throw new MalformedDumpException(Dialect.REFERENCE, number,
                    "indentation must use spaces, found " + describe(line.charAt(count)));
            }
            count++;
        }
        return count;
    }

    private static String describe(char c) {
        return c == '\t' ? "a tab" : String.format("U+%04X", (int) c);
    }

    private record Line(int number, int depth, String name, boolean root) {}

    private static final class Builder {
        private final String name;
        private final int depth;
        private final List<Builder> children = new ArrayList<>();

        Builder(String name, int depth) {
            this.name = name;
            this.depth = depth;
        }

        Node build() {
            var built = new ArrayList<Node>(children.size());
            for (Builder child : children) {
                built.add(child.build());
            }
            return new Node(name, built);
        }
    }
}
