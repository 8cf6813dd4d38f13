package work.lcod.crosscheck.dump;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

class SExpressionDumpParserTest {
    private final SExpressionDumpParser parser = new SExpressionDumpParser();

    @Test
    void stripsPositionsAndKeepsChildOrder() {
        var root = parser.parse("(root [0,0]-[1,0] (a [0,0]-[0,1]) (b [0,1]-[0,2]))");
        assertEquals(Node.of("root", Node.leaf("a"), Node.leaf("b")), root);
    }

    @Test
    void parsesMultiLineCliOutput() {
        var root = parser.parse(String.join("\n",
            "(source_file [0, 0] - [3, 0]",
            "  (class_declaration [2, 0] - [2, 12]",
            "    (type_identifier [2, 6] - [2, 9])))",
            ""));
        assertEquals("source_file(class_declaration(type_identifier))", root.toString());
    }

    @Test
    void skipsFieldLabels() {
        var root = parser.parse("(call_expression function: (simple_identifier) (call_suffix))");
        assertEquals(List.of("simple_identifier", "call_suffix"),
            root.children().stream().map(Node::name).toList());
    }

    @Test
    void blankInputIsAnEmptySourceFile() {
        assertEquals(Node.leaf("source_file"), parser.parse(""));
        assertEquals(Node.leaf("source_file"), parser.parse("  \n"));
        assertEquals(Node.leaf("source_file"), parser.parse(null));
    }

    @Test
    void tokenizerSeparatesParentheses() {
        assertEquals(List.of("(", "a", "(", "b", ")", ")"), SExpressionDumpParser.tokenize("(a(b))"));
    }

    @Test
    void rejectsUnclosedTerm() {
        var ex = assertThrows(MalformedDumpException.class, () -> parser.parse("(a (b)"));
        assertEquals(Dialect.CANDIDATE, ex.dialect());
        assertTrue(ex.getMessage().contains("unclosed"));
    }

    @Test
    void rejectsStrayClosingParenthesis() {
        var ex = assertThrows(MalformedDumpException.class, () -> parser.parse("(a))"));
        assertTrue(ex.getMessage().endsWith("(token 3)"), ex.getMessage());
    }

    @Test
    void rejectsNamelessTerm() {
        assertThrows(MalformedDumpException.class, () -> parser.parse("(() a)"));
        assertThrows(MalformedDumpException.class, () -> parser.parse("()"));
    }

    @Test
    void rejectsBarewordRoot() {
        assertThrows(MalformedDumpException.class, () -> parser.parse("source_file"));
    }

    @Test
    void neverKeepsPositionText() {
        var root = parser.parse("(a [10, 2] - [11, 0] (b [10, 4] - [10, 5]))");
        assertFalse(root.toString().contains("["));
    }
}
