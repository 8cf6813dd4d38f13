package work.lcod.crosscheck.dump;

import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

/**
 * Turns the textual dump of one dialect into a raw {@link Node} tree.
 */
public interface DumpParser {
    Dialect dialect();

    /**
     * Parses a dump. Blank input yields the dialect's empty compilation unit.
     *
     * @throws MalformedDumpException when the text violates the dump format
     */
    Node parse(String text);
}
