package work.lcod.crosscheck.model;

/**
 * The two dump dialects under comparison.
 */
public enum Dialect {
    /** tree-sitter-kotlin S-expression dumps. */
    CANDIDATE("tree-sitter"),
    /** JetBrains PSI indented dumps, the trusted baseline. */
    REFERENCE("psi");

    private final String label;

    Dialect(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
