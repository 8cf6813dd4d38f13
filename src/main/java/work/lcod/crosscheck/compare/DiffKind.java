package work.lcod.crosscheck.compare;

public enum DiffKind {
    NAME_MISMATCH,
    CHILD_COUNT_MISMATCH,
    EXTRA_CHILD,
    MISSING_CHILD
}
