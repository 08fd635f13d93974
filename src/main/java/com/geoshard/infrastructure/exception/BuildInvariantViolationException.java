package com.geoshard.infrastructure.exception;

/**
 * A shard build hit a state that correct inputs can never produce, e.g. a seed/level mismatch
 * between the enumerator and the scorer. Fatal; the build is not retried.
 */
public class BuildInvariantViolationException extends GeoshardException {

    public static final String NO_CELLS_ENUMERATED = "NO_CELLS_ENUMERATED";
    public static final String CELL_NOT_ENUMERATED = "CELL_NOT_ENUMERATED";
    public static final String EMPTY_CELL_SET = "EMPTY_CELL_SET";
    public static final String NEGATIVE_CELL_SCORE = "NEGATIVE_CELL_SCORE";
    public static final String SCORE_OVERFLOW = "SCORE_OVERFLOW";

    public BuildInvariantViolationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static BuildInvariantViolationException noCellsEnumerated(int storageLevel) {
        return new BuildInvariantViolationException(NO_CELLS_ENUMERATED,
            "no cells enumerated at storage level " + storageLevel + " (invalid seed cell)");
    }

    public static BuildInvariantViolationException cellNotEnumerated(Object user, Object cell, int storageLevel) {
        return new BuildInvariantViolationException(CELL_NOT_ENUMERATED,
            "cell for user not found in enumerated set: user=" + user + ", cell=" + cell + ", level=" + storageLevel);
    }

    public static BuildInvariantViolationException emptyCellSet() {
        return new BuildInvariantViolationException(EMPTY_CELL_SET, "cannot partition an empty cell set");
    }

    public static BuildInvariantViolationException negativeScore(Object cell, long score) {
        return new BuildInvariantViolationException(NEGATIVE_CELL_SCORE,
            "cell scores must be non-negative: cell=" + cell + ", score=" + score);
    }

    public static BuildInvariantViolationException scoreOverflow(Object cell, long addend) {
        return new BuildInvariantViolationException(SCORE_OVERFLOW,
            "load overflows a long: cell=" + cell + ", adding=" + addend);
    }
}
