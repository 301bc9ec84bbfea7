package com.complexityscan.core.error;

/**
 * Error taxonomy of a scan.
 *
 * <p>Fatal kinds abort the scan. The others are recovered where they happen and
 * only show up as per-file statuses and counters.
 */
public enum ErrorKind {
    ROOT_NOT_FOUND(true),
    PERMISSION_DENIED(false),
    UNSUPPORTED_LANGUAGE(false),
    PARSE_FAILURE(false),
    TIMEOUT(true),
    INTERNAL_INVARIANT_VIOLATION(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
