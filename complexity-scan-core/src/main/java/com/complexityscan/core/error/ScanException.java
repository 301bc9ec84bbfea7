package com.complexityscan.core.error;

import java.util.Objects;

/**
 * Raised when a scan cannot complete.
 *
 * <p>Only {@link ErrorKind#isFatal() fatal} kinds escape a scan. Callers map the kind to
 * an exit status:
 * <pre>{@code
 * try {
 *     ScanReport report = scanner.scan(root);
 * } catch (ScanException e) {
 *     if (e.getKind() == ErrorKind.TIMEOUT) {
 *         // partial work is discarded
 *     }
 * }
 * }</pre>
 */
public class ScanException extends RuntimeException {

    private final ErrorKind kind;

    public ScanException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ScanException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isFatal() {
        return kind.isFatal();
    }
}
