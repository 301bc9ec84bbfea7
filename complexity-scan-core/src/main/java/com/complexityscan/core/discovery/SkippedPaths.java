package com.complexityscan.core.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Tally of what discovery left out and why.
 *
 * <p>Written by the single thread that drains the discovery sequence; read after the
 * walk has finished.
 */
public final class SkippedPaths {

    static final String NO_EXTENSION = "(none)";
    private static final int MAX_EXAMPLES = 10;

    private int binary;
    private int unrecognized;
    private int permissionDenied;
    private int symlinkCycles;
    private int ignored;
    private final SortedMap<String, Integer> unrecognizedExtensions = new TreeMap<>();
    private final List<String> problems = new ArrayList<>();

    void recordBinary(String relativePath, String reason) {
        binary++;
        remember(relativePath + ": " + reason);
    }

    void recordUnrecognized(String extension) {
        unrecognized++;
        unrecognizedExtensions.merge(extension.isEmpty() ? NO_EXTENSION : extension, 1, Integer::sum);
    }

    void recordPermissionDenied(String relativePath) {
        permissionDenied++;
        remember(relativePath + ": permission denied");
    }

    void recordSymlinkCycle(String relativePath) {
        symlinkCycles++;
        remember(relativePath + ": symlink cycle");
    }

    void recordIgnored() {
        ignored++;
    }

    private void remember(String problem) {
        if (problems.size() < MAX_EXAMPLES) {
            problems.add(problem);
        }
    }

    public int binary() {
        return binary;
    }

    public int unrecognized() {
        return unrecognized;
    }

    public int permissionDenied() {
        return permissionDenied;
    }

    public int symlinkCycles() {
        return symlinkCycles;
    }

    public int ignored() {
        return ignored;
    }

    public SortedMap<String, Integer> unrecognizedExtensions() {
        return Collections.unmodifiableSortedMap(unrecognizedExtensions);
    }

    /**
     * First few skip reasons, for diagnostics.
     *
     * @return up to ten messages
     */
    public List<String> problems() {
        return List.copyOf(problems);
    }
}
