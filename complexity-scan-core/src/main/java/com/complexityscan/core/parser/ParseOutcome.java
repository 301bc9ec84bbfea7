package com.complexityscan.core.parser;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Result of parsing one file: either a syntax tree or a failure reason.
 *
 * <p>The tree is only valid while the outcome is referenced; callers compute metrics and
 * then drop it so native memory is released file by file.
 *
 * @param tree parsed tree, {@code null} on failure
 * @param source UTF-8 bytes the tree's byte offsets refer to (BOM removed)
 * @param lineCount number of source lines
 * @param hasSyntaxErrors whether the grammar had to recover from errors
 * @param failureReason why parsing failed, {@code null} on success
 */
public record ParseOutcome(
    TSTree tree,
    byte[] source,
    int lineCount,
    boolean hasSyntaxErrors,
    String failureReason
) {
    public ParseOutcome {
        if (tree == null && failureReason == null) {
            failureReason = "no syntax tree produced";
        }
        if (source == null) {
            source = new byte[0];
        }
    }

    public static ParseOutcome parsed(TSTree tree, byte[] source, int lineCount, boolean hasSyntaxErrors) {
        return new ParseOutcome(Objects.requireNonNull(tree, "tree must not be null"),
            source, lineCount, hasSyntaxErrors, null);
    }

    public static ParseOutcome failed(String reason) {
        return new ParseOutcome(null, null, 0, false, reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public TSNode root() {
        if (tree == null) {
            throw new IllegalStateException("No tree: " + failureReason);
        }
        return tree.getRootNode();
    }

    /**
     * Source text covered by a node.
     *
     * @param node node of this outcome's tree
     * @return node text, or empty string for null or out-of-range nodes
     */
    public String textOf(TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start < 0 || end > source.length || start >= end) {
            return "";
        }
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }
}
