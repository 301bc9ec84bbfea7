package com.complexityscan.core.model;

/**
 * Language-agnostic category a concrete syntax node is classified into.
 *
 * <p>The complexity algorithms only ever look at these categories, never at
 * grammar-specific node names. Anything a language table does not mention is
 * {@link #OTHER} and is ignored for complexity.
 */
public enum NormalizedNodeKind {
    FUNCTION,
    IF,
    LOOP,
    SWITCH_CASE_ARM,
    EXCEPTION_HANDLER,
    BOOLEAN_SHORT_CIRCUIT_OP,
    OTHER;

    /**
     * Whether this kind counts as a decision point (adds to cyclomatic complexity).
     *
     * @return true for branches, loops, case arms, handlers and short-circuit operators
     */
    public boolean isDecisionPoint() {
        return this != FUNCTION && this != OTHER;
    }

    /**
     * Whether this kind opens a new nesting level for its descendants.
     *
     * @return true for structural decision constructs
     */
    public boolean increasesNesting() {
        return this == IF || this == LOOP || this == SWITCH_CASE_ARM || this == EXCEPTION_HANDLER;
    }
}
