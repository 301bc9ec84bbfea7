package com.complexityscan.core.metrics;

import com.complexityscan.core.model.NormalizedNodeKind;
import com.complexityscan.core.normalize.NodeClassifier;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Computes cyclomatic and cognitive complexity of one function.
 *
 * <p>The body is walked in pre-order with an explicit stack, so pathologically deep
 * files cannot overflow the Java stack. Nested functions are not entered: they are
 * scored separately by whoever enumerates functions.
 *
 * <ul>
 *   <li><b>Cyclomatic:</b> 1, plus 1 per if, loop, case arm, exception handler and
 *       short-circuit operator.</li>
 *   <li><b>Cognitive:</b> each decision point adds {@code 1 + nesting}; structural
 *       constructs raise the nesting level of their descendants only.</li>
 *   <li><b>Max nesting:</b> the deepest level opened by a structural construct.</li>
 * </ul>
 */
public class ComplexityCalculator {

    private final NodeClassifier classifier;

    public ComplexityCalculator(NodeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Scores a function node.
     *
     * @param function node classified as {@link NormalizedNodeKind#FUNCTION}
     * @return complexity of the function's own body
     */
    public ComplexityScore measure(TSNode function) {
        int cyclomatic = 1;
        int cognitive = 0;
        int maxNesting = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        pushChildren(stack, function, 0);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            NormalizedNodeKind kind = classifier.classify(frame.node());
            if (kind == NormalizedNodeKind.FUNCTION) {
                continue;
            }

            int childNesting = frame.nesting();
            if (kind.isDecisionPoint()) {
                cyclomatic++;
                cognitive += 1 + frame.nesting();
            }
            if (kind.increasesNesting()) {
                childNesting = frame.nesting() + 1;
                maxNesting = Math.max(maxNesting, childNesting);
            }
            pushChildren(stack, frame.node(), childNesting);
        }
        return new ComplexityScore(cyclomatic, cognitive, maxNesting);
    }

    // reverse push keeps the pop order equal to source order
    private static void pushChildren(Deque<Frame> stack, TSNode node, int nesting) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                stack.push(new Frame(child, nesting));
            }
        }
    }

    private record Frame(TSNode node, int nesting) {}
}
