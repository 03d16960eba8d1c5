package com.formulagrid.app.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Post-order fold of an expression tree using heap-allocated stacks instead of recursion.
 */
public final class ExpressionWalker {

    private ExpressionWalker() {
    }

    public static <R> R fold(Expression root, ExpressionVisitor<R> visitor) {
        Deque<Frame> work = new ArrayDeque<>();
        Deque<R> results = new ArrayDeque<>();
        work.push(new Frame(root));

        while (!work.isEmpty()) {
            Frame frame = work.pop();
            List<Expression> operands = frame.node.operands();
            if (frame.expanded || operands.isEmpty()) {
                results.push(frame.node.accept(visitor, popResults(results, operands.size())));
            } else {
                // Revisit this node once all operands have been folded
                frame.expanded = true;
                work.push(frame);
                for (int i = operands.size() - 1; i >= 0; i--) {
                    work.push(new Frame(operands.get(i)));
                }
            }
        }
        return results.pop();
    }

    private static <R> List<R> popResults(Deque<R> results, int count) {
        if (count == 0) {
            return Collections.emptyList();
        }
        List<R> operandResults = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            operandResults.add(results.pop());
        }
        // Operands were pushed left to right, so they come off the stack reversed
        Collections.reverse(operandResults);
        return operandResults;
    }

    private static final class Frame {
        private final Expression node;
        private boolean expanded;

        private Frame(Expression node) {
            this.node = node;
        }
    }
}
