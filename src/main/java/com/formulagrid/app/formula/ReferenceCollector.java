package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the distinct cells an expression refers to, in first-seen order.
 */
public final class ReferenceCollector implements ExpressionVisitor<Set<CellId>> {

    private static final ReferenceCollector INSTANCE = new ReferenceCollector();

    private ReferenceCollector() {
    }

    public static Set<CellId> collect(Expression expression) {
        return Collections.unmodifiableSet(ExpressionWalker.fold(expression, INSTANCE));
    }

    @Override
    public Set<CellId> visitConstant(Constant constant) {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<CellId> visitCellReference(CellReference reference) {
        Set<CellId> refs = new LinkedHashSet<>();
        refs.add(reference.getTarget());
        return refs;
    }

    @Override
    public Set<CellId> visitUnary(UnaryOperation operation, Set<CellId> operand) {
        return operand;
    }

    @Override
    public Set<CellId> visitBinary(BinaryOperation operation, Set<CellId> left, Set<CellId> right) {
        left.addAll(right);
        return left;
    }
}
