package org.csu.sqlfront.compiler.parser.ast;

public record OrNode(ConditionNode left, ConditionNode right) implements ConditionNode {

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public String toString() {
        return "Or(" + left + ", " + right + ")";
    }
}
