package org.csu.sqlfront.compiler.parser.ast;

public record AndNode(ConditionNode left, ConditionNode right) implements ConditionNode {

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return "And(" + left + ", " + right + ")";
    }
}
