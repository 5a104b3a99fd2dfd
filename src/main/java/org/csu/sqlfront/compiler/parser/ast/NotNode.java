package org.csu.sqlfront.compiler.parser.ast;

public record NotNode(ConditionNode operand) implements ConditionNode {

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return "Not(" + operand + ")";
    }
}
