package org.csu.sqlfront.compiler.parser.ast;

import lombok.Getter;
import lombok.Setter;
import org.csu.sqlfront.common.model.DataType;

/**
 * AST 节点: 一个简单比较 column op literal (e.g., age > 20)。
 * 语义分析通过后会标注被引用列的类型，供后续报告使用。
 */
@Getter
public final class ComparisonNode implements ConditionNode {
    private final IdentifierNode column;
    private final ComparisonOperator operator;
    private final LiteralNode value;
    @Setter
    private DataType resolvedType; // 语义分析前为 null

    public ComparisonNode(IdentifierNode column, ComparisonOperator operator, LiteralNode value) {
        this.column = column;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return "Compare(" + column + "," + operator + "," + value + ")";
    }
}
