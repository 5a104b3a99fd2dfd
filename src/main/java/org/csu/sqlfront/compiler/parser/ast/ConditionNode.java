package org.csu.sqlfront.compiler.parser.ast;

/**
 * WHERE 条件树的节点: 比较、AND、OR、NOT。树自底向上构建，有限且无环。
 */
public sealed interface ConditionNode extends AstNode
        permits ComparisonNode, AndNode, OrNode, NotNode {

    <R> R accept(ConditionVisitor<R> visitor);
}
