package org.csu.sqlfront.compiler.parser.ast;

public interface ConditionVisitor<R> {

    R visitComparison(ComparisonNode node);

    R visitAnd(AndNode node);

    R visitOr(OrNode node);

    R visitNot(NotNode node);
}
