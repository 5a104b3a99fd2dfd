package org.csu.sqlfront.compiler.parser;

import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.exception.ParseException;
import org.csu.sqlfront.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * 语法分析的结果: 成功解析的语句 (按源顺序) 以及累积的语法错误。
 */
public record ParseResult(List<StatementNode> statements, List<Diagnostic> errors) {

    public ParseResult {
        statements = List.copyOf(statements);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 有语法错误时以第一个错误抛出 {@link ParseException}，否则返回全部语句。
     */
    public List<StatementNode> requireNoErrors() {
        if (hasErrors()) {
            throw new ParseException(errors.get(0));
        }
        return statements;
    }
}
