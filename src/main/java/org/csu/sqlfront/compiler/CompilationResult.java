package org.csu.sqlfront.compiler;

import org.csu.sqlfront.catalog.SchemaTable;
import org.csu.sqlfront.catalog.UserTable;
import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;
import org.csu.sqlfront.compiler.lexer.Token;
import org.csu.sqlfront.compiler.parser.ast.StatementNode;
import org.csu.sqlfront.compiler.semantic.AnalysisResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次编译的完整输出。
 *
 * @param tokens      词法分析得到的 Token 序列 (含 ILLEGAL 与 EOF)
 * @param statements  语法分析成功构造的语句
 * @param analysis    语义分析结果；词法中止或因语法错误跳过时为 null
 * @param diagnostics 按阶段顺序排列的全部诊断 (词法, 语法, 语义)
 */
public record CompilationResult(
        List<Token> tokens,
        List<StatementNode> statements,
        AnalysisResult analysis,
        List<Diagnostic> diagnostics
) {

    public CompilationResult {
        tokens = List.copyOf(tokens);
        statements = List.copyOf(statements);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isAnalyzed() {
        return analysis != null;
    }

    /**
     * 只看错误，重复授权之类的警告不算
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> diagnostics(Phase phase) {
        return diagnostics.stream()
                .filter(d -> d.phase() == phase)
                .collect(Collectors.toList());
    }

    public List<StatementNode> validatedStatements() {
        return analysis == null ? List.of() : analysis.validatedStatements();
    }

    public SchemaTable schemaTable() {
        return analysis == null ? new SchemaTable() : analysis.schemaTable();
    }

    public UserTable userTable() {
        return analysis == null ? new UserTable() : analysis.userTable();
    }
}
