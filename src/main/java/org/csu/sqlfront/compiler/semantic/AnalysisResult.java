package org.csu.sqlfront.compiler.semantic;

import org.csu.sqlfront.catalog.SchemaTable;
import org.csu.sqlfront.catalog.UserTable;
import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.exception.SemanticException;
import org.csu.sqlfront.compiler.parser.ast.StatementNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次语义分析的结果。
 * 成功时 fatalError 为 null；失败时 validatedStatements 只包含出错语句之前通过检查的语句，
 * 两张表保持出错时的状态。
 *
 * @param validatedStatements 通过检查 (并已标注类型) 的语句
 * @param schemaTable         分析结束时的表结构符号表
 * @param userTable           分析结束时的用户与权限表
 * @param warnings            非致命的提示，例如重复授权
 * @param fatalError          中止分析的语义错误，可能为 null
 */
public record AnalysisResult(
        List<StatementNode> validatedStatements,
        SchemaTable schemaTable,
        UserTable userTable,
        List<Diagnostic> warnings,
        Diagnostic fatalError
) {

    public AnalysisResult {
        validatedStatements = List.copyOf(validatedStatements);
        warnings = List.copyOf(warnings);
    }

    public boolean isSuccessful() {
        return fatalError == null;
    }

    /**
     * 警告在前 (按产生顺序)，致命错误 (如果有) 在最后。
     */
    public List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>(warnings);
        if (fatalError != null) {
            all.add(fatalError);
        }
        return all;
    }

    public AnalysisResult orElseThrow() {
        if (fatalError != null) {
            throw new SemanticException(fatalError);
        }
        return this;
    }
}
