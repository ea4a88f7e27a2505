package org.csu.astrodsl.compiler.semantic;

import org.csu.astrodsl.common.exception.SemanticException;
import org.csu.astrodsl.compiler.parser.ast.ExpressionNode;

/**
 * 领域语义校验器：在求值之前拒绝语法正确、但在占星学上不可能成立的公式。
 *
 * 核心管道本身只做词法、语法和通用类型检查，领域规则由实现类提供。
 */
public interface FormulaValidator {

    /**
     * @param formula 已解析的公式
     * @throws SemanticException 公式在领域上没有意义
     */
    void validate(ExpressionNode formula);
}
