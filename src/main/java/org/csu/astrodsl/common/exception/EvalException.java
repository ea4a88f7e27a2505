package org.csu.astrodsl.common.exception;

import lombok.Getter;
import org.csu.astrodsl.compiler.parser.ast.ExpressionNode;

/**
 * 求值阶段的异常，携带出错的 AST 节点。
 */
@Getter
public final class EvalException extends FormulaException {

    public enum Reason {
        MISSING_ENTITY,
        MISSING_PROPERTY,
        TYPE_MISMATCH,
        NOT_A_SEQUENCE,
        UNSUPPORTED_VALUE
    }

    private final Reason reason;
    private final transient ExpressionNode node;
    /**
     * 缺失的键 (对象名或属性名)，仅 MISSING_* 时非空
     */
    private final String missingKey;

    public EvalException(Reason reason, ExpressionNode node, String message) {
        this(reason, node, message, null);
    }

    public EvalException(Reason reason, ExpressionNode node, String message, String missingKey) {
        super(String.format("Evaluation error in '%s': %s", node, message));
        this.reason = reason;
        this.node = node;
        this.missingKey = missingKey;
    }

    @Override
    public Stage getStage() {
        return Stage.EVAL;
    }
}
