package org.csu.astrodsl.config;

/**
 * 公式处理的复杂度限制，在词法分析之前和语法分析过程中生效，用于拒绝过长或嵌套过深的输入。
 *
 * <pre>{@code
 * FormulaPolicy policy = FormulaPolicy.defaults();   // 4096 字符, 64 层嵌套
 * FormulaPolicy policy = FormulaPolicy.strict();     // 不可信输入
 * FormulaPolicy policy = new FormulaPolicy("custom", 2000, 16);
 * }</pre>
 *
 * @param name             策略名称，用于日志和错误信息
 * @param maxFormulaLength 公式文本的最大字符数
 * @param maxNestingDepth  括号、NOT 和列表的最大嵌套层数
 */
public record FormulaPolicy(
        String name,
        int maxFormulaLength,
        int maxNestingDepth
) {

    public FormulaPolicy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    public static FormulaPolicy defaults() {
        return new FormulaPolicy("DEFAULT", 4096, 64);
    }

    /**
     * 面向外部用户输入 (命令行参数、界面输入框)
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy("STRICT", 1000, 32);
    }

    /**
     * 面向可信的预置公式文件
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy("RELAXED", 20000, 256);
    }
}
