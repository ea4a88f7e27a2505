package org.csu.astrodsl.compiler.parser.ast;

/**
 * 二元逻辑运算符
 */
public enum LogicalOperator {
    AND,
    OR
}
