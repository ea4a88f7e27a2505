package org.csu.astrodsl.compiler.parser.ast;

/**
 * 一元逻辑运算符，目前只有 NOT
 */
public enum UnaryOperator {
    NOT
}
