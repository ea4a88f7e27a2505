package org.csu.astrodsl.common.model;

/**
 * 求值结果的类型
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    LIST
}
