package org.exprengine.exceptions;

import lombok.Getter;

@Getter
public final class UnmappedVariableException extends ExpressionTreeException {

    private final String variable;

    public UnmappedVariableException(String variable) {
        super("变量 " + variable + " 在切片表中没有对应的状态向量切片。");
        this.variable = variable;
    }
}
