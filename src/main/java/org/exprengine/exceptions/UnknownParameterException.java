package org.exprengine.exceptions;

import lombok.Getter;

@Getter
public final class UnknownParameterException extends ExpressionTreeException {

    private final String parameterName;

    public UnknownParameterException(String parameterName) {
        super("参数 '" + parameterName + "' 不存在于参数表中。");
        this.parameterName = parameterName;
    }
}
