package org.exprengine.exceptions;

import lombok.Getter;
import org.exprengine.core.Shape;

/**
 * 构造时发现操作数形状不兼容。
 */
@Getter
public final class ShapeMismatchException extends ExpressionTreeException {

    private final String operator;
    private final Shape left;
    private final Shape right;

    public ShapeMismatchException(String operator, Shape left, Shape right) {
        super(String.format("形状不兼容: %s %s %s", left, operator, right));
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public ShapeMismatchException(String message) {
        super(message);
        this.operator = null;
        this.left = null;
        this.right = null;
    }
}
