package org.exprengine.expressions;

import org.exprengine.utils.NumericValue;

/**
 * 二元运算的种类。除 MATMUL 外都是带标量广播的逐元素运算。
 */
public enum BinaryKind {

    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MATMUL("@"),
    POWER("**");

    private final String symbol;

    BinaryKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isElementwise() {
        return this != MATMUL;
    }

    /**
     * 对两个数应用此运算。MATMUL 在标量上退化为乘法。
     */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY, MATMUL -> left * right;
            case DIVIDE -> left / right;
            case POWER -> Math.pow(left, right);
        };
    }

    public NumericValue apply(NumericValue left, NumericValue right) {
        if (this == MATMUL) {
            return left.matmul(right);
        }
        return left.combine(right, this::apply);
    }
}
