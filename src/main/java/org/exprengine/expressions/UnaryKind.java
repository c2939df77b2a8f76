package org.exprengine.expressions;

import org.exprengine.core.SpatialOperator;
import org.exprengine.utils.NumericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 一元运算的种类。
 * 逐元素函数可以直接求值；GRADIENT 和 DIVERGENCE 是空间算子，只能在离散化之后以矩阵乘法的形式求值。
 */
public enum UnaryKind {

    NEGATE("-"),
    SIN("sin"),
    COS("cos"),
    EXP("exp"),
    LOG("log"),
    SQRT("sqrt"),
    ABS("abs"),
    SIGN("sign"),
    GRADIENT("grad"),
    DIVERGENCE("div");

    private static final Logger logger = LoggerFactory.getLogger(UnaryKind.class);

    private final String symbol;

    UnaryKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isSpatial() {
        return this == GRADIENT || this == DIVERGENCE;
    }

    /**
     * 空间算子在算子表中对应的键。
     * @throws IllegalStateException 如果不是空间算子。
     */
    public SpatialOperator toSpatialOperator() {
        return switch (this) {
            case GRADIENT -> SpatialOperator.GRADIENT;
            case DIVERGENCE -> SpatialOperator.DIVERGENCE;
            default -> throw new IllegalStateException(this + " 不是空间算子");
        };
    }

    /**
     * 对单个数应用此函数。
     */
    public double apply(double x) {
        return switch (this) {
            case NEGATE -> -x;
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case EXP -> Math.exp(x);
            case LOG -> Math.log(x);
            case SQRT -> Math.sqrt(x);
            case ABS -> Math.abs(x);
            case SIGN -> Math.signum(x);
            case GRADIENT, DIVERGENCE -> {
                logger.error("空间算子 {} 不能逐元素求值", this);
                throw new IllegalStateException("空间算子 " + this + " 不能逐元素求值");
            }
        };
    }

    public NumericValue apply(NumericValue value) {
        return value.map(this::apply);
    }
}
