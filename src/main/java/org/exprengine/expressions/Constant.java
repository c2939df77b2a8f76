package org.exprengine.expressions;

import org.exprengine.core.Shape;
import org.exprengine.utils.NumericValue;

import java.util.Collections;

/**
 * 数值已知的叶子：标量、向量常量或矩阵常量。常量没有定义域。
 */
public abstract sealed class Constant extends Node permits Scalar, VectorConstant, MatrixConstant {

    protected Constant(Shape shape, int hashCode) {
        super(shape, Collections.emptySortedSet(), 1, hashCode);
    }

    /**
     * @return 此常量存储的值。
     */
    public abstract NumericValue toNumericValue();

    @Override
    public boolean isConstant() {
        return true;
    }

    /**
     * 所有元素都等于 0.0。
     */
    public boolean isZero() {
        return toNumericValue().allEqualTo(0.0);
    }

    /**
     * 所有元素都等于 1.0。
     */
    public boolean isOne() {
        return toNumericValue().allEqualTo(1.0);
    }

    /**
     * 根据数值的形状创建对应的常量节点。
     */
    public static Constant of(NumericValue value) {
        Shape shape = value.getShape();
        if (shape.isScalar()) {
            return Scalar.of(value.asDouble());
        }
        if (shape.isVector()) {
            return VectorConstant.of(value.toArray());
        }
        return MatrixConstant.of(value.toMatrix());
    }
}
