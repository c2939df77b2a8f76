package org.exprengine.expressions;

import org.exprengine.core.Shape;
import org.exprengine.utils.NumericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * 一维常量数组。构造时做防御性拷贝。
 */
public final class VectorConstant extends Constant {

    private static final Logger logger = LoggerFactory.getLogger(VectorConstant.class);

    private final double[] data;

    private VectorConstant(double[] data) {
        super(Shape.vector(data.length), Arrays.hashCode(data) * 31 + 2);
        this.data = data;
    }

    public static VectorConstant of(double... data) {
        Objects.requireNonNull(data, "VectorConstant: data 不能为 null");
        if (data.length == 0) {
            logger.error("VectorConstant 不能为空");
            throw new IllegalArgumentException("VectorConstant 至少需要一个元素");
        }
        return new VectorConstant(data.clone());
    }

    public static VectorConstant filled(int length, double value) {
        double[] data = new double[length];
        Arrays.fill(data, value);
        return of(data);
    }

    public double[] getData() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    @Override
    public NumericValue toNumericValue() {
        return NumericValue.vector(data);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVectorConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(data, ((VectorConstant) o).data);
    }

    @Override
    public String toString() {
        if (data.length <= 4) {
            return Arrays.toString(data);
        }
        return "vector(" + data.length + ")";
    }
}
