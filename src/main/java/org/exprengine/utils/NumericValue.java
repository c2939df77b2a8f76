package org.exprengine.utils;

import lombok.Getter;
import org.apache.commons.lang3.ArrayUtils;
import org.exprengine.core.Shape;
import org.exprengine.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * 表达式树求值的结果：一个标量、向量或矩阵，元素按行优先存放。
 * 运算遵循 IEEE-754 语义，NaN 与无穷只做传播。
 * 此类是不可变的。
 */
public final class NumericValue {

    private static final Logger logger = LoggerFactory.getLogger(NumericValue.class);

    @Getter
    private final Shape shape;

    private final double[] data;

    private volatile int hash;

    private NumericValue(Shape shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    // ========== 工厂方法 ==========

    public static NumericValue scalar(double value) {
        return new NumericValue(Shape.SCALAR, new double[]{value});
    }

    public static NumericValue vector(double[] values) {
        Objects.requireNonNull(values, "向量数据不能为 null");
        return new NumericValue(Shape.vector(values.length), values.clone());
    }

    public static NumericValue matrix(double[][] rows) {
        Objects.requireNonNull(rows, "矩阵数据不能为 null");
        if (rows.length == 0 || rows[0] == null) {
            logger.error("矩阵至少需要一行");
            throw new IllegalArgumentException("矩阵至少需要一行");
        }
        int cols = rows[0].length;
        double[] flat = new double[rows.length * cols];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != cols) {
                logger.error("矩阵第 {} 行长度与首行 {} 不一致", i, cols);
                throw new IllegalArgumentException("矩阵必须是矩形的，第 " + i + " 行长度不一致");
            }
            System.arraycopy(rows[i], 0, flat, i * cols, cols);
        }
        return new NumericValue(Shape.matrix(rows.length, cols), flat);
    }

    /**
     * 将若干标量或向量首尾拼接成一个向量。
     */
    public static NumericValue concatenate(List<NumericValue> parts) {
        double[] result = ArrayUtils.EMPTY_DOUBLE_ARRAY;
        for (NumericValue part : parts) {
            if (part.shape.isMatrix()) {
                logger.error("不能拼接矩阵: {}", part.shape);
                throw new ShapeMismatchException("只能拼接标量或向量，收到 " + part.shape);
            }
            result = ArrayUtils.addAll(result, part.data);
        }
        return vector(result);
    }

    // ========== 运算 ==========

    /**
     * 逐元素二元运算，标量会广播到另一侧的形状。
     */
    public NumericValue combine(NumericValue other, DoubleBinaryOperator op) {
        if (this.shape.equals(other.shape)) {
            double[] out = new double[data.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = op.applyAsDouble(this.data[i], other.data[i]);
            }
            return new NumericValue(this.shape, out);
        }
        if (this.shape.isScalar()) {
            double left = this.data[0];
            double[] out = new double[other.data.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = op.applyAsDouble(left, other.data[i]);
            }
            return new NumericValue(other.shape, out);
        }
        if (other.shape.isScalar()) {
            double right = other.data[0];
            double[] out = new double[data.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = op.applyAsDouble(this.data[i], right);
            }
            return new NumericValue(this.shape, out);
        }
        logger.error("逐元素运算时形状不兼容: {} 与 {}", this.shape, other.shape);
        throw new ShapeMismatchException("elementwise", this.shape, other.shape);
    }

    public NumericValue map(DoubleUnaryOperator op) {
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = op.applyAsDouble(data[i]);
        }
        return new NumericValue(shape, out);
    }

    /**
     * 矩阵乘法。每个输出元素按列下标从小到大累加，保证结果确定。
     */
    public NumericValue matmul(NumericValue right) {
        Shape resultShape = this.shape.matmul(right.shape);
        int rows = this.shape.getRows();
        int inner = this.shape.getCols();
        int cols = right.shape.isMatrix() ? right.shape.getCols() : 1;
        double[] out = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            for (int k = 0; k < cols; k++) {
                double sum = 0.0;
                for (int j = 0; j < inner; j++) {
                    sum += this.data[i * inner + j] * right.data[j * cols + k];
                }
                out[i * cols + k] = sum;
            }
        }
        return new NumericValue(resultShape, out);
    }

    // ========== 访问 ==========

    public int size() {
        return data.length;
    }

    public boolean isScalar() {
        return shape.isScalar();
    }

    public double get(int index) {
        return data[index];
    }

    public double get(int row, int col) {
        return data[row * shape.getCols() + col];
    }

    /**
     * 单元素值（标量或长度为 1 的向量）的数值。
     */
    public double asDouble() {
        if (data.length != 1) {
            logger.error("尝试把形状为 {} 的值当作单个数读取", shape);
            throw new IllegalStateException("值的形状为 " + shape + "，不是单个数");
        }
        return data[0];
    }

    /**
     * @return 按行优先展开的元素副本。
     */
    public double[] toArray() {
        return data.clone();
    }

    public double[][] toMatrix() {
        int rows = shape.isMatrix() || shape.isVector() ? shape.getRows() : 1;
        int cols = shape.isMatrix() ? shape.getCols() : 1;
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(data, i * cols, out[i], 0, cols);
        }
        return out;
    }

    /**
     * 所有元素是否都等于给定值（按数值比较，-0.0 与 0.0 视为相等）。
     */
    public boolean allEqualTo(double value) {
        for (double d : data) {
            if (d != value) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NumericValue that = (NumericValue) o;
        return shape.equals(that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(shape, Arrays.hashCode(data));
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        if (shape.isScalar()) {
            return Double.toString(data[0]);
        }
        if (shape.isMatrix()) {
            return Arrays.deepToString(toMatrix());
        }
        return Arrays.toString(data);
    }
}
