package org.exprengine.core;

import lombok.Getter;
import org.exprengine.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个节点求值结果的维度：标量、向量、矩阵，或者尚待离散化才能确定长度的向量 (DEFERRED)。
 * 此类是不可变的。
 */
@Getter
public final class Shape {

    private static final Logger logger = LoggerFactory.getLogger(Shape.class);

    public enum Kind {
        SCALAR,
        VECTOR,
        MATRIX,
        /** 离散化之前的 Variable 与空间算子：一定是向量，但长度取决于网格 */
        DEFERRED
    }

    public static final Shape SCALAR = new Shape(Kind.SCALAR, 1, 1);
    public static final Shape DEFERRED = new Shape(Kind.DEFERRED, -1, 1);

    private final Kind kind;
    private final int rows;
    private final int cols;

    private Shape(Kind kind, int rows, int cols) {
        this.kind = kind;
        this.rows = rows;
        this.cols = cols;
    }

    public static Shape vector(int length) {
        if (length <= 0) {
            logger.error("向量长度必须为正数，收到 {}", length);
            throw new IllegalArgumentException("向量长度必须为正数: " + length);
        }
        return new Shape(Kind.VECTOR, length, 1);
    }

    public static Shape matrix(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            logger.error("矩阵尺寸必须为正数，收到 {}x{}", rows, cols);
            throw new IllegalArgumentException("矩阵尺寸必须为正数: " + rows + "x" + cols);
        }
        return new Shape(Kind.MATRIX, rows, cols);
    }

    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }

    public boolean isVector() {
        return kind == Kind.VECTOR;
    }

    public boolean isMatrix() {
        return kind == Kind.MATRIX;
    }

    public boolean isDeferred() {
        return kind == Kind.DEFERRED;
    }

    /**
     * 元素个数；DEFERRED 返回 -1。
     */
    public int size() {
        return switch (kind) {
            case SCALAR -> 1;
            case VECTOR -> rows;
            case MATRIX -> rows * cols;
            case DEFERRED -> -1;
        };
    }

    /**
     * 逐元素运算的结果形状。标量可以与任何形状广播；数组与数组必须形状相同；
     * DEFERRED 与向量或 DEFERRED 兼容，结果取已知的那一个（离散化重建树时会再次校验）。
     *
     * @param other    右操作数的形状。
     * @param operator 运算符号，仅用于错误信息。
     * @return 结果形状。
     * @throws ShapeMismatchException 如果不兼容。
     */
    public Shape broadcast(Shape other, String operator) {
        Objects.requireNonNull(other, "Shape-broadcast: other 不能为 null");
        if (this.isScalar()) {
            return other;
        }
        if (other.isScalar()) {
            return this;
        }
        if (this.equals(other)) {
            return this;
        }
        if (this.isDeferred() && (other.isVector() || other.isDeferred())) {
            return other;
        }
        if (other.isDeferred() && this.isVector()) {
            return this;
        }
        logger.error("逐元素运算 {} 的形状不兼容: {} 与 {}", operator, this, other);
        throw new ShapeMismatchException(operator, this, other);
    }

    /**
     * 矩阵乘法的结果形状。左侧必须是 r×c 矩阵。
     *
     * @param right 右操作数的形状。
     * @return 结果形状。
     * @throws ShapeMismatchException 如果不满足乘法相容条件。
     */
    public Shape matmul(Shape right) {
        Objects.requireNonNull(right, "Shape-matmul: right 不能为 null");
        if (this.isMatrix()) {
            if (right.isVector() && right.rows == this.cols) {
                return vector(this.rows);
            }
            if (right.isMatrix() && right.rows == this.cols) {
                return matrix(this.rows, right.cols);
            }
            if (right.isDeferred()) {
                return vector(this.rows);
            }
        }
        logger.error("矩阵乘法的形状不兼容: {} @ {}", this, right);
        throw new ShapeMismatchException("@", this, right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Shape shape = (Shape) o;
        return kind == shape.kind && rows == shape.rows && cols == shape.cols;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rows, cols);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SCALAR -> "scalar";
            case VECTOR -> "vector(" + rows + ")";
            case MATRIX -> "matrix(" + rows + "x" + cols + ")";
            case DEFERRED -> "vector(?)";
        };
    }
}
