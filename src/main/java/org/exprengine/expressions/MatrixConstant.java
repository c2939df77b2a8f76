package org.exprengine.expressions;

import org.exprengine.core.Shape;
import org.exprengine.utils.NumericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * 二维常量数组，通常是离散化得到的空间算子矩阵。构造时做深拷贝并校验是矩形。
 */
public final class MatrixConstant extends Constant {

    private static final Logger logger = LoggerFactory.getLogger(MatrixConstant.class);

    private final double[][] data;

    private MatrixConstant(double[][] data) {
        super(Shape.matrix(data.length, data[0].length), Arrays.deepHashCode(data) * 31 + 3);
        this.data = data;
    }

    public static MatrixConstant of(double[][] data) {
        Objects.requireNonNull(data, "MatrixConstant: data 不能为 null");
        if (data.length == 0 || data[0] == null || data[0].length == 0) {
            logger.error("MatrixConstant 不能为空");
            throw new IllegalArgumentException("MatrixConstant 至少需要一行一列");
        }
        int cols = data[0].length;
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            if (data[i] == null || data[i].length != cols) {
                logger.error("MatrixConstant 第 {} 行的长度与首行 {} 不一致", i, cols);
                throw new IllegalArgumentException("MatrixConstant 必须是矩形的，第 " + i + " 行长度不一致");
            }
            copy[i] = data[i].clone();
        }
        return new MatrixConstant(copy);
    }

    public static MatrixConstant filled(int rows, int cols, double value) {
        double[][] data = new double[rows][cols];
        for (double[] row : data) {
            Arrays.fill(row, value);
        }
        return of(data);
    }

    public double[][] getData() {
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            copy[i] = data[i].clone();
        }
        return copy;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public int rows() {
        return data.length;
    }

    public int cols() {
        return data[0].length;
    }

    @Override
    public NumericValue toNumericValue() {
        return NumericValue.matrix(data);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMatrixConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.deepEquals(data, ((MatrixConstant) o).data);
    }

    @Override
    public String toString() {
        return "matrix(" + rows() + "x" + cols() + ")";
    }
}
