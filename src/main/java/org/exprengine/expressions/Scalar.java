package org.exprengine.expressions;

import org.exprengine.core.Shape;
import org.exprengine.utils.NumericValue;

public final class Scalar extends Constant {

    public static final Scalar ZERO = new Scalar(0.0);
    public static final Scalar ONE = new Scalar(1.0);

    private final double value;

    private Scalar(double value) {
        super(Shape.SCALAR, Double.hashCode(value) * 31 + 1);
        this.value = value;
    }

    public static Scalar of(double value) {
        if (Double.doubleToRawLongBits(value) == 0L) {
            return ZERO;
        }
        if (value == 1.0) {
            return ONE;
        }
        return new Scalar(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public NumericValue toNumericValue() {
        return NumericValue.scalar(value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Double.compare(value, ((Scalar) o).value) == 0;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
