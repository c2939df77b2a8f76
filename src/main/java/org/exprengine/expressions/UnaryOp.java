package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;
import org.exprengine.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 一元运算节点。逐元素函数保持子节点形状；空间算子的输出长度取决于网格，在离散化前为 DEFERRED。
 */
@Getter
public final class UnaryOp extends Node {

    private static final Logger logger = LoggerFactory.getLogger(UnaryOp.class);

    private final UnaryKind kind;

    private final Node child;

    private UnaryOp(UnaryKind kind, Node child, Shape shape) {
        super(shape, child.getDomain(), child.getDepth() + 1, Objects.hash(kind.ordinal(), child) * 31 + 8);
        this.kind = kind;
        this.child = child;
    }

    /**
     * @throws ShapeMismatchException 如果对矩阵施加空间算子。
     */
    public static UnaryOp of(UnaryKind kind, Node child) {
        Objects.requireNonNull(kind, "UnaryOp: kind 不能为 null");
        Objects.requireNonNull(child, "UnaryOp: child 不能为 null");
        Shape shape = child.getShape();
        if (kind.isSpatial()) {
            if (shape.isMatrix()) {
                logger.error("空间算子 {} 不能作用于矩阵 {}", kind, child);
                throw new ShapeMismatchException("空间算子 " + kind.getSymbol() + " 不能作用于形状 " + shape);
            }
            shape = Shape.DEFERRED;
        }
        UnaryOp node = new UnaryOp(kind, child, shape);
        logger.debug("创建 UnaryOp: {}", node);
        return node;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(child);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnaryOp that = (UnaryOp) o;
        return hashCode() == that.hashCode() && kind == that.kind && child.equals(that.child);
    }

    @Override
    public String toString() {
        if (kind == UnaryKind.NEGATE) {
            return "-(" + child + ")";
        }
        return kind.getSymbol() + "(" + child + ")";
    }
}
