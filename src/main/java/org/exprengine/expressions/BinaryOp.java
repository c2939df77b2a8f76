package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;
import org.exprengine.exceptions.DomainMismatchException;
import org.exprengine.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 二元运算节点。输出形状在构造时由两侧形状算出并缓存。
 */
@Getter
public final class BinaryOp extends Node {

    private static final Logger logger = LoggerFactory.getLogger(BinaryOp.class);

    private final BinaryKind kind;

    private final Node left;

    private final Node right;

    private BinaryOp(BinaryKind kind, Node left, Node right, Shape shape, SortedSet<String> domain) {
        super(shape, domain, Math.max(left.getDepth(), right.getDepth()) + 1,
                Objects.hash(kind.ordinal(), left, right) * 31 + 9);
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    /**
     * @throws ShapeMismatchException  如果两侧形状不兼容。
     * @throws DomainMismatchException 如果两侧都有定义域且不同。
     */
    public static BinaryOp of(BinaryKind kind, Node left, Node right) {
        Objects.requireNonNull(kind, "BinaryOp: kind 不能为 null");
        Objects.requireNonNull(left, "BinaryOp: left 不能为 null");
        Objects.requireNonNull(right, "BinaryOp: right 不能为 null");

        Shape shape = kind == BinaryKind.MATMUL
                ? left.getShape().matmul(right.getShape())
                : left.getShape().broadcast(right.getShape(), kind.getSymbol());

        BinaryOp node = new BinaryOp(kind, left, right, shape, mergeDomains(left, right));
        logger.debug("创建 BinaryOp: {}，形状为 {}", node, shape);
        return node;
    }

    private static SortedSet<String> mergeDomains(Node left, Node right) {
        SortedSet<String> leftDomain = left.getDomain();
        SortedSet<String> rightDomain = right.getDomain();
        if (leftDomain.isEmpty()) {
            return rightDomain;
        }
        if (rightDomain.isEmpty() || leftDomain.equals(rightDomain)) {
            return leftDomain;
        }
        logger.error("二元运算两侧的定义域不同: {} 与 {}", leftDomain, rightDomain);
        throw new DomainMismatchException("二元运算两侧的定义域不同", leftDomain, rightDomain);
    }

    @Override
    public List<Node> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryOp that = (BinaryOp) o;
        return hashCode() == that.hashCode()
                && kind == that.kind
                && left.equals(that.left)
                && right.equals(that.right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + kind.getSymbol() + " " + right + ")";
    }
}
