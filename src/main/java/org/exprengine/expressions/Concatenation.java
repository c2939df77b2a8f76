package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;
import org.exprengine.exceptions.DomainMismatchException;
import org.exprengine.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 把若干标量或向量首尾拼接成一个向量。标量子节点按长度为 1 的向量处理。
 * 子节点的定义域必须两两不相交，拼接结果的定义域是它们的并集。
 * <p>
 * 离散化之前，跨多个定义域的变量写作各定义域上变量的拼接，此时子节点长度未知，结果为 DEFERRED；
 * 离散化重建时再算出实际长度。
 */
@Getter
public final class Concatenation extends Node {

    private static final Logger logger = LoggerFactory.getLogger(Concatenation.class);

    private final List<Node> children;

    private Concatenation(List<Node> children, Shape shape, SortedSet<String> domain) {
        super(shape, domain, depthOf(children), children.hashCode() * 31 + 10);
        this.children = children;
    }

    /**
     * @throws ShapeMismatchException  如果某个子节点是矩阵。
     * @throws DomainMismatchException 如果子节点的定义域相交。
     */
    public static Concatenation of(List<Node> children) {
        Objects.requireNonNull(children, "Concatenation: children 不能为 null");
        if (children.isEmpty()) {
            logger.error("Concatenation 至少需要一个子节点");
            throw new IllegalArgumentException("Concatenation 至少需要一个子节点");
        }
        int length = 0;
        boolean deferred = false;
        SortedSet<String> domain = new TreeSet<>();
        for (Node child : children) {
            Objects.requireNonNull(child, "Concatenation: 子节点不能为 null");
            Shape shape = child.getShape();
            if (shape.isMatrix()) {
                logger.error("Concatenation 的子节点必须是标量或向量，收到 {}", shape);
                throw new ShapeMismatchException("Concatenation 的子节点必须是标量或向量，收到 " + shape);
            }
            if (shape.isDeferred()) {
                deferred = true;
            } else {
                length += shape.size();
            }
            if (!Collections.disjoint(domain, child.getDomain())) {
                logger.error("Concatenation 子节点的定义域相交: {} 与 {}", domain, child.getDomain());
                throw new DomainMismatchException("Concatenation 子节点的定义域必须不相交", domain, child.getDomain());
            }
            domain.addAll(child.getDomain());
        }
        Shape shape = deferred ? Shape.DEFERRED : Shape.vector(length);
        Concatenation node = new Concatenation(List.copyOf(children), shape, domainOf(domain));
        logger.debug("创建 Concatenation: {}", node);
        return node;
    }

    public static Concatenation of(Node... children) {
        return of(List.of(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConcatenation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Concatenation that = (Concatenation) o;
        return hashCode() == that.hashCode() && children.equals(that.children);
    }

    @Override
    public String toString() {
        return children.stream().map(Node::toString).collect(Collectors.joining(", ", "concat(", ")"));
    }
}
