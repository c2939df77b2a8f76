package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 表达式树的一个顶点。
 * <p>
 * 变体是封闭的：常量 ({@link Constant})、{@link Parameter}、{@link Variable}、{@link StateVectorSlice}、
 * {@link Time}、{@link UnaryOp}、{@link BinaryOp} 和 {@link Concatenation}。
 * 节点在构造时校验形状并缓存形状、定义域、深度和结构哈希，之后不可变。
 * <p>
 * 节点的相等性是结构性的：种类、负载和子节点都相等即相等，与对象地址无关。
 */
@Getter
public abstract sealed class Node
        permits Constant, Parameter, Variable, StateVectorSlice, Time, UnaryOp, BinaryOp, Concatenation {

    private final Shape shape;

    private final SortedSet<String> domain;

    /** 叶子为 1，否则为 1 + 最深子节点的深度 */
    private final int depth;

    @Getter(lombok.AccessLevel.NONE)
    private final int hashCode;

    protected Node(Shape shape, SortedSet<String> domain, int depth, int hashCode) {
        this.shape = shape;
        this.domain = domain;
        this.depth = depth;
        this.hashCode = hashCode;
    }

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * @return 子节点列表，叶子返回空列表。
     */
    public List<Node> getChildren() {
        return Collections.emptyList();
    }

    public boolean isLeaf() {
        return getChildren().isEmpty();
    }

    public boolean isConstant() {
        return false;
    }

    @Override
    public final int hashCode() {
        return hashCode;
    }

    @Override
    public abstract boolean equals(Object o);

    static SortedSet<String> domainOf(Collection<String> domain) {
        if (domain == null || domain.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(domain));
    }

    static int depthOf(List<Node> children) {
        int max = 0;
        for (Node child : children) {
            max = Math.max(max, child.depth);
        }
        return max + 1;
    }
}
