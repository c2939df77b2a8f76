package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;

/**
 * 全局状态向量 y 上的一个窗口 y[start:end]，左闭右开。
 * 由离散化引入，替代符号变量。
 */
@Getter
public final class StateVectorSlice extends Node {

    private static final Logger logger = LoggerFactory.getLogger(StateVectorSlice.class);

    private final int start;

    private final int end;

    private StateVectorSlice(int start, int end) {
        super(Shape.vector(end - start), Collections.emptySortedSet(), 1, Objects.hash(start, end) * 31 + 6);
        this.start = start;
        this.end = end;
    }

    /**
     * @param start 起始下标（含）。
     * @param end   结束下标（不含）。
     * @throws IllegalArgumentException 如果 start < 0 或 start >= end。
     */
    public static StateVectorSlice of(int start, int end) {
        if (start < 0 || start >= end) {
            logger.error("非法的状态向量切片 [{}:{}]", start, end);
            throw new IllegalArgumentException("状态向量切片必须满足 0 <= start < end，收到 [" + start + ":" + end + "]");
        }
        return new StateVectorSlice(start, end);
    }

    public int length() {
        return end - start;
    }

    /**
     * 下一个切片是否紧接在此切片之后。
     */
    public boolean isFollowedBy(StateVectorSlice next) {
        return this.end == next.start;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStateVectorSlice(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StateVectorSlice that = (StateVectorSlice) o;
        return start == that.start && end == that.end;
    }

    @Override
    public String toString() {
        return "y[" + start + ":" + end + "]";
    }
}
