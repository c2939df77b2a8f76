package org.exprengine.expressions;

import org.exprengine.core.Shape;

import java.util.Collections;

/**
 * 对求值时标量时间 t 的引用。单例。
 */
public final class Time extends Node {

    public static final Time INSTANCE = new Time();

    private Time() {
        super(Shape.SCALAR, Collections.emptySortedSet(), 1, 7);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTime(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Time;
    }

    @Override
    public String toString() {
        return "t";
    }
}
