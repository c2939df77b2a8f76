package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * 尚未解析的具名标量常数，例如扩散系数 D。参数代入之后不得再出现。
 */
@Getter
public final class Parameter extends Node {

    private static final Logger logger = LoggerFactory.getLogger(Parameter.class);

    private final String name;

    private Parameter(String name) {
        super(Shape.SCALAR, Collections.emptySortedSet(), 1, name.hashCode() * 31 + 4);
        this.name = name;
    }

    public static Parameter of(String name) {
        if (name == null || name.isBlank()) {
            logger.error("Parameter 名称不能为空");
            throw new IllegalArgumentException("Parameter 名称不能为空");
        }
        return new Parameter(name);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Parameter) o).name);
    }

    @Override
    public String toString() {
        return name;
    }
}
