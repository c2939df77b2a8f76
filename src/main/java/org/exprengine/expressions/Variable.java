package org.exprengine.expressions;

import lombok.Getter;
import org.exprengine.core.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * 定义在某个定义域上的未知函数，例如负极中的浓度 c。
 * 变量的身份由名称和定义域共同决定；离散化时被替换为状态向量切片。
 */
@Getter
public final class Variable extends Node {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private final String name;

    private Variable(String name, Collection<String> domain) {
        super(Shape.DEFERRED, domainOf(domain), 1, Objects.hash(name, domainOf(domain)) * 31 + 5);
        this.name = name;
    }

    public static Variable of(String name, Collection<String> domain) {
        if (name == null || name.isBlank()) {
            logger.error("Variable 名称不能为空");
            throw new IllegalArgumentException("Variable 名称不能为空");
        }
        Objects.requireNonNull(domain, "Variable: domain 不能为 null");
        return new Variable(name, domain);
    }

    public static Variable of(String name, String... domain) {
        return of(name, Arrays.asList(domain));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable that = (Variable) o;
        return name.equals(that.name) && getDomain().equals(that.getDomain());
    }

    @Override
    public String toString() {
        return getDomain().isEmpty() ? name : name + getDomain();
    }
}
