package org.exprengine.exceptions;

import lombok.Getter;
import org.exprengine.core.SpatialOperator;

import java.util.Set;

@Getter
public final class NoSpatialOperatorForDomainException extends ExpressionTreeException {

    private final SpatialOperator operator;
    private final Set<String> domain;

    public NoSpatialOperatorForDomainException(SpatialOperator operator, Set<String> domain) {
        super("空间算子表中没有定义域 " + domain + " 上的 " + operator + " 矩阵。");
        this.operator = operator;
        this.domain = Set.copyOf(domain);
    }
}
