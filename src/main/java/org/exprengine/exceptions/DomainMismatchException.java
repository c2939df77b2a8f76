package org.exprengine.exceptions;

import lombok.Getter;

import java.util.Set;

/**
 * 两个子树的定义域冲突：二元运算两侧的非空定义域不同，或拼接的子节点定义域相交。
 */
@Getter
public final class DomainMismatchException extends ExpressionTreeException {

    private final Set<String> first;
    private final Set<String> second;

    public DomainMismatchException(String message, Set<String> first, Set<String> second) {
        super(message + ": " + first + " / " + second);
        this.first = Set.copyOf(first);
        this.second = Set.copyOf(second);
    }
}
