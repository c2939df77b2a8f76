package org.exprengine.exceptions;

import lombok.Getter;

/**
 * 树的深度超过了配置的递归上限。
 */
@Getter
public final class TreeDepthExceededException extends ExpressionTreeException {

    private final int depth;
    private final int limit;

    public TreeDepthExceededException(int depth, int limit) {
        super(String.format("表达式树深度 %d 超过上限 %d", depth, limit));
        this.depth = depth;
        this.limit = limit;
    }
}
