package org.exprengine.exceptions;

import lombok.Getter;

/**
 * 在只接受已完全降阶的树的位置遇到了 Parameter、Variable 或空间算子。
 * 这总是调用方的降阶流程不完整所致。
 */
@Getter
public final class UnresolvedSymbolException extends ExpressionTreeException {

    private final String symbol;

    public UnresolvedSymbolException(String symbol, String stage) {
        super(String.format("%s 阶段遇到未解析的符号 '%s'", stage, symbol));
        this.symbol = symbol;
    }
}
