package org.exprengine.core;

/**
 * 空间算子表中矩阵的种类。
 * LAPLACIAN 不对应树中的节点，它是 div(grad(u)) 的融合矩阵，供离散化时一次性替换两层算子。
 */
public enum SpatialOperator {

    GRADIENT("grad"),
    DIVERGENCE("div"),
    LAPLACIAN("div∘grad");

    private final String symbol;

    SpatialOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
