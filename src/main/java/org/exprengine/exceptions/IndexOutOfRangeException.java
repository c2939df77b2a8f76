package org.exprengine.exceptions;

import lombok.Getter;

/**
 * 调用方提供的状态向量太短（或缺失），无法读取某个切片。
 */
@Getter
public final class IndexOutOfRangeException extends ExpressionTreeException {

    private final int requiredLength;
    private final int actualLength;

    public IndexOutOfRangeException(int requiredLength, int actualLength) {
        super(String.format("状态向量长度为 %d，但切片需要至少 %d 个元素", actualLength, requiredLength));
        this.requiredLength = requiredLength;
        this.actualLength = actualLength;
    }
}
