package org.exprengine.exceptions;

/**
 * 表达式树引擎所有错误的公共父类。
 * 错误总是由检测到它的调用同步抛出，引擎内部从不重试。
 */
public class ExpressionTreeException extends RuntimeException {

    public ExpressionTreeException(String message) {
        super(message);
    }

    public ExpressionTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
