package org.exprengine.expressions;

/**
 * 对 {@link Node} 各变体的穷举访问。
 * 每一个遍历（求值、求导、化简、代入、离散化）都实现此接口，新增变体会让所有遍历在编译期报错。
 *
 * @param <R> 访问结果的类型。
 */
public interface NodeVisitor<R> {

    R visitScalar(Scalar node);

    R visitVectorConstant(VectorConstant node);

    R visitMatrixConstant(MatrixConstant node);

    R visitParameter(Parameter node);

    R visitVariable(Variable node);

    R visitStateVectorSlice(StateVectorSlice node);

    R visitTime(Time node);

    R visitUnaryOp(UnaryOp node);

    R visitBinaryOp(BinaryOp node);

    R visitConcatenation(Concatenation node);
}
