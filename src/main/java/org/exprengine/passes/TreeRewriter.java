package org.exprengine.passes;

import org.exprengine.expressions.BinaryOp;
import org.exprengine.expressions.Concatenation;
import org.exprengine.expressions.MatrixConstant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.NodeVisitor;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.Scalar;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Time;
import org.exprengine.expressions.UnaryOp;
import org.exprengine.expressions.Variable;
import org.exprengine.expressions.VectorConstant;

import java.util.ArrayList;
import java.util.List;

/**
 * 自底向上重建树的访问者。默认保持叶子不变，并且只在子节点确实变化时才重新构造父节点，
 * 未变化的子树在新旧两棵树之间共享。重新构造会再次执行形状校验。
 */
abstract class TreeRewriter implements NodeVisitor<Node> {

    protected Node rewrite(Node node) {
        return node.accept(this);
    }

    @Override
    public Node visitScalar(Scalar node) {
        return node;
    }

    @Override
    public Node visitVectorConstant(VectorConstant node) {
        return node;
    }

    @Override
    public Node visitMatrixConstant(MatrixConstant node) {
        return node;
    }

    @Override
    public Node visitParameter(Parameter node) {
        return node;
    }

    @Override
    public Node visitVariable(Variable node) {
        return node;
    }

    @Override
    public Node visitStateVectorSlice(StateVectorSlice node) {
        return node;
    }

    @Override
    public Node visitTime(Time node) {
        return node;
    }

    @Override
    public Node visitUnaryOp(UnaryOp node) {
        Node child = rewrite(node.getChild());
        if (child == node.getChild()) {
            return node;
        }
        return UnaryOp.of(node.getKind(), child);
    }

    @Override
    public Node visitBinaryOp(BinaryOp node) {
        Node left = rewrite(node.getLeft());
        Node right = rewrite(node.getRight());
        if (left == node.getLeft() && right == node.getRight()) {
            return node;
        }
        return BinaryOp.of(node.getKind(), left, right);
    }

    @Override
    public Node visitConcatenation(Concatenation node) {
        List<Node> children = rewriteAll(node.getChildren());
        if (children == null) {
            return node;
        }
        return Concatenation.of(children);
    }

    /**
     * @return 重建后的子节点列表；所有子节点都未变化时返回 null。
     */
    protected List<Node> rewriteAll(List<Node> children) {
        List<Node> rewritten = new ArrayList<>(children.size());
        boolean changed = false;
        for (Node child : children) {
            Node next = rewrite(child);
            changed |= next != child;
            rewritten.add(next);
        }
        return changed ? rewritten : null;
    }
}
