package org.exprengine.passes;

import org.exprengine.config.EngineSettings;
import org.exprengine.core.Shape;
import org.exprengine.expressions.BinaryOp;
import org.exprengine.expressions.Concatenation;
import org.exprengine.expressions.MatrixConstant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.NodeVisitor;
import org.exprengine.expressions.Nodes;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.Scalar;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Time;
import org.exprengine.expressions.UnaryOp;
import org.exprengine.expressions.Variable;
import org.exprengine.expressions.VectorConstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.exprengine.expressions.Nodes.add;
import static org.exprengine.expressions.Nodes.cos;
import static org.exprengine.expressions.Nodes.divide;
import static org.exprengine.expressions.Nodes.exp;
import static org.exprengine.expressions.Nodes.log;
import static org.exprengine.expressions.Nodes.matmul;
import static org.exprengine.expressions.Nodes.multiply;
import static org.exprengine.expressions.Nodes.negate;
import static org.exprengine.expressions.Nodes.power;
import static org.exprengine.expressions.Nodes.sign;
import static org.exprengine.expressions.Nodes.sin;
import static org.exprengine.expressions.Nodes.sqrt;
import static org.exprengine.expressions.Nodes.subtract;

/**
 * 符号求导：对树按结构递归，应用和、积、商、幂法则与链式法则，得到一棵新的树。
 * <p>
 * 求导对象必须是叶子（时间、状态向量切片、参数、变量……），按结构相等判断"是否是它自己"。
 * 对向量表达式按逐元素的方式求导：d(y[0:n])/d(y[0:n]) = 1，其他切片为 0。
 * <p>
 * 结果不保证最简，调用方应随后运行 {@link Simplifier}。商法则中的奇异性推迟到求值时按 IEEE 语义体现。
 * 空间算子被视为线性算子，与求导交换次序；作用对象长度未知时，标量导数先按对象的定义域扩展，
 * 保证导数树仍然可以离散化。
 */
public final class Differentiator extends TreePass {

    private static final Logger logger = LoggerFactory.getLogger(Differentiator.class);

    public Differentiator() {
        this(EngineSettings.defaults());
    }

    public Differentiator(EngineSettings settings) {
        super(settings);
    }

    /**
     * @param tree          被求导的树。
     * @param withRespectTo 求导对象，必须是叶子。
     * @return 导数树；树中不含求导对象时为 Scalar(0)。
     * @throws IllegalArgumentException 如果求导对象不是叶子。
     */
    public Node differentiate(Node tree, Node withRespectTo) {
        checkDepth(tree);
        Objects.requireNonNull(withRespectTo, "求导对象不能为 null");
        if (!withRespectTo.isLeaf()) {
            logger.error("只能对叶子求导，收到 {}", withRespectTo);
            throw new IllegalArgumentException("只能对叶子求导，收到 " + withRespectTo);
        }
        if (!Nodes.contains(tree, withRespectTo)) {
            logger.debug("{} 中不含 {}，导数为 0", tree, withRespectTo);
            return Scalar.ZERO;
        }
        Node result = tree.accept(new DerivativeVisitor(withRespectTo));
        logger.debug("d({})/d({}) = {}", tree, withRespectTo, result);
        return result;
    }

    private static final class DerivativeVisitor implements NodeVisitor<Node> {

        private final Node target;

        private DerivativeVisitor(Node target) {
            this.target = target;
        }

        private Node d(Node node) {
            return node.accept(this);
        }

        private Node leaf(Node node) {
            return node.equals(target) ? Scalar.ONE : Scalar.ZERO;
        }

        @Override
        public Node visitScalar(Scalar node) {
            return leaf(node);
        }

        @Override
        public Node visitVectorConstant(VectorConstant node) {
            return leaf(node);
        }

        @Override
        public Node visitMatrixConstant(MatrixConstant node) {
            return leaf(node);
        }

        @Override
        public Node visitParameter(Parameter node) {
            return leaf(node);
        }

        @Override
        public Node visitVariable(Variable node) {
            return leaf(node);
        }

        @Override
        public Node visitStateVectorSlice(StateVectorSlice node) {
            return leaf(node);
        }

        @Override
        public Node visitTime(Time node) {
            return leaf(node);
        }

        @Override
        public Node visitUnaryOp(UnaryOp node) {
            Node u = node.getChild();
            Node du = d(u);
            return switch (node.getKind()) {
                case NEGATE -> negate(du);
                case SIN -> multiply(cos(u), du);
                case COS -> multiply(negate(sin(u)), du);
                case EXP -> multiply(exp(u), du);
                case LOG -> divide(du, u);
                case SQRT -> divide(du, multiply(Scalar.of(2.0), sqrt(u)));
                case ABS -> multiply(sign(u), du);
                case SIGN -> Scalar.ZERO;
                // 线性空间算子与求导交换；常数的梯度和散度为 0
                case GRADIENT, DIVERGENCE -> Nodes.isZero(du) ? Scalar.ZERO : UnaryOp.of(node.getKind(), broaden(du, u));
            };
        }

        @Override
        public Node visitBinaryOp(BinaryOp node) {
            Node u = node.getLeft();
            Node v = node.getRight();
            Node du = d(u);
            Node dv = d(v);
            return switch (node.getKind()) {
                case ADD -> add(du, dv);
                case SUBTRACT -> subtract(du, dv);
                case MULTIPLY -> add(multiply(du, v), multiply(u, dv));
                case DIVIDE -> divide(subtract(multiply(du, v), multiply(u, dv)), power(v, Scalar.of(2.0)));
                case POWER -> powerRule(node, u, v, du, dv);
                case MATMUL -> matmulRule(u, v, du, dv);
            };
        }

        /**
         * d(u^v) = v*u^(v-1)*du + u^v*log(u)*dv，为 0 的项省略。
         */
        private Node powerRule(Node node, Node u, Node v, Node du, Node dv) {
            List<Node> terms = new ArrayList<>(2);
            if (!Nodes.isZero(du)) {
                terms.add(multiply(multiply(v, power(u, subtract(v, Scalar.ONE))), du));
            }
            if (!Nodes.isZero(dv)) {
                terms.add(multiply(multiply(node, log(u)), dv));
            }
            return sum(terms);
        }

        /**
         * d(A@u) = dA@u + A@du，为 0 的项省略。标量导数先扩展成对应形状，才能参与矩阵乘法。
         */
        private Node matmulRule(Node a, Node u, Node da, Node du) {
            List<Node> terms = new ArrayList<>(2);
            if (!Nodes.isZero(da)) {
                terms.add(matmul(broaden(da, a.getShape()), u));
            }
            if (!Nodes.isZero(du)) {
                Shape uShape = u.getShape().isDeferred() ? Shape.vector(a.getShape().getCols()) : u.getShape();
                terms.add(matmul(a, broaden(du, uShape)));
            }
            return sum(terms);
        }

        @Override
        public Node visitConcatenation(Concatenation node) {
            List<Node> derivatives = new ArrayList<>(node.getChildren().size());
            for (Node child : node.getChildren()) {
                derivatives.add(broaden(d(child), child));
            }
            return Concatenation.of(derivatives);
        }

        private static Node sum(List<Node> terms) {
            if (terms.isEmpty()) {
                return Scalar.ZERO;
            }
            Node result = terms.get(0);
            for (int i = 1; i < terms.size(); i++) {
                result = add(result, terms.get(i));
            }
            return result;
        }

        /**
         * 把标量导数扩展为给定形状（乘以全一常量），形状已一致时原样返回。
         */
        private static Node broaden(Node derivative, Shape shape) {
            if (!derivative.getShape().isScalar() || shape.isScalar() || shape.isDeferred()) {
                return derivative;
            }
            return multiply(derivative, Nodes.ones(shape));
        }

        /**
         * 把标量导数扩展为与 like 相同的形状和定义域。
         * like 的长度未知时写成 (0 * like) + derivative：它带着 like 的定义域，离散化后长度随之确定，
         * 化简器再把它折叠为全 derivative 的常量。
         */
        private static Node broaden(Node derivative, Node like) {
            if (derivative.getShape().isScalar() && like.getShape().isDeferred()) {
                return add(multiply(Scalar.ZERO, like), derivative);
            }
            return broaden(derivative, like.getShape());
        }
    }
}
