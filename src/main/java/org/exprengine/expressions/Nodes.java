package org.exprengine.expressions;

import org.exprengine.core.Shape;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 构造表达式树的便捷方法，以及不依赖递归的树遍历工具。
 */
public final class Nodes {

    private Nodes() {
    }

    // --- 构造 ---

    public static Scalar scalar(double value) {
        return Scalar.of(value);
    }

    public static Node add(Node left, Node right) {
        return BinaryOp.of(BinaryKind.ADD, left, right);
    }

    public static Node subtract(Node left, Node right) {
        return BinaryOp.of(BinaryKind.SUBTRACT, left, right);
    }

    public static Node multiply(Node left, Node right) {
        return BinaryOp.of(BinaryKind.MULTIPLY, left, right);
    }

    public static Node divide(Node left, Node right) {
        return BinaryOp.of(BinaryKind.DIVIDE, left, right);
    }

    public static Node power(Node base, Node exponent) {
        return BinaryOp.of(BinaryKind.POWER, base, exponent);
    }

    public static Node matmul(Node left, Node right) {
        return BinaryOp.of(BinaryKind.MATMUL, left, right);
    }

    public static Node negate(Node child) {
        return UnaryOp.of(UnaryKind.NEGATE, child);
    }

    public static Node sin(Node child) {
        return UnaryOp.of(UnaryKind.SIN, child);
    }

    public static Node cos(Node child) {
        return UnaryOp.of(UnaryKind.COS, child);
    }

    public static Node exp(Node child) {
        return UnaryOp.of(UnaryKind.EXP, child);
    }

    public static Node log(Node child) {
        return UnaryOp.of(UnaryKind.LOG, child);
    }

    public static Node sqrt(Node child) {
        return UnaryOp.of(UnaryKind.SQRT, child);
    }

    public static Node abs(Node child) {
        return UnaryOp.of(UnaryKind.ABS, child);
    }

    public static Node sign(Node child) {
        return UnaryOp.of(UnaryKind.SIGN, child);
    }

    public static Node grad(Node child) {
        return UnaryOp.of(UnaryKind.GRADIENT, child);
    }

    public static Node div(Node child) {
        return UnaryOp.of(UnaryKind.DIVERGENCE, child);
    }

    public static Node concat(Node... children) {
        return Concatenation.of(children);
    }

    /**
     * 指定形状的全零常量。
     * @throws IllegalArgumentException 如果形状是 DEFERRED。
     */
    public static Constant zeros(Shape shape) {
        return filled(shape, 0.0);
    }

    /**
     * 指定形状的全一常量。
     * @throws IllegalArgumentException 如果形状是 DEFERRED。
     */
    public static Constant ones(Shape shape) {
        return filled(shape, 1.0);
    }

    private static Constant filled(Shape shape, double value) {
        return switch (shape.getKind()) {
            case SCALAR -> Scalar.of(value);
            case VECTOR -> VectorConstant.filled(shape.getRows(), value);
            case MATRIX -> MatrixConstant.filled(shape.getRows(), shape.getCols(), value);
            case DEFERRED -> throw new IllegalArgumentException("无法为长度未知的形状创建常量");
        };
    }

    /**
     * 是否是每个元素都为 0 的常量。
     */
    public static boolean isZero(Node node) {
        return node instanceof Constant constant && constant.isZero();
    }

    /**
     * 是否是每个元素都为 1 的常量。
     */
    public static boolean isOne(Node node) {
        return node instanceof Constant constant && constant.isOne();
    }

    // --- 遍历 ---

    /**
     * 先序遍历整棵树，使用显式栈，不受树深度影响。子节点按从左到右的顺序访问。
     *
     * @return 所有节点（共享的子树按出现次数重复）。
     */
    public static List<Node> preOrder(Node root) {
        Objects.requireNonNull(root, "root 不能为 null");
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            result.add(node);
            List<Node> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * 收集满足条件的节点。同一个节点实例在树中被共享多次时只访问、收集一次。
     */
    public static List<Node> collect(Node root, Predicate<Node> predicate) {
        List<Node> result = new ArrayList<>();
        visitDistinct(root, node -> {
            if (predicate.test(node)) {
                result.add(node);
            }
            return false;
        });
        return result;
    }

    /**
     * 树中是否存在与 target 结构相等的子树。找到第一个即返回。
     */
    public static boolean contains(Node root, Node target) {
        Objects.requireNonNull(target, "target 不能为 null");
        return visitDistinct(root, target::equals);
    }

    /**
     * 树中是否还有未解析的符号：Parameter、Variable 或空间算子。
     */
    public static boolean isFullyLowered(Node root) {
        return collect(root, Nodes::isUnresolved).isEmpty();
    }

    /**
     * 先序遍历，每个节点实例只访问一次（按对象身份去重），共享子树不重复展开。
     *
     * @param visitor 返回 true 时停止遍历。
     * @return 是否因 visitor 返回 true 而提前停止。
     */
    private static boolean visitDistinct(Node root, Predicate<Node> visitor) {
        Objects.requireNonNull(root, "root 不能为 null");
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            if (visitor.test(node)) {
                return true;
            }
            List<Node> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return false;
    }

    static boolean isUnresolved(Node node) {
        return node instanceof Parameter
                || node instanceof Variable
                || (node instanceof UnaryOp unary && unary.getKind().isSpatial());
    }
}
