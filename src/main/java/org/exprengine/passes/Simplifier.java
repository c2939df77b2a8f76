package org.exprengine.passes;

import org.exprengine.config.EngineSettings;
import org.exprengine.core.Shape;
import org.exprengine.expressions.BinaryOp;
import org.exprengine.expressions.Concatenation;
import org.exprengine.expressions.Constant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Nodes;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.UnaryKind;
import org.exprengine.expressions.UnaryOp;
import org.exprengine.utils.NumericValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 化简：自底向上重写，反复执行直到树不再变化（不动点），因此 simplify(simplify(t)) 与 simplify(t) 结构相等。
 * <p>
 * 规则：
 * <ul>
 *     <li>常量折叠：非空间算子的所有子节点都是常量时，直接算出结果常量；</li>
 *     <li>单位元与零元：x+0、0+x、x-0、x*1、1*x、x/1、x^1 化为 x，x*0、0*x、0@x 化为 0；</li>
 *     <li>双重取负：-(-x) 化为 x；</li>
 *     <li>嵌套拼接展平，首尾相接的状态向量切片拼接合并为一个切片。</li>
 * </ul>
 * 只有当替换结果与原节点形状相同时才应用重写；0 会按原形状物化为常量，长度未知时不做替换。
 * 不调整任何运算的顺序，不改变未化简树的舍入行为。
 */
public final class Simplifier extends TreePass {

    private static final Logger logger = LoggerFactory.getLogger(Simplifier.class);

    public Simplifier() {
        this(EngineSettings.defaults());
    }

    public Simplifier(EngineSettings settings) {
        super(settings);
    }

    public Node simplify(Node tree) {
        checkDepth(tree);
        Node current = tree;
        for (int iteration = 0; iteration < getSettings().getMaxSimplifyIterations(); iteration++) {
            Node next = current.accept(new SimplificationVisitor());
            if (next == current || next.equals(current)) {
                logger.debug("化简在第 {} 轮收敛: {} -> {}", iteration + 1, tree, next);
                return next;
            }
            current = next;
        }
        logger.warn("化简在 {} 轮内未收敛，返回当前结果", getSettings().getMaxSimplifyIterations());
        return current;
    }

    private static final class SimplificationVisitor extends TreeRewriter {

        @Override
        public Node visitUnaryOp(UnaryOp node) {
            Node child = rewrite(node.getChild());
            UnaryKind kind = node.getKind();

            if (kind == UnaryKind.NEGATE && child instanceof UnaryOp inner && inner.getKind() == UnaryKind.NEGATE) {
                return inner.getChild();
            }
            if (!kind.isSpatial() && child instanceof Constant constant) {
                return Constant.of(kind.apply(constant.toNumericValue()));
            }
            return child == node.getChild() ? node : UnaryOp.of(kind, child);
        }

        @Override
        public Node visitBinaryOp(BinaryOp node) {
            Node left = rewrite(node.getLeft());
            Node right = rewrite(node.getRight());

            if (left instanceof Constant l && right instanceof Constant r) {
                return Constant.of(node.getKind().apply(l.toNumericValue(), r.toNumericValue()));
            }

            Node replacement = identity(node, left, right);
            if (replacement != null && replacement.getShape().equals(node.getShape())) {
                return replacement;
            }
            if (left == node.getLeft() && right == node.getRight()) {
                return node;
            }
            return BinaryOp.of(node.getKind(), left, right);
        }

        /**
         * @return 单位元 / 零元规则给出的替换，没有适用规则时返回 null。
         */
        private static Node identity(BinaryOp node, Node left, Node right) {
            Shape shape = node.getShape();
            return switch (node.getKind()) {
                case ADD -> Nodes.isZero(right) ? left : Nodes.isZero(left) ? right : null;
                case SUBTRACT -> Nodes.isZero(right) ? left : null;
                case MULTIPLY -> {
                    if (Nodes.isZero(left) || Nodes.isZero(right)) {
                        yield shape.isDeferred() ? null : Nodes.zeros(shape);
                    }
                    yield Nodes.isOne(right) ? left : Nodes.isOne(left) ? right : null;
                }
                case DIVIDE, POWER -> Nodes.isOne(right) ? left : null;
                case MATMUL -> Nodes.isZero(left) ? Nodes.zeros(shape) : null;
            };
        }

        @Override
        public Node visitConcatenation(Concatenation node) {
            List<Node> rewritten = rewriteAll(node.getChildren());
            boolean changed = rewritten != null;
            List<Node> children = changed ? rewritten : node.getChildren();

            List<Node> flat = new ArrayList<>(children.size());
            for (Node child : children) {
                if (child instanceof Concatenation nested) {
                    flat.addAll(nested.getChildren());
                    changed = true;
                } else {
                    flat.add(child);
                }
            }

            if (flat.stream().allMatch(Node::isConstant)) {
                List<NumericValue> values = new ArrayList<>(flat.size());
                for (Node child : flat) {
                    values.add(((Constant) child).toNumericValue());
                }
                return Constant.of(NumericValue.concatenate(values));
            }

            StateVectorSlice merged = mergeContiguousSlices(flat);
            if (merged != null) {
                return merged;
            }
            return changed ? Concatenation.of(flat) : node;
        }

        /**
         * 若所有子节点都是首尾相接的切片，返回覆盖它们的单个切片。
         */
        private static StateVectorSlice mergeContiguousSlices(List<Node> children) {
            if (!children.stream().allMatch(child -> child instanceof StateVectorSlice)) {
                return null;
            }
            for (int i = 1; i < children.size(); i++) {
                StateVectorSlice previous = (StateVectorSlice) children.get(i - 1);
                if (!previous.isFollowedBy((StateVectorSlice) children.get(i))) {
                    return null;
                }
            }
            StateVectorSlice first = (StateVectorSlice) children.get(0);
            StateVectorSlice last = (StateVectorSlice) children.get(children.size() - 1);
            return StateVectorSlice.of(first.getStart(), last.getEnd());
        }
    }
}
