package org.exprengine.passes;

import org.exprengine.core.Shape;
import org.exprengine.expressions.BinaryOp;
import org.exprengine.expressions.Concatenation;
import org.exprengine.expressions.MatrixConstant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Scalar;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Time;
import org.exprengine.expressions.UnaryOp;
import org.exprengine.expressions.Variable;
import org.exprengine.expressions.VectorConstant;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.exprengine.expressions.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class SimplifierTest {

    private static final Time T = Time.INSTANCE;
    private static final StateVectorSlice X = StateVectorSlice.of(0, 2);
    private static final MatrixConstant M = MatrixConstant.of(new double[][]{{1, 2}, {3, 4}});

    private static Simplifier simplifier;
    private static Evaluator evaluator;

    @BeforeAll
    static void setUp() {
        simplifier = new Simplifier();
        evaluator = new Evaluator();
    }

    @Nested
    @DisplayName("常量折叠 (Constant folding)")
    class FoldingTests {

        @Test
        @DisplayName("全为常量的子树被折叠")
        void foldsConstantSubtrees() {
            assertAll(
                    () -> assertEquals(scalar(7), simplifier.simplify(add(multiply(scalar(2), scalar(3)), scalar(1)))),
                    () -> assertEquals(scalar(-1), simplifier.simplify(cos(scalar(Math.PI)))),
                    () -> assertEquals(VectorConstant.of(5, 11), simplifier.simplify(matmul(M, VectorConstant.of(1, 2)))),
                    () -> assertEquals(add(T, scalar(5)), simplifier.simplify(add(T, add(scalar(2), scalar(3)))))
            );
        }

        @Test
        @DisplayName("空间算子不折叠")
        void spatialOperatorsNotFolded() {
            Node tree = grad(VectorConstant.of(1, 2, 3));
            assertSame(tree, simplifier.simplify(tree));
        }
    }

    @Nested
    @DisplayName("单位元与零元 (Identities)")
    class IdentityTests {

        @Test
        @DisplayName("加 0、乘 1、除以 1、一次幂")
        void neutralElementsRemoved() {
            assertAll(
                    () -> assertSame(X, simplifier.simplify(add(X, Scalar.ZERO))),
                    () -> assertSame(X, simplifier.simplify(add(Scalar.ZERO, X))),
                    () -> assertSame(X, simplifier.simplify(subtract(X, Scalar.ZERO))),
                    () -> assertSame(X, simplifier.simplify(multiply(X, Scalar.ONE))),
                    () -> assertSame(X, simplifier.simplify(multiply(Scalar.ONE, X))),
                    () -> assertSame(X, simplifier.simplify(divide(X, Scalar.ONE))),
                    () -> assertSame(X, simplifier.simplify(power(X, Scalar.ONE))),
                    () -> assertSame(X, simplifier.simplify(add(X, VectorConstant.of(0, 0))))
            );
        }

        @Test
        @DisplayName("乘以 0 得到形状相同的零常量")
        void multiplicationByZeroKeepsShape() {
            assertAll(
                    () -> assertEquals(VectorConstant.of(0, 0), simplifier.simplify(multiply(X, Scalar.ZERO))),
                    () -> assertEquals(VectorConstant.of(0, 0), simplifier.simplify(multiply(Scalar.ZERO, sin(X)))),
                    () -> assertEquals(Scalar.ZERO, simplifier.simplify(multiply(T, Scalar.ZERO))),
                    () -> assertEquals(VectorConstant.of(0, 0), simplifier.simplify(matmul(MatrixConstant.filled(2, 2, 0), X)))
            );
        }

        @Test
        @DisplayName("替换会改变形状时不化简")
        void shapeChangingRewriteSkipped() {
            Node tree = add(T, VectorConstant.of(0, 0));

            Node simplified = simplifier.simplify(tree);

            assertEquals(tree, simplified);
            assertEquals(Shape.vector(2), simplified.getShape());
        }

        @Test
        @DisplayName("长度未知时不物化零常量")
        void deferredZeroNotMaterialized() {
            Node tree = multiply(Variable.of("c", "neg"), Scalar.ZERO);

            assertInstanceOf(BinaryOp.class, simplifier.simplify(tree));
            assertEquals(Variable.of("c", "neg"), simplifier.simplify(multiply(Variable.of("c", "neg"), Scalar.ONE)));
        }

        @Test
        @DisplayName("双重取负被消去")
        void doubleNegation() {
            assertSame(X, simplifier.simplify(negate(negate(X))));
            assertInstanceOf(UnaryOp.class, simplifier.simplify(negate(negate(negate(X)))));
        }
    }

    @Nested
    @DisplayName("拼接 (Concatenation)")
    class ConcatenationTests {

        @Test
        @DisplayName("嵌套拼接被展平")
        void nestedConcatenationFlattened() {
            Node tree = concat(concat(StateVectorSlice.of(0, 1), T), StateVectorSlice.of(2, 3));

            assertEquals(Concatenation.of(StateVectorSlice.of(0, 1), T, StateVectorSlice.of(2, 3)),
                    simplifier.simplify(tree));
        }

        @Test
        @DisplayName("首尾相接的切片合并为一个切片")
        void contiguousSlicesMerged() {
            assertEquals(StateVectorSlice.of(0, 5),
                    simplifier.simplify(concat(StateVectorSlice.of(0, 2), StateVectorSlice.of(2, 5))));
            assertEquals(StateVectorSlice.of(1, 6),
                    simplifier.simplify(concat(concat(StateVectorSlice.of(1, 2), StateVectorSlice.of(2, 4)), StateVectorSlice.of(4, 6))));
            assertInstanceOf(Concatenation.class,
                    simplifier.simplify(concat(StateVectorSlice.of(0, 2), StateVectorSlice.of(3, 5))));
        }

        @Test
        @DisplayName("全为常量的拼接折叠为向量常量")
        void constantConcatenationFolded() {
            assertEquals(VectorConstant.of(1, 2, 3), simplifier.simplify(concat(Scalar.ONE, VectorConstant.of(2, 3))));
        }
    }

    @Nested
    @DisplayName("整体性质 (Properties)")
    class PropertyTests {

        private final List<Node> trees = List.of(
                add(multiply(Scalar.ONE, sin(X)), multiply(Scalar.ZERO, cos(X))),
                divide(subtract(multiply(Scalar.ONE, X), multiply(T, Scalar.ZERO)), power(add(X, scalar(2)), scalar(2))),
                matmul(M, add(multiply(scalar(2), X), negate(negate(X)))),
                concat(add(T, Scalar.ZERO), concat(StateVectorSlice.of(0, 1), StateVectorSlice.of(1, 2))),
                exp(multiply(power(T, Scalar.ONE), add(Scalar.ZERO, multiply(scalar(2), scalar(0.5)))))
        );

        @Test
        @DisplayName("化简是幂等的")
        void idempotent() {
            for (Node tree : trees) {
                Node once = simplifier.simplify(tree);
                assertEquals(once, simplifier.simplify(once), () -> "化简不是幂等的: " + tree);
            }
        }

        @Test
        @DisplayName("化简保持形状和数值")
        void preservesShapeAndValue() {
            double[] y = {0.25, -1.5};
            for (Node tree : trees) {
                Node simplified = simplifier.simplify(tree);
                assertEquals(tree.getShape(), simplified.getShape(), () -> "形状改变: " + tree);
                assertArrayEquals(evaluator.evaluate(tree, 0.8, y).toArray(),
                        evaluator.evaluate(simplified, 0.8, y).toArray(), 1e-12, () -> "数值改变: " + tree);
            }
        }

        @Test
        @DisplayName("化简后不变大")
        void neverDeeper() {
            for (Node tree : trees) {
                assertTrue(simplifier.simplify(tree).getDepth() <= tree.getDepth());
            }
        }
    }
}
