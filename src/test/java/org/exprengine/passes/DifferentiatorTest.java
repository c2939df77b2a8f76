package org.exprengine.passes;

import org.exprengine.core.Shape;
import org.exprengine.expressions.MatrixConstant;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Nodes;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.Scalar;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Time;
import org.exprengine.expressions.Variable;
import org.exprengine.utils.NumericValue;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.exprengine.expressions.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class DifferentiatorTest {

    private static final double H = 1e-6;
    private static final double TOLERANCE = 1e-6;

    private static final Time T = Time.INSTANCE;
    private static final StateVectorSlice U = StateVectorSlice.of(0, 2);
    private static final MatrixConstant M = MatrixConstant.of(new double[][]{{2, -1}, {0.5, 3}});

    private static final double T0 = 1.5;
    private static final double[] Y0 = {0.7, 1.3};

    private static Differentiator differentiator;
    private static Simplifier simplifier;
    private static Evaluator evaluator;

    @BeforeAll
    static void setUp() {
        differentiator = new Differentiator();
        simplifier = new Simplifier();
        evaluator = new Evaluator();
    }

    /**
     * 沿目标方向的中心差分：对时间扰动 t，对切片同时扰动切片内的每个元素。
     */
    private static double[] centralDifference(Node tree, Node target) {
        double[] yUp = Y0.clone();
        double[] yDown = Y0.clone();
        double tUp = T0;
        double tDown = T0;
        if (target instanceof StateVectorSlice slice) {
            for (int i = slice.getStart(); i < slice.getEnd(); i++) {
                yUp[i] += H;
                yDown[i] -= H;
            }
        } else {
            tUp += H;
            tDown -= H;
        }
        NumericValue up = evaluator.evaluate(tree, tUp, yUp);
        NumericValue down = evaluator.evaluate(tree, tDown, yDown);
        double[] result = new double[up.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = (up.get(i) - down.get(i)) / (2 * H);
        }
        return result;
    }

    /**
     * 符号导数（化简前后）都与数值导数一致。标量导数广播到表达式的每个元素。
     */
    private static void assertMatchesFiniteDifference(Node tree, Node target) {
        double[] expected = centralDifference(tree, target);
        Node derivative = differentiator.differentiate(tree, target);
        Node simplified = simplifier.simplify(derivative);
        for (Node candidate : new Node[]{derivative, simplified}) {
            NumericValue actual = evaluator.evaluate(candidate, T0, Y0);
            for (int i = 0; i < expected.length; i++) {
                double value = actual.isScalar() ? actual.asDouble() : actual.get(i);
                assertEquals(expected[i], value, TOLERANCE * Math.max(1.0, Math.abs(expected[i])),
                        "d(" + tree + ")/d(" + target + ") 第 " + i + " 个元素");
            }
        }
    }

    @Test
    @DisplayName("2*y*(1-y)+t 对时间求导并化简后在 t=1, y=[2] 处等于 1")
    void derivativeWithRespectToTime() {
        StateVectorSlice y = StateVectorSlice.of(0, 1);
        Node tree = add(multiply(multiply(scalar(2), y), subtract(scalar(1), y)), T);

        Node dT = simplifier.simplify(differentiator.differentiate(tree, T));

        assertEquals(1.0, evaluator.evaluate(dT, 1.0, new double[]{2.0}).asDouble());
    }

    @Nested
    @DisplayName("与有限差分比较 (Finite-difference checks)")
    class FiniteDifferenceTests {

        @Test
        @DisplayName("和、积与正弦")
        void sumProductAndSine() {
            Node tree = add(multiply(U, U), sin(U));
            assertMatchesFiniteDifference(tree, U);
            assertMatchesFiniteDifference(multiply(T, tree), T);
        }

        @Test
        @DisplayName("商与指数")
        void quotientAndExp() {
            Node tree = divide(exp(U), add(T, U));
            assertMatchesFiniteDifference(tree, U);
            assertMatchesFiniteDifference(tree, T);
        }

        @Test
        @DisplayName("底数和指数都含目标的幂")
        void powerWithTargetInBaseAndExponent() {
            Node tree = power(U, T);
            assertMatchesFiniteDifference(tree, U);
            assertMatchesFiniteDifference(tree, T);
            assertMatchesFiniteDifference(power(T, U), T);
        }

        @Test
        @DisplayName("对数、平方根与减法")
        void logSqrtAndSubtraction() {
            assertMatchesFiniteDifference(subtract(log(U), sqrt(multiply(T, U))), U);
            assertMatchesFiniteDifference(subtract(log(U), sqrt(multiply(T, U))), T);
        }

        @Test
        @DisplayName("取负、绝对值与余弦")
        void negateAbsAndCosine() {
            Node tree = multiply(abs(negate(U)), cos(multiply(T, U)));
            assertMatchesFiniteDifference(tree, U);
            assertMatchesFiniteDifference(tree, T);
        }

        @Test
        @DisplayName("常量矩阵乘以依赖目标的向量")
        void matmulWithConstantMatrix() {
            assertMatchesFiniteDifference(matmul(M, multiply(U, U)), U);
            assertMatchesFiniteDifference(matmul(M, multiply(T, U)), T);
        }

        @Test
        @DisplayName("矩阵本身依赖目标")
        void matmulWithVaryingMatrix() {
            assertMatchesFiniteDifference(matmul(add(M, T), U), T);
            assertMatchesFiniteDifference(matmul(multiply(T, M), U), T);
        }

        @Test
        @DisplayName("拼接逐段求导")
        void concatenation() {
            Node tree = concat(multiply(T, T), multiply(U, T));
            assertMatchesFiniteDifference(tree, T);
            assertMatchesFiniteDifference(tree, U);
        }
    }

    @Nested
    @DisplayName("结构规则 (Structural rules)")
    class StructuralTests {

        @Test
        @DisplayName("不含目标的树导数为 0")
        void absentTargetGivesZero() {
            assertAll(
                    () -> assertSame(Scalar.ZERO, differentiator.differentiate(sin(U), T)),
                    () -> assertSame(Scalar.ZERO, differentiator.differentiate(U, StateVectorSlice.of(0, 1))),
                    () -> assertSame(Scalar.ZERO, differentiator.differentiate(scalar(5), T))
            );
        }

        @Test
        @DisplayName("目标按结构相等识别")
        void targetMatchedStructurally() {
            Node derivative = differentiator.differentiate(StateVectorSlice.of(0, 2), StateVectorSlice.of(0, 2));
            assertSame(Scalar.ONE, derivative);
        }

        @Test
        @DisplayName("可以对参数和变量求导，空间算子与求导交换")
        void symbolicLeavesAndSpatialOperators() {
            Variable c = Variable.of("c", "neg");
            Parameter d = Parameter.of("D");
            Node tree = multiply(d, div(grad(c)));

            Node byParameter = simplifier.simplify(differentiator.differentiate(tree, d));
            Node byVariable = simplifier.simplify(differentiator.differentiate(tree, c));

            assertEquals(div(grad(c)), byParameter);
            assertTrue(Nodes.contains(byVariable, multiply(d, div(grad(add(multiply(Scalar.ZERO, c), Scalar.ONE))))));
            assertEquals(Shape.DEFERRED, byVariable.getShape());
            assertEquals(tree.getDomain(), byVariable.getDomain());
        }

        @Test
        @DisplayName("空间算子内的标量导数带上作用对象的定义域")
        void spatialDerivativeKeepsDomain() {
            Variable c = Variable.of("c", "neg");

            Node derivative = differentiator.differentiate(grad(c), c);
            Node scaled = differentiator.differentiate(grad(multiply(scalar(3), c)), c);

            assertAll(
                    () -> assertEquals(grad(add(multiply(Scalar.ZERO, c), Scalar.ONE)), derivative),
                    () -> assertEquals(Set.of("neg"), derivative.getDomain()),
                    () -> assertEquals(Set.of("neg"), scaled.getDomain()),
                    () -> assertEquals(Shape.DEFERRED, scaled.getShape()),
                    () -> assertTrue(Nodes.isZero(differentiator.differentiate(grad(scalar(3)), T))),
                    () -> assertSame(Scalar.ZERO, differentiator.differentiate(grad(c), Variable.of("c", "pos")))
            );
        }

        @Test
        @DisplayName("长度未知的拼接逐段扩展导数")
        void deferredConcatenation() {
            Variable cn = Variable.of("c", "neg");
            Variable cs = Variable.of("c", "sep");

            Node derivative = differentiator.differentiate(concat(cn, cs), cn);

            assertEquals(concat(add(multiply(Scalar.ZERO, cn), Scalar.ONE), add(multiply(Scalar.ZERO, cs), Scalar.ZERO)),
                    derivative);
        }

        @Test
        @DisplayName("只能对叶子求导")
        void nonLeafTargetRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> differentiator.differentiate(sin(T), sin(T)));
        }
    }
}
