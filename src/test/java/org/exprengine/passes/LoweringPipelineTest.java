package org.exprengine.passes;

import org.exprengine.config.EngineSettings;
import org.exprengine.core.ParameterTable;
import org.exprengine.core.Shape;
import org.exprengine.core.SliceTable;
import org.exprengine.core.SpatialOperator;
import org.exprengine.core.SpatialOperatorTable;
import org.exprengine.exceptions.TreeDepthExceededException;
import org.exprengine.expressions.Node;
import org.exprengine.expressions.Nodes;
import org.exprengine.expressions.Parameter;
import org.exprengine.expressions.StateVectorSlice;
import org.exprengine.expressions.Time;
import org.exprengine.expressions.Variable;
import org.exprengine.expressions.VectorConstant;
import org.exprengine.utils.NumericValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.exprengine.expressions.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class LoweringPipelineTest {

    private static final int POINTS = 40;

    private final Variable c = Variable.of("c", "neg");
    private final Variable phi = Variable.of("phi", "pos");

    private double[][] laplacian;
    private LoweringPipeline pipeline;

    @BeforeEach
    void setUp() {
        laplacian = DiscretizerTest.laplacian(POINTS);
        pipeline = new LoweringPipeline(
                ParameterTable.of(Map.of("D", 2.0, "k", 0.5)),
                SliceTable.builder().append(c, POINTS).append(phi, 1).build(),
                SpatialOperatorTable.builder().register(SpatialOperator.LAPLACIAN, c.getDomain(), laplacian).build());
    }

    @Test
    @DisplayName("扩散模型降阶后不含符号，数值与直接计算一致")
    void lowerDiffusionModel() {
        Node model = multiply(Parameter.of("D"), div(grad(c)));
        double[] y = DiscretizerTest.testVector(POINTS + 1);

        Node lowered = pipeline.lower(model);
        NumericValue value = pipeline.evaluate(lowered, 0.0, y);

        assertTrue(Nodes.isFullyLowered(lowered));
        assertEquals(Shape.vector(POINTS), lowered.getShape());
        for (int i = 0; i < POINTS; i++) {
            double dot = 0;
            for (int j = 0; j < POINTS; j++) {
                dot += laplacian[i][j] * y[j];
            }
            assertEquals(2.0 * dot, value.get(i), 1e-12);
        }
    }

    @Test
    @DisplayName("降阶时化简掉参数带来的常量")
    void loweringFoldsParameters() {
        Node model = add(multiply(multiply(Parameter.of("k"), Parameter.of("D")), phi), Time.INSTANCE);

        Node lowered = pipeline.lower(model);

        assertEquals(add(StateVectorSlice.of(POINTS, POINTS + 1), Time.INSTANCE), lowered);
    }

    @Test
    @DisplayName("对切片求雅可比得到常量向量")
    void jacobianOfLinearModel() {
        Node lowered = pipeline.lower(multiply(Parameter.of("D"), div(grad(c))));

        Node jacobian = pipeline.jacobian(lowered, StateVectorSlice.of(0, POINTS));

        double[] expected = new double[POINTS];
        expected[0] = -2.0;
        expected[POINTS - 1] = -2.0;
        assertEquals(VectorConstant.of(expected), jacobian);
        assertArrayEquals(expected, pipeline.evaluate(jacobian, 0.0, null).toArray());
    }

    @Test
    @DisplayName("符号阶段对变量求导后仍可降阶，结果为 2*M@ones")
    void symbolicDerivativeThroughSpatialOperatorLowers() {
        Node model = multiply(Parameter.of("D"), div(grad(c)));

        Node lowered = pipeline.lower(new Differentiator().differentiate(model, c));

        double[] expected = new double[POINTS];
        for (int i = 0; i < POINTS; i++) {
            double rowSum = 0;
            for (int j = 0; j < POINTS; j++) {
                rowSum += laplacian[i][j];
            }
            expected[i] = 2.0 * rowSum;
        }
        assertTrue(Nodes.isFullyLowered(lowered));
        assertEquals(VectorConstant.of(expected), lowered);
        assertEquals(pipeline.jacobian(pipeline.lower(model), StateVectorSlice.of(0, POINTS)), lowered);
    }

    @Test
    @DisplayName("没有融合矩阵时，符号导数分别经过散度和梯度矩阵")
    void symbolicDerivativeWithComposedOperators() {
        double[][] gradient = {{-1, 0}, {1, -1}, {0, 1}};
        double[][] divergence = {{-1, 1, 0}, {0, -1, 1}};
        Variable u = Variable.of("u", "sep");
        LoweringPipeline composed = new LoweringPipeline(
                ParameterTable.empty(),
                SliceTable.builder().append(u, 2).build(),
                SpatialOperatorTable.builder()
                        .register(SpatialOperator.GRADIENT, u.getDomain(), gradient)
                        .register(SpatialOperator.DIVERGENCE, u.getDomain(), divergence)
                        .build());

        Node lowered = composed.lower(new Differentiator().differentiate(multiply(scalar(3), div(grad(u))), u));

        // G@ones = [-1, 0, 1]，D@[-1, 0, 1] = [1, 1]
        assertEquals(VectorConstant.of(3, 3), lowered);
    }

    @Test
    @DisplayName("对非线性模型求雅可比")
    void jacobianOfNonlinearModel() {
        Node model = multiply(Parameter.of("k"), multiply(phi, subtract(scalar(1), phi)));
        StateVectorSlice phiSlice = StateVectorSlice.of(POINTS, POINTS + 1);
        double[] y = new double[POINTS + 1];
        y[POINTS] = 0.2;

        Node jacobian = pipeline.jacobian(pipeline.lower(model), phiSlice);

        assertEquals(0.5 * (1 - 2 * 0.2), pipeline.evaluate(jacobian, 0.0, y).asDouble(), 1e-15);
    }

    @Test
    @DisplayName("流水线使用传入的设置")
    void settingsApplied() {
        LoweringPipeline shallow = new LoweringPipeline(pipeline.getParameters(), pipeline.getSlices(),
                pipeline.getOperators(), EngineSettings.builder().maxTreeDepth(2).build());

        assertThrows(TreeDepthExceededException.class,
                () -> shallow.lower(multiply(Parameter.of("D"), div(grad(c)))));
        assertSame(shallow.getSettings(), shallow.getSimplifier().getSettings());
    }
}
