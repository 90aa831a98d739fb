/**
 * SpectraFit
 * CompositeObjectiveTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.Test;

import spectrafit.exception.NonFiniteDataException;
import spectrafit.parameters.AttributeSpec;
import spectrafit.parameters.ParameterGraph;
import spectrafit.parameters.ParameterGraphBuilder;
import spectrafit.parameters.PeakSpec;

class CompositeObjectiveTest {

	private static final double[] X = { -1, 0, 1, 2 };

	private static ParameterGraph constant(final double level) {
		return ParameterGraphBuilder.build(Collections.singletonList(PeakSpec.of(1,
			"constant").with("amplitude", AttributeSpec.of(level))));
	}

	@Test
	void residualIsDataMinusModel() {
		final CompositeObjective o = new CompositeObjective(constant(1), Dataset.of(
			X, new double[] { 3, 3, 3, 3 }).column(0), 0, NanPolicy.PROPAGATE);

		assertThat(o.residual(new double[] { 1 })).containsExactly(2, 2, 2, 2);
		assertThat(o.residual(new double[] { 4 })).containsExactly(-1, -1, -1, -1);
		assertThat(o.length()).isEqualTo(4);
	}

	@Test
	void weightsScaleResiduals() {
		final Dataset data = Dataset.of(X, new double[] { 3, 3, 3, 3 })
			.withWeights(0, new double[] { 2, 1, 0, 1 });
		final CompositeObjective o = new CompositeObjective(constant(1), data
			.column(0), 0, NanPolicy.PROPAGATE);

		assertThat(o.residual(new double[] { 1 })).containsExactly(4, 2, 0, 2);
	}

	@Test
	void omitDropsNonFiniteSamplesOnce() {
		final double[] y = { 1, Double.NaN, 1, 1 };
		final double[] x = { 0, 1, Double.POSITIVE_INFINITY, 3 };
		final CompositeObjective o = new CompositeObjective(constant(1), Dataset.of(
			x, y).column(0), 0, NanPolicy.OMIT);

		assertThat(o.length()).isEqualTo(2);
		assertThat(o.getX()).containsExactly(0, 3);
		assertThat(o.residual(new double[] { 0.5 })).containsExactly(0.5, 0.5);
	}

	@Test
	void raiseRejectsNonFiniteData() {
		final double[] y = { 1, Double.NaN, 1, 1 };
		assertThatThrownBy(() -> new CompositeObjective(constant(1), Dataset.of(X,
			y).column(0), 0, NanPolicy.RAISE)).isInstanceOf(
				NonFiniteDataException.class).hasMessageContaining("index 1");
	}

	@Test
	void raiseRejectsNonFiniteResiduals() {
		final ParameterGraph graph = ParameterGraphBuilder.build(Collections
			.singletonList(PeakSpec.of(1, "power") //
				.with("amplitude", AttributeSpec.of(1)) //
				.with("exponent", AttributeSpec.fixed(-1))));
		final CompositeObjective o = new CompositeObjective(graph, Dataset.of(X,
			new double[4]).column(0), 0, NanPolicy.RAISE);

		assertThatThrownBy(() -> o.residual(new double[] { 1 })).isInstanceOf(
			NonFiniteDataException.class);
	}

	@Test
	void propagateLetsNanThrough() {
		final double[] y = { 1, Double.NaN, 1, 1 };
		final CompositeObjective o = new CompositeObjective(constant(1), Dataset.of(
			X, y).column(0), 0, NanPolicy.PROPAGATE);

		assertThat(o.residual(new double[] { 1 })[1]).isNaN();
	}

	@Test
	void componentsAddUpToModel() {
		final ParameterGraph graph = ParameterGraphBuilder.build(Arrays.asList(
			PeakSpec.of(1, "gaussian") //
				.with("amplitude", AttributeSpec.of(2)) //
				.with("center", AttributeSpec.of(0.5)), //
			PeakSpec.of(2, "constant").with("amplitude", AttributeSpec.of(0.1))));
		final CompositeObjective o = new CompositeObjective(graph, Dataset.of(X,
			new double[4]).column(0), 0, NanPolicy.PROPAGATE);

		final double[] p = graph.initialValues();
		final Map<String, double[]> parts = o.components(p);
		assertThat(parts).containsOnlyKeys("gaussian_1", "constant_2");
		final double[] model = o.model(p);
		for (int i = 0; i < X.length; i++) {
			assertThat(parts.get("gaussian_1")[i] + parts.get("constant_2")[i])
				.isCloseTo(model[i], within(1e-15));
		}
		assertThat(parts.get("constant_2")).containsOnly(0.1);
	}

	@Test
	void rebindingKeepsData() {
		final CompositeObjective o = new CompositeObjective(constant(1), Dataset.of(
			X, new double[] { 3, 3, 3, 3 }).column(0), 0, NanPolicy.PROPAGATE);
		final CompositeObjective fixed = o.withGraph(o.graph().withFixed(
			"constant_amplitude_1", 2));

		assertThat(fixed.graph().freeCount()).isZero();
		assertThat(fixed.residual(new double[0])).containsOnly(1.0);
	}
}
