/**
 * SpectraFit
 * OptimizerAdapterTest.java
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
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.scijava.Context;
import org.scijava.log.LogService;

import spectrafit.exception.InvalidBoundsException;
import spectrafit.models.Model;
import spectrafit.parameters.AttributeSpec;
import spectrafit.parameters.ParameterGraph;
import spectrafit.parameters.ParameterGraphBuilder;
import spectrafit.parameters.PeakSpec;
import spectrafit.statistics.CorrelationMatrix;

class OptimizerAdapterTest {

	private static Context context;
	private static OptimizerAdapter adapter;

	@BeforeAll
	static void setUp() {
		context = new Context(LogService.class);
		adapter = new OptimizerAdapter(context.getService(LogService.class));
	}

	@AfterAll
	static void tearDown() {
		context.dispose();
	}

	/** Gaussian (2, 0.3, 1.2) with a small deterministic ripple. */
	private static Dataset gaussianData() {
		final double[] x = new double[201];
		for (int i = 0; i < x.length; i++) {
			x[i] = -5 + 0.05 * i;
		}
		final double[] y = Model.GAUSSIAN.evaluate(x, 2, 0.3, 1.2);
		for (int i = 0; i < y.length; i++) {
			y[i] += 0.01 * FastMath.sin(17 * x[i]);
		}
		return Dataset.of(x, y);
	}

	private static CompositeObjective objective(final double amplitude,
		final AttributeSpec center, final double fwhmg)
	{
		final ParameterGraph graph = ParameterGraphBuilder.build(Collections
			.singletonList(PeakSpec.of(1, "gaussian") //
				.with("amplitude", AttributeSpec.of(amplitude, 0, 10)) //
				.with("center", center) //
				.with("fwhmg", AttributeSpec.of(fwhmg, 0.1, 5))));
		return new CompositeObjective(graph, gaussianData().column(0), 0,
			NanPolicy.PROPAGATE);
	}

	@Test
	void levenbergMarquardtRecoversGaussian() {
		final Optimum o = adapter.minimize(objective(1, AttributeSpec.of(0), 1),
			Minimizer.LEASTSQ, 1000, true, FitMonitor.NONE);

		assertThat(o.getReason()).isEqualTo(TerminationReason.CONVERGED);
		assertThat(o.isSuccess()).isTrue();
		assertThat(o.getValues()[0]).isCloseTo(2.0, within(1e-2));
		assertThat(o.getValues()[1]).isCloseTo(0.3, within(1e-2));
		assertThat(o.getValues()[2]).isCloseTo(1.2, within(1e-2));
		assertThat(o.hasCovariance()).isTrue();
		for (final double se : o.getStandardErrors()) {
			assertThat(se).isPositive().isLessThan(0.01);
		}
		assertThat(o.getNfev()).isPositive().isLessThanOrEqualTo(1000);
	}

	@Test
	void numericalFailureIsNotASuccess() {
		final Dataset data = gaussianData();
		final double[] y = data.column(0).getY();
		y[100] = Double.NaN;
		final ParameterGraph graph = objective(0.8, AttributeSpec.of(0), 1)
			.graph();
		final Optimum o = adapter.minimize(new CompositeObjective(graph, Dataset.of(
			data.column(0).getX(), y).column(0), 0, NanPolicy.PROPAGATE),
			Minimizer.LEASTSQ, 1000, false, FitMonitor.NONE);

		assertThat(o.getReason()).isEqualTo(TerminationReason.CONVERGED);
		assertThat(o.isSuccess()).isFalse();
		assertThat(o.getMessage()).startsWith("Stopped");
		assertThat(o.getValues()[0]).isEqualTo(0.8);
	}

	@Test
	void covarianceAndCorrelationsAreSymmetric() {
		final CompositeObjective objective = objective(1, AttributeSpec.of(0), 1);
		final Optimum o = adapter.minimize(objective, Minimizer.LEASTSQ, 1000,
			true, FitMonitor.NONE);
		final RealMatrix cov = o.getCovariance();
		final List<String> names = objective.graph().freeNames();
		final Map<String, Map<String, Double>> corr = CorrelationMatrix.parameters(
			names, names, cov);

		for (int i = 0; i < names.size(); i++) {
			for (int j = 0; j < names.size(); j++) {
				assertThat(cov.getEntry(i, j)).isEqualTo(cov.getEntry(j, i));
				assertThat(corr.get(names.get(i)).get(names.get(j))).isEqualTo(corr
					.get(names.get(j)).get(names.get(i)));
			}
		}
		assertThat(corr.get(names.get(0)).get(names.get(2))).isBetween(-1.0, 1.0)
			.isNotEqualTo(0.0);
	}

	@ParameterizedTest
	@EnumSource(value = Minimizer.class, names = { "GAUSS_NEWTON", "NELDER",
		"POWELL", "CMAES", "BASINHOPPING" })
	void otherMethodsRecoverGaussian(final Minimizer method) {
		final Optimum o = adapter.minimize(objective(1.8, AttributeSpec.of(0.2), 1),
			method, 500000, false, FitMonitor.NONE);

		assertThat(o.getValues()[0]).isCloseTo(2.0, within(1e-2));
		assertThat(o.getValues()[1]).isCloseTo(0.3, within(1e-2));
		assertThat(o.getValues()[2]).isCloseTo(1.2, within(1e-2));
		assertThat(o.hasCovariance()).isFalse();
	}

	@Test
	void ensembleSamplerKeepsMostProbableSample() {
		final Optimum o = adapter.minimize(objective(1.9, AttributeSpec.of(0.25),
			1.1), Minimizer.EMCEE, 500000, true, FitMonitor.NONE);

		assertThat(o.getReason()).isEqualTo(TerminationReason.CONVERGED);
		assertThat(o.isSuccess()).isTrue();
		// unit-variance likelihood, so the samples spread by about 0.1
		assertThat(o.getValues()[0]).isCloseTo(2.0, within(0.05));
		assertThat(o.getValues()[1]).isCloseTo(0.3, within(0.05));
		assertThat(o.getValues()[2]).isCloseTo(1.2, within(0.05));
		assertThat(o.getNfev()).isLessThanOrEqualTo(100 + 100 * 1000);
	}

	@Test
	void differentialEvolutionSearchesTheBox() {
		final Optimum o = adapter.minimize(objective(1, AttributeSpec.of(0, -1, 1),
			1), Minimizer.DIFFERENTIAL_EVOLUTION, 0, false, FitMonitor.NONE);

		assertThat(o.getValues()[1]).isCloseTo(0.3, within(2e-2));
		assertThat(o.getChiSquare()).isLessThan(0.1);
	}

	@Test
	void differentialEvolutionNeedsFiniteBounds() {
		final int[] calls = new int[1];
		final FitMonitor counting = new FitMonitor() {

			@Override
			public void evaluated(final int nfev, final int maxNfev,
				final double[] values, final double chiSquare)
			{
				calls[0]++;
			}
		};
		assertThatThrownBy(() -> adapter.minimize(objective(1, AttributeSpec.of(0),
			1), Minimizer.DIFFERENTIAL_EVOLUTION, 100, false, counting))
				.isInstanceOf(InvalidBoundsException.class).hasMessageContaining(
					"gaussian_center_1");
		assertThat(calls[0]).isZero();
	}

	@Test
	void budgetIsAHardLimit() {
		final Optimum o = adapter.minimize(objective(1, AttributeSpec.of(0), 1),
			Minimizer.LEASTSQ, 5, true, FitMonitor.NONE);

		assertThat(o.getReason()).isEqualTo(TerminationReason.MAX_EVALS_REACHED);
		assertThat(o.isSuccess()).isFalse();
		assertThat(o.getNfev()).isEqualTo(5);
		assertThat(o.getMaxNfev()).isEqualTo(5);
		assertThat(o.getMessage()).contains("(5)");
		for (final double v : o.getValues()) {
			assertThat(v).isFinite();
		}
	}

	@Test
	void monitorCanAbort() {
		final FitMonitor abortAfterThree = new FitMonitor() {

			private int seen;

			@Override
			public void evaluated(final int nfev, final int maxNfev,
				final double[] values, final double chiSquare)
			{
				seen = nfev;
			}

			@Override
			public boolean isAborted() {
				return seen >= 3;
			}
		};
		final Optimum o = adapter.minimize(objective(1, AttributeSpec.of(0), 1),
			Minimizer.NELDER, 1000, false, abortAfterThree);

		assertThat(o.getReason()).isEqualTo(TerminationReason.USER_ABORT);
		assertThat(o.getNfev()).isEqualTo(3);
	}

	@Test
	void fixedModelIsEvaluatedOnce() {
		final ParameterGraph graph = ParameterGraphBuilder.build(Collections
			.singletonList(PeakSpec.of(1, "gaussian").with("amplitude", AttributeSpec
				.fixed(2))));
		final Optimum o = adapter.minimize(new CompositeObjective(graph,
			gaussianData().column(0), 0, NanPolicy.PROPAGATE), Minimizer.LEASTSQ,
			1000, true, FitMonitor.NONE);

		assertThat(o.getNfev()).isEqualTo(1);
		assertThat(o.getValues()).isEmpty();
		assertThat(o.hasCovariance()).isFalse();
		assertThat(o.getReason()).isEqualTo(TerminationReason.CONVERGED);
	}

	@Test
	void covarianceOfAConstantIsTheVarianceOfTheMean() {
		final double[] x = new double[10];
		final double[] y = new double[10];
		for (int i = 0; i < x.length; i++) {
			x[i] = i;
			y[i] = 2 + (i % 2 == 0 ? 0.1 : -0.1);
		}
		final ParameterGraph graph = ParameterGraphBuilder.build(Collections
			.singletonList(PeakSpec.of(1, "constant").with("amplitude", AttributeSpec
				.of(0))));
		final Optimum o = adapter.minimize(new CompositeObjective(graph, Dataset.of(
			x, y).column(0), 0, NanPolicy.PROPAGATE), Minimizer.LEASTSQ, 1000, true,
			FitMonitor.NONE);

		assertThat(o.getValues()[0]).isCloseTo(2.0, within(1e-8));
		assertThat(o.getChiSquare()).isCloseTo(0.1, within(1e-10));
		// chi2 / (n - k) / n
		assertThat(o.getStandardErrors()[0]).isCloseTo(1.0 / 30, within(1e-6));
	}

	@Test
	void covarianceIsUnavailableForDegenerateParameters() {
		final PeakSpec first = PeakSpec.of(1, "gaussian").with("amplitude",
			AttributeSpec.of(1));
		final PeakSpec second = PeakSpec.of(2, "gaussian").with("amplitude",
			AttributeSpec.of(1));
		final ParameterGraph graph = ParameterGraphBuilder.build(Arrays.asList(
			first, second));
		final CompositeObjective o = new CompositeObjective(graph, gaussianData()
			.column(0), 0, NanPolicy.PROPAGATE);
		final double[] best = { 1, 1 };

		assertThat(adapter.covariance(o, best, o.residual(best))).isNull();
	}

	@Test
	void covarianceNeedsMoreSamplesThanParameters() {
		final ParameterGraph graph = ParameterGraphBuilder.build(Collections
			.singletonList(PeakSpec.of(1, "linear") //
				.with("slope", AttributeSpec.of(1)) //
				.with("intercept", AttributeSpec.of(0))));
		final CompositeObjective o = new CompositeObjective(graph, Dataset.of(
			new double[] { 0, 1 }, new double[] { 0, 1 }).column(0), 0,
			NanPolicy.PROPAGATE);
		final double[] best = { 1, 0 };

		assertThat(adapter.covariance(o, best, o.residual(best))).isNull();
	}
}
