/**
 * SpectraFit
 * SpectraFitTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;

import spectrafit.exception.InvalidBoundsException;
import spectrafit.exception.InvalidSettingsException;
import spectrafit.models.Model;
import spectrafit.parameters.AttributeSpec;
import spectrafit.parameters.ParameterGraph;
import spectrafit.parameters.ParameterGraphBuilder;
import spectrafit.parameters.PeakDetectionSettings;
import spectrafit.parameters.PeakSpec;
import spectrafit.report.FitReport;
import spectrafit.solver.Dataset;
import spectrafit.solver.FitMonitor;
import spectrafit.solver.GlobalFitAggregator;
import spectrafit.solver.NanPolicy;
import spectrafit.solver.TerminationReason;
import spectrafit.statistics.ConfidenceSettings;

class SpectraFitTest {

	private static Context context;
	private static SpectraFit spectraFit;

	@BeforeAll
	static void setUp() {
		context = new Context(LogService.class, StatusService.class);
		spectraFit = new SpectraFit(context);
	}

	@AfterAll
	static void tearDown() {
		context.dispose();
	}

	private static double[] axis(final int n, final double from,
		final double to)
	{
		final double[] x = new double[n];
		for (int i = 0; i < n; i++) {
			x[i] = from + (to - from) * i / (n - 1);
		}
		return x;
	}

	private static PeakSpec pseudoVoigt(final double amplitude,
		final double center, final double fwhmg, final double fwhml)
	{
		return PeakSpec.of(1, "pseudovoigt") //
			.with("amplitude", AttributeSpec.of(amplitude, 0, 2)) //
			.with("center", AttributeSpec.of(center, -2, 2)) //
			.with("fwhmg", AttributeSpec.of(fwhmg, 0.02, 0.4)) //
			.with("fwhml", AttributeSpec.of(fwhml, 0.01, 0.4));
	}

	@Test
	void recoversNoiselessPseudoVoigt() {
		final double[] x = axis(577, -1, 1);
		final double[] y = Model.PSEUDOVOIGT.evaluate(x, 1, 0, 0.1, 0.05);
		final FitProject project = FitProject.create(Collections.singletonList(
			pseudoVoigt(0.8, 0.01, 0.08, 0.08)), SolverSettings.create()
				.withMaxNfev(5000), Dataset.of(x, y));

		final FitResult result = spectraFit.fit(project, FitMonitor.NONE);

		assertThat(result.getReason()).isEqualTo(TerminationReason.CONVERGED);
		assertThat(result.isGlobal()).isFalse();
		assertThat(result.getParameter("pseudovoigt_amplitude_1").getBestValue())
			.isCloseTo(1.0, within(0.01));
		assertThat(result.getParameter("pseudovoigt_center_1").getBestValue())
			.isCloseTo(0.0, within(0.001));
		assertThat(result.getParameter("pseudovoigt_fwhmg_1").getBestValue())
			.isCloseTo(0.1, within(0.001));
		assertThat(result.getParameter("pseudovoigt_fwhml_1").getBestValue())
			.isCloseTo(0.05, within(0.0005));
		assertThat(result.getStatistics().getGoodness().getDegreesOfFreedom())
			.isEqualTo(573);
		assertThat(result.getTable().getResult()).containsKeys("energy",
			"intensity", "residual", "fit", "pseudovoigt_1");
	}

	@Test
	void literalStartBelowLowerBoundIsRejectedBeforeFitting() {
		final double[] x = axis(101, -1, 1);
		final FitProject project = FitProject.create(Collections.singletonList(
			pseudoVoigt(1, 0, 0.01, 0.01)), SolverSettings.create(), Dataset.of(x,
				new double[x.length]));

		assertThatThrownBy(() -> spectraFit.fit(project, FitMonitor.NONE))
			.isInstanceOf(InvalidBoundsException.class).hasMessageContaining(
				"pseudovoigt_fwhmg_1");
	}

	@Test
	void expressionHoldsAtEveryIterate() {
		final List<PeakSpec> peaks = Arrays.asList(pseudoVoigt(0.8, 0.01, 0.08,
			0.08), PeakSpec.of(2, "pseudovoigt") //
				.with("amplitude", AttributeSpec.derived("pseudovoigt_amplitude_1 / 3")) //
				.with("center", AttributeSpec.fixed(0.5)) //
				.with("fwhmg", AttributeSpec.fixed(0.1)) //
				.with("fwhml", AttributeSpec.fixed(0.05)));
		final double[] x = axis(301, -1, 1);
		final double[] y = Model.PSEUDOVOIGT.evaluate(x, 1.2, 0, 0.1, 0.05);
		final double[] second = Model.PSEUDOVOIGT.evaluate(x, 0.4, 0.5, 0.1, 0.05);
		for (int i = 0; i < y.length; i++) {
			y[i] += second[i];
		}
		final ParameterGraph graph = ParameterGraphBuilder.build(peaks);
		final List<String> violations = new ArrayList<>();
		final FitMonitor checking = new FitMonitor() {

			@Override
			public void evaluated(final int nfev, final int maxNfev,
				final double[] values, final double chiSquare)
			{
				final Map<String, Double> v = graph.resolve(values);
				if (v.get("pseudovoigt_amplitude_2") != v.get(
					"pseudovoigt_amplitude_1") / 3)
				{
					violations.add(nfev + ": " + v);
				}
			}
		};
		final FitResult result = spectraFit.fit(FitProject.create(peaks,
			SolverSettings.create().withMaxNfev(5000), Dataset.of(x, y)), checking);

		assertThat(violations).isEmpty();
		final double a1 = result.getParameter("pseudovoigt_amplitude_1")
			.getBestValue();
		assertThat(result.getParameter("pseudovoigt_amplitude_2").getBestValue())
			.isEqualTo(a1 / 3);
		assertThat(a1).isCloseTo(1.2, within(0.01));
		assertThat(result.getParameter("pseudovoigt_amplitude_2").getExpr())
			.isEqualTo("pseudovoigt_amplitude_1 / 3");
		assertThat(result.getParameter("pseudovoigt_amplitude_2").getInitValue())
			.isNaN();
	}

	@Test
	void derivedErrorsArePropagated() {
		final double[] x = axis(201, -1, 1);
		final double[] y = Model.PSEUDOVOIGT.evaluate(x, 1, 0, 0.1, 0.05);
		for (int i = 0; i < y.length; i++) {
			y[i] += 0.01 * FastMath.sin(23 * x[i]);
		}
		final List<PeakSpec> peaks = Arrays.asList(pseudoVoigt(0.9, 0, 0.1, 0.05),
			PeakSpec.of(2, "constant").with("amplitude", AttributeSpec.derived(
				"pseudovoigt_amplitude_1 / 3")));
		final FitResult result = spectraFit.fit(FitProject.create(peaks,
			SolverSettings.create(), Dataset.of(x, y)), FitMonitor.NONE);

		assertThat(result.hasErrorbars()).isTrue();
		final double se = result.getParameter("pseudovoigt_amplitude_1")
			.getStderr();
		assertThat(se).isPositive();
		assertThat(result.getParameter("constant_amplitude_2").getStderr())
			.isCloseTo(se / 3, within(se * 1e-3));
	}

	@Test
	void globalFitSharesCenterAndWidth() {
		final double[] x = axis(201, -3, 3);
		final double[] y1 = Model.GAUSSIAN.evaluate(x, 1, 0.2, 1);
		final double[] y2 = Model.GAUSSIAN.evaluate(x, 2, 0.2, 1);
		for (int i = 0; i < x.length; i++) {
			y1[i] += 0.005 * FastMath.sin(13 * x[i]);
			y2[i] += 0.005 * FastMath.cos(11 * x[i]);
		}
		final Map<String, double[]> ys = new LinkedHashMap<>();
		ys.put("intensity_1", y1);
		ys.put("intensity_2", y2);
		final PeakSpec peak = PeakSpec.of(1, "gaussian") //
			.with("amplitude", AttributeSpec.of(1.5, 0, 5)) //
			.with("center", AttributeSpec.of(0)) //
			.with("fwhmg", AttributeSpec.of(0.8, 0.1, 3));
		final FitProject project = FitProject.create(Collections.singletonList(
			peak), SolverSettings.create().withGlobal(GlobalFitAggregator.AUTO_SHARED),
			Dataset.of(x, ys));

		final FitResult result = spectraFit.fit(project);

		assertThat(result.isGlobal()).isTrue();
		assertThat(result.getFreeNames()).containsExactly("gaussian_amplitude_1_1",
			"gaussian_center_1_1", "gaussian_fwhmg_1_1", "gaussian_amplitude_1_2");
		final Map<String, Double> best = result.getBestValues();
		assertThat(best.get("gaussian_amplitude_1_1")).isCloseTo(1, within(0.01));
		assertThat(best.get("gaussian_amplitude_1_2")).isCloseTo(2, within(0.01));
		assertThat(best.get("gaussian_center_1_1")).isCloseTo(0.2, within(0.01));
		assertThat(best.get("gaussian_center_1_2")).isEqualTo(best.get(
			"gaussian_center_1_1"));
		assertThat(result.getTable().getResult()).containsKeys("energy",
			"intensity_1", "intensity_2", "fit_1", "fit_2", "residual_1",
			"residual_2", "residual_avg", "gaussian_1_1", "gaussian_1_2");
		assertThat(result.getStatistics().getGoodness().getNdata()).isEqualTo(402);

		assertThat(result.getDatasets()).hasSize(2);
		final FitResult second = result.getDatasets().get(1);
		assertThat(second.getDataset()).isEqualTo(2);
		assertThat(second.getParameters()).extracting(ParameterEstimate::getName)
			.containsExactly("gaussian_amplitude_1_2", "gaussian_center_1_2",
				"gaussian_fwhmg_1_2");
		assertThat(second.getStatistics().getGoodness().getNvarys()).isEqualTo(3);
		assertThat(second.getStatistics().getGoodness().getNdata()).isEqualTo(201);
		assertThat(second.getTable().getResidual()).hasSize(201);
	}

	@Test
	void confidenceIntervalsAreAttached() {
		final double[] x = axis(101, -2, 2);
		final double[] y = Model.GAUSSIAN.evaluate(x, 1, 0, 1);
		for (int i = 0; i < y.length; i++) {
			y[i] += 0.01 * FastMath.sin(7 * x[i]);
		}
		final PeakSpec peak = PeakSpec.of(1, "gaussian") //
			.with("amplitude", AttributeSpec.of(0.9)) //
			.with("center", AttributeSpec.of(0.1)) //
			.with("fwhmg", AttributeSpec.fixed(1));
		final FitResult result = spectraFit.fit(FitProject.create(Collections
			.singletonList(peak), SolverSettings.create().withConfidence(
				ConfidenceSettings.create().withProbabilities(1)), Dataset.of(x, y)),
			FitMonitor.NONE);

		final double best = result.getParameter("gaussian_amplitude_1")
			.getBestValue();
		final double lower = result.getStatistics().getConfidence().interval(
			"gaussian_amplitude_1").limit(0, false);
		final double upper = result.getStatistics().getConfidence().interval(
			"gaussian_amplitude_1").limit(0, true);
		assertThat(lower).isLessThan(best);
		assertThat(upper).isGreaterThan(best);
		final double se = result.getParameter("gaussian_amplitude_1").getStderr();
		assertThat(upper - best).isCloseTo(se, within(0.2 * se));
	}

	@Test
	void numericalFailureIsReportedAsUnsuccessful() {
		final double[] x = axis(101, -1, 1);
		final double[] y = Model.PSEUDOVOIGT.evaluate(x, 1, 0, 0.1, 0.05);
		y[50] = Double.NaN;
		final FitProject project = FitProject.create(Collections.singletonList(
			pseudoVoigt(0.8, 0.01, 0.08, 0.08)), SolverSettings.create(), Dataset.of(
				x, y));

		final FitResult result = spectraFit.fit(project, FitMonitor.NONE);
		final FitReport report = spectraFit.report(project, result);

		assertThat(result.isSuccess()).isFalse();
		assertThat(result.getParameter("pseudovoigt_amplitude_1").getBestValue())
			.isEqualTo(0.8);
		assertThat(report.getFitInsights().getComputational().get("success"))
			.isEqualTo(false);
	}

	@Test
	void globalOmitPadsResultColumnsToEqualLength() {
		final double[] x = axis(50, -2, 2);
		final double[] y1 = Model.GAUSSIAN.evaluate(x, 1, 0, 1);
		final double[] y2 = Model.GAUSSIAN.evaluate(x, 2, 0, 1);
		y2[10] = Double.NaN;
		final Map<String, double[]> ys = new LinkedHashMap<>();
		ys.put("intensity_1", y1);
		ys.put("intensity_2", y2);
		final PeakSpec peak = PeakSpec.of(1, "gaussian") //
			.with("amplitude", AttributeSpec.of(1.5, 0, 5)) //
			.with("center", AttributeSpec.of(0.1)) //
			.with("fwhmg", AttributeSpec.of(0.8, 0.1, 3));
		final FitProject project = FitProject.create(Collections.singletonList(
			peak), SolverSettings.create().withNanPolicy(NanPolicy.OMIT), Dataset.of(
				x, ys));

		final FitResult result = spectraFit.fit(project, FitMonitor.NONE);
		final Map<String, double[]> columns = spectraFit.report(project, result)
			.getFitResult();

		assertThat(result.getTable().getResult().get("residual_1")).hasSize(50);
		assertThat(result.getTable().getResult().get("residual_2")).hasSize(49);
		assertThat(columns).containsKeys("energy_1", "energy_2").doesNotContainKey(
			"residual_avg");
		for (final double[] column : columns.values()) {
			assertThat(column).hasSize(50);
		}
		assertThat(columns.get("residual_2")[49]).isNaN();
		assertThat(columns.get("energy_2")[10]).isEqualTo(x[11]);
	}

	@Test
	void detectedPeaksAreFitted() {
		final double[] x = axis(191, 0.5, 10);
		final double[] first = Model.GAUSSIAN.evaluate(x, 2, 3, 0.8);
		final double[] second = Model.GAUSSIAN.evaluate(x, 1.5, 7, 1.0);
		final double[] y = new double[x.length];
		for (int i = 0; i < y.length; i++) {
			y[i] = first[i] + second[i];
		}
		final FitProject project = FitProject.create(Collections
			.<PeakSpec> emptyList(), SolverSettings.create().withMaxNfev(5000)
				.withPeakDetection(PeakDetectionSettings.create()), Dataset.of(x, y));

		final FitResult result = spectraFit.fit(project, FitMonitor.NONE);

		assertThat(result.getReason()).isEqualTo(TerminationReason.CONVERGED);
		assertThat(result.getParameter("gaussian_amplitude_1").getBestValue())
			.isCloseTo(2.0, within(1e-3));
		assertThat(result.getParameter("gaussian_center_1").getBestValue())
			.isCloseTo(3.0, within(1e-3));
		assertThat(result.getParameter("gaussian_amplitude_2").getBestValue())
			.isCloseTo(1.5, within(1e-3));
		assertThat(result.getParameter("gaussian_fwhmg_2").getBestValue())
			.isCloseTo(1.0, within(1e-3));
		assertThat(spectraFit.report(project, result).getSettings()
			.get("autopeak")).isEqualTo(true);
	}

	@Test
	void peakDetectionNeedsASingleSpectrum() {
		final double[] x = axis(50, -2, 2);
		final Map<String, double[]> ys = new LinkedHashMap<>();
		ys.put("intensity_1", Model.GAUSSIAN.evaluate(x, 1, 0, 1));
		ys.put("intensity_2", Model.GAUSSIAN.evaluate(x, 2, 0, 1));
		final FitProject project = FitProject.create(Collections
			.<PeakSpec> emptyList(), SolverSettings.create().withPeakDetection(
				PeakDetectionSettings.create()), Dataset.of(x, ys));

		assertThatThrownBy(() -> spectraFit.fit(project, FitMonitor.NONE))
			.isInstanceOf(InvalidSettingsException.class).hasMessageContaining(
				"single spectrum");
	}

	@Test
	void flatSpectrumHasNoPeaksToDetect() {
		final double[] x = axis(50, -2, 2);
		final FitProject project = FitProject.create(Collections
			.<PeakSpec> emptyList(), SolverSettings.create().withPeakDetection(
				PeakDetectionSettings.create()), Dataset.of(x, new double[x.length]));

		assertThatThrownBy(() -> spectraFit.fit(project, FitMonitor.NONE))
			.isInstanceOf(InvalidSettingsException.class).hasMessageContaining(
				"No peaks detected");
	}
}
