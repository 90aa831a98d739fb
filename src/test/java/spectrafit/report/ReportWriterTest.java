/**
 * SpectraFit
 * ReportWriterTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.report;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;

import spectrafit.FitProject;
import spectrafit.SolverSettings;
import spectrafit.SpectraFit;
import spectrafit.models.Model;
import spectrafit.solver.Dataset;
import spectrafit.solver.FitMonitor;

class ReportWriterTest {

	private static Context context;
	private static FitReport report;

	@BeforeAll
	static void setUp() {
		context = new Context(LogService.class, StatusService.class);
		final SpectraFit spectraFit = new SpectraFit(context);
		final double[] x = ReportAssemblerTest.axis();
		final FitProject project = FitProject.create(ReportAssemblerTest.peaks(),
			SolverSettings.create(), Dataset.of(x, ReportAssemblerTest.ripple(x,
				Model.GAUSSIAN.evaluate(x, 1, 0, 1))));
		report = spectraFit.report(project, spectraFit.fit(project,
			FitMonitor.NONE));
	}

	@AfterAll
	static void tearDown() {
		context.dispose();
	}

	@Test
	void writesTopLevelKeysInOrder() throws IOException {
		final String json = new ReportWriter().toJson(report);

		assertThat(json).contains("\"version\" : \"1.0\"");
		assertThat(json.indexOf("\"settings\"")).isLessThan(json.indexOf(
			"\"fit_insights\""));
		assertThat(json.indexOf("\"fit_insights\"")).isLessThan(json.indexOf(
			"\"fit_result\""));
		assertThat(json).doesNotContain("\"datasets\"").doesNotContain(
			"\"confidence_interval\"");
	}

	@Test
	void nonFiniteNumbersAreQuoted() throws IOException {
		final String json = new ReportWriter().toJson(report);

		assertThat(json).contains("\"init_value\" : \"NaN\"");
	}

	@Test
	void readsBackBitExactValues() throws IOException {
		final ReportWriter writer = new ReportWriter();
		final StringWriter out = new StringWriter();
		writer.write(report, out);
		final FitReport back = writer.fromJson(out.toString());

		final Map<String, FitReport.Variable> before = report.getFitInsights()
			.getVariables();
		final Map<String, FitReport.Variable> after = back.getFitInsights()
			.getVariables();
		assertThat(after.keySet()).containsExactlyElementsOf(before.keySet());
		for (final String name : before.keySet()) {
			assertThat(Double.doubleToLongBits(after.get(name).getBestValue()))
				.isEqualTo(Double.doubleToLongBits(before.get(name).getBestValue()));
		}
		assertThat(after.get("lorentzian_amplitude_2").getInitValue()).isNaN();
		assertThat(back.getFitResult().get("fit")).containsExactly(report
			.getFitResult().get("fit"));
		assertThat(back.getVersion()).isEqualTo(FitReport.VERSION);
	}
}
