/**
 * SpectraFit
 * ProjectReaderTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.exception.UnknownMethodException;
import spectrafit.exception.UnknownModelException;
import spectrafit.models.Model;
import spectrafit.parameters.AttributeSpec;
import spectrafit.parameters.PeakDetectionSettings;
import spectrafit.parameters.PeakSpec;
import spectrafit.solver.Dataset;
import spectrafit.solver.Minimizer;
import spectrafit.solver.NanPolicy;

class ProjectReaderTest {

	private static final ObjectMapper MAPPER = new ObjectMapper().configure(
		JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
	private static final TypeReference<Map<String, Object>> MAPPING =
		new TypeReference<Map<String, Object>>()
		{};
	private static final Dataset DATA = Dataset.of(new double[] { 0, 1, 2 },
		new double[] { 1, 2, 1 });

	private static FitProject read(final String json) throws IOException {
		return ProjectReader.read(MAPPER.<Map<String, Object>> readValue(json,
			MAPPING), DATA);
	}

	@Test
	void readsProjectFile() throws IOException {
		final Map<String, Object> mapping;
		try (InputStream in = getClass().getResourceAsStream("project.json")) {
			mapping = MAPPER.readValue(in, MAPPING);
		}
		final FitProject project = ProjectReader.read(mapping, DATA);

		final SolverSettings s = project.getSettings();
		assertThat(s.getGlobal()).isZero();
		assertThat(s.getNanPolicy()).isEqualTo(NanPolicy.OMIT);
		assertThat(s.isCalcCovar()).isTrue();
		assertThat(s.getMethod()).isEqualTo(Minimizer.NELDER);
		assertThat(s.getMaxNfev()).isEqualTo(2000);
		assertThat(s.getConfidence().isEnabled()).isTrue();
		assertThat(s.getConfidence().isTrace()).isTrue();
		assertThat(s.getConfidence().getMaxIter()).isEqualTo(50);
		assertThat(s.getConfidence().getMinRelChange()).isEqualTo(1e-4);
		assertThat(s.getConfidence().getProbabilities()[1]).isCloseTo(0.9545,
			within(1e-4));

		final List<PeakSpec> peaks = project.getPeaks();
		assertThat(peaks).hasSize(2);
		final Map<String, AttributeSpec> first = peaks.get(0).getAttributes();
		assertThat(peaks.get(0).getModel()).isEqualTo(Model.PSEUDOVOIGT);
		assertThat(first.get("amplitude").getMax()).isEqualTo(
			Double.POSITIVE_INFINITY);
		assertThat(first.get("fwhmg").getValue()).isEqualTo(0.1);
		assertThat(first.get("fwhmg").isVary()).isTrue();
		assertThat(first.get("fwhml").isVary()).isFalse();

		assertThat(peaks.get(1).getModel()).isEqualTo(Model.GAUSSIAN);
		assertThat(peaks.get(1).getIndex()).isEqualTo(2);
		final Map<String, AttributeSpec> second = peaks.get(1).getAttributes();
		assertThat(second.get("amplitude").getExpr()).isEqualTo(
			"pseudovoigt_amplitude_1 / 3");
		assertThat(second.get("center").isShared("center")).isFalse();
		assertThat(project.getDataset()).isSameAs(DATA);
	}

	@Test
	void defaultsApplyToMissingSections() throws IOException {
		final FitProject project = read(
			"{'fitting': {'peaks': {'1': {'constant': {'amplitude': 1}}}}}");

		final SolverSettings s = project.getSettings();
		assertThat(s.getMethod()).isEqualTo(Minimizer.LEASTSQ);
		assertThat(s.getNanPolicy()).isEqualTo(NanPolicy.PROPAGATE);
		assertThat(s.getMaxNfev()).isEqualTo(SolverSettings.DEFAULT_MAX_NFEV);
		assertThat(s.getConfidence().isEnabled()).isFalse();
	}

	@Test
	void confIntervalTrueUsesDefaults() throws IOException {
		final FitProject project = read("{'fitting': {'parameters': " +
			"{'conf_interval': true}, 'peaks': {'1': {'constant': {}}}}}");

		assertThat(project.getSettings().getConfidence().isEnabled()).isTrue();
		assertThat(project.getSettings().getConfidence().getProbabilities())
			.hasSize(3);
	}

	@Test
	void predefinedPeaksAreKeyedByDataset() throws IOException {
		final FitProject project = read("{'settings': {'global': 2}, 'fitting': " +
			"{'peaks': {'1': {'1': {'gaussian': {'center': 0}}}, " +
			"'2': {'1': {'gaussian': {'center': 1}}}}}}");

		assertThat(project.getPeaks()).extracting(PeakSpec::getDataset)
			.containsExactly(1, 2);
	}

	@Test
	void autopeakTrueDetectsWithEstimatedWindows() throws IOException {
		final FitProject project = read(
			"{'settings': {'autopeak': true}, 'fitting': {}}");

		final PeakDetectionSettings d = project.getSettings().getPeakDetection();
		assertThat(d.isEnabled()).isTrue();
		assertThat(d.getModel()).isEqualTo(Model.GAUSSIAN);
		assertThat(d.getHeight()).isNull();
		assertThat(project.getPeaks()).isEmpty();
	}

	@Test
	void autopeakMappingSetsWindows() throws IOException {
		final FitProject project = read("{'settings': {'autopeak': " +
			"{'modeltype': 'lorentzian', 'height': [0.1, 5], 'prominence': 0.2, " +
			"'distance': 3, 'rel_height': 0.8}}, 'fitting': {}}");

		final PeakDetectionSettings d = project.getSettings().getPeakDetection();
		assertThat(d.getModel()).isEqualTo(Model.LORENTZIAN);
		assertThat(d.getHeight()).containsExactly(0.1, 5);
		assertThat(d.getProminence()).containsExactly(0.2,
			Double.POSITIVE_INFINITY);
		assertThat(d.getDistance()).isEqualTo(3.0);
		assertThat(d.getRelHeight()).isEqualTo(0.8);
		assertThat(d.getWidth()).isNull();
	}

	@Test
	void rejectsInvalidAutopeak() {
		assertThatThrownBy(() -> read("{'settings': {'autopeak': " +
			"{'modeltype': 'exponential'}}, 'fitting': {}}")).isInstanceOf(
				InvalidSettingsException.class);
		assertThatThrownBy(() -> read("{'settings': {'autopeak': " +
			"{'height': [1, 2, 3]}}, 'fitting': {}}")).isInstanceOf(
				InvalidSettingsException.class);
		assertThatThrownBy(() -> read("{'settings': {'autopeak': " +
			"{'smoothing': 2}}, 'fitting': {}}")).isInstanceOf(
				InvalidSettingsException.class).hasMessageContaining("smoothing");
		assertThatThrownBy(() -> read("{'settings': {'autopeak': false}, " +
			"'fitting': {}}")).isInstanceOf(InvalidSettingsException.class)
				.hasMessageContaining("No peaks");
	}

	@Test
	void rejectsPeakWithTwoModels() {
		assertThatThrownBy(() -> read("{'fitting': {'peaks': {'1': " +
			"{'gaussian': {}, 'lorentzian': {}}}}}")).isInstanceOf(
				InvalidSettingsException.class);
	}

	@Test
	void rejectsNonPositivePeakIndex() {
		assertThatThrownBy(() -> read(
			"{'fitting': {'peaks': {'0': {'gaussian': {}}}}}")).isInstanceOf(
				InvalidSettingsException.class);
		assertThatThrownBy(() -> read(
			"{'fitting': {'peaks': {'x': {'gaussian': {}}}}}")).isInstanceOf(
				InvalidSettingsException.class);
	}

	@Test
	void rejectsProjectWithoutPeaks() {
		assertThatThrownBy(() -> read("{'fitting': {'peaks': {}}}")).isInstanceOf(
			InvalidSettingsException.class).hasMessageContaining("No peaks");
	}

	@Test
	void rejectsUnknownNames() {
		assertThatThrownBy(() -> read("{'fitting': {'parameters': {'optimizer': " +
			"{'method': 'bfgs'}}, 'peaks': {'1': {'gaussian': {}}}}}")).isInstanceOf(
				UnknownMethodException.class);
		assertThatThrownBy(() -> read(
			"{'fitting': {'peaks': {'1': {'sinc': {}}}}}")).isInstanceOf(
				UnknownModelException.class);
		assertThatThrownBy(() -> read("{'fitting': {'parameters': {'minimizer': " +
			"{'nan_policy': 'ignore'}}, 'peaks': {'1': {'gaussian': {}}}}}"))
				.isInstanceOf(InvalidSettingsException.class);
	}

	@Test
	void rejectsMalformedValues() {
		assertThatThrownBy(() -> read("{'fitting': {'peaks': {'1': " +
			"{'gaussian': {'center': {'value': 'abc'}}}}}}")).isInstanceOf(
				InvalidSettingsException.class);
		assertThatThrownBy(() -> read("{'fitting': {'peaks': {'1': " +
			"{'gaussian': {'center': {'vary': 'maybe'}}}}}}")).isInstanceOf(
				InvalidSettingsException.class);
	}
}
