/**
 * SpectraFit
 * PeakDetectorTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.models.Model;

class PeakDetectorTest {

	private static final double[] X = new double[191];
	private static final double[] Y;

	static {
		for (int i = 0; i < X.length; i++) {
			X[i] = 0.5 + 0.05 * i;
		}
		final double[] first = Model.GAUSSIAN.evaluate(X, 2, 3, 0.8);
		final double[] second = Model.GAUSSIAN.evaluate(X, 1.5, 7, 1.0);
		Y = new double[X.length];
		for (int i = 0; i < X.length; i++) {
			Y[i] = first[i] + second[i];
		}
	}

	@Test
	void findsSeparatedGaussians() {
		final List<PeakDetector.Peak> peaks = new PeakDetector(
			PeakDetectionSettings.create()).detect(X, Y);

		assertThat(peaks).hasSize(2);
		assertThat(peaks.get(0).getPosition()).isEqualTo(50);
		assertThat(peaks.get(0).getCenter()).isCloseTo(3.0, within(1e-9));
		assertThat(peaks.get(0).getWidth()).isCloseTo(0.8, within(1e-3));
		assertThat(peaks.get(1).getCenter()).isCloseTo(7.0, within(1e-9));
		assertThat(peaks.get(1).getWidth()).isCloseTo(1.0, within(1e-3));
		assertThat(peaks.get(1).getProminence()).isCloseTo(peaks.get(1)
			.getHeight(), within(1e-4));
	}

	@Test
	void startingPeaksAreBoundedAroundDetection() {
		final List<PeakSpec> specs = new PeakDetector(PeakDetectionSettings
			.create()).peaks(X, Y);

		assertThat(specs).extracting(PeakSpec::getIndex).containsExactly(1, 2);
		assertThat(specs).extracting(PeakSpec::getModel).containsOnly(
			Model.GAUSSIAN);
		final Map<String, AttributeSpec> first = specs.get(0).getAttributes();
		final double h = Y[50];
		assertThat(first.get("amplitude").getValue()).isEqualTo(h);
		assertThat(first.get("amplitude").getMin()).isEqualTo(-1.25 * h);
		assertThat(first.get("amplitude").getMax()).isEqualTo(1.25 * h);
		assertThat(first.get("center").getMin()).isCloseTo(1.5, within(1e-9));
		assertThat(first.get("center").getMax()).isCloseTo(6.0, within(1e-9));
		assertThat(first.get("fwhmg").getValue()).isCloseTo(0.8, within(1e-3));
		assertThat(first.get("fwhmg").getMin()).isZero();
		assertThat(first.get("fwhmg").getMax()).isCloseTo(1.6, within(2e-3));
	}

	@Test
	void pseudoVoigtSplitsTheWidth() {
		final List<PeakSpec> specs = new PeakDetector(PeakDetectionSettings
			.create().withModel(Model.PSEUDOVOIGT)).peaks(X, Y);

		final Map<String, AttributeSpec> second = specs.get(1).getAttributes();
		assertThat(second.get("fwhmg").getValue()).isCloseTo(0.5, within(1e-3));
		assertThat(second.get("fwhmg").getMax()).isCloseTo(1.0, within(1e-3));
		assertThat(second.get("fwhml").getValue()).isCloseTo(0.5, within(1e-3));
		assertThat(second.get("fwhml").getMax()).isCloseTo(2.0, within(2e-3));
	}

	@Test
	void windowsFilterPeaks() {
		assertThat(new PeakDetector(PeakDetectionSettings.create().withHeight(2,
			Double.POSITIVE_INFINITY)).detect(X, Y)).extracting(
				PeakDetector.Peak::getPosition).containsExactly(50);
		assertThat(new PeakDetector(PeakDetectionSettings.create().withWidth(0.9,
			2)).detect(X, Y)).extracting(PeakDetector.Peak::getPosition)
				.containsExactly(130);
		assertThat(new PeakDetector(PeakDetectionSettings.create().withDistance(
			100)).detect(X, Y)).extracting(PeakDetector.Peak::getPosition)
				.containsExactly(50);
	}

	@Test
	void flatTopsAreMarkedAtTheirCenter() {
		assertThat(PeakDetector.localMaxima(new double[] { 0, 1, 1, 1, 0, 2,
			0 })).containsExactly(2, 5);
		assertThat(PeakDetector.localMaxima(new double[] { 0, 1, 1 })).isEmpty();
		assertThat(PeakDetector.localMaxima(new double[] { 3, 2, 1 })).isEmpty();
	}

	@Test
	void rejectsInvalidSettings() {
		assertThatThrownBy(() -> PeakDetectionSettings.create().withModel(
			Model.LINEAR)).isInstanceOf(InvalidSettingsException.class)
				.hasMessageContaining("linear");
		assertThatThrownBy(() -> PeakDetectionSettings.create().withHeight(2, 1))
			.isInstanceOf(InvalidSettingsException.class);
		assertThatThrownBy(() -> PeakDetectionSettings.create().withDistance(0.5))
			.isInstanceOf(InvalidSettingsException.class);
		assertThatThrownBy(() -> PeakDetectionSettings.create().withRelHeight(
			1.5)).isInstanceOf(InvalidSettingsException.class);
	}
}
