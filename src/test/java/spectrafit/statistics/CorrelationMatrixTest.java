/**
 * SpectraFit
 * CorrelationMatrixTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

class CorrelationMatrixTest {

	private static final List<String> NAMES = Arrays.asList("a", "b", "c");
	private static final List<String> FREE = Arrays.asList("a", "b");

	@Test
	void parameterCorrelationFromCovariance() {
		final RealMatrix cov = new Array2DRowRealMatrix(new double[][] { { 4, 2 },
			{ 2, 9 } });
		final Map<String, Map<String, Double>> c = CorrelationMatrix.parameters(
			NAMES, FREE, cov);

		assertThat(c).containsOnlyKeys("a", "b", "c");
		assertThat(c.get("a").get("a")).isEqualTo(1.0);
		assertThat(c.get("a").get("b")).isCloseTo(1.0 / 3, within(1e-15));
		assertThat(c.get("b").get("a")).isEqualTo(c.get("a").get("b"));
		assertThat(c.get("c").values()).containsOnly(Double.NaN);
		assertThat(c.get("a").get("c")).isNaN();
	}

	@Test
	void missingCovarianceGivesNaN() {
		final Map<String, Map<String, Double>> c = CorrelationMatrix.parameters(
			NAMES, FREE, null);
		for (final Map<String, Double> row : c.values()) {
			assertThat(row.values()).containsOnly(Double.NaN);
		}
	}

	@Test
	void componentCorrelation() {
		final Map<String, double[]> columns = new LinkedHashMap<>();
		columns.put("rising", new double[] { 1, 2, 3 });
		columns.put("double", new double[] { 2, 4, 6 });
		columns.put("falling", new double[] { 3, 2, 1 });
		columns.put("flat", new double[] { 5, 5, 5 });

		final Map<String, Map<String, Double>> c = CorrelationMatrix.components(
			columns);
		assertThat(c.get("rising").get("double")).isCloseTo(1.0, within(1e-12));
		assertThat(c.get("rising").get("falling")).isCloseTo(-1.0, within(1e-12));
		assertThat(c.get("flat").get("flat")).isNaN();
		assertThat(c.get("rising").get("flat")).isNaN();
		assertThat(c.get("falling").keySet()).containsExactly("rising", "double",
			"falling", "flat");
	}
}
