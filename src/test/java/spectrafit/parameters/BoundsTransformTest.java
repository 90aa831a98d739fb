/**
 * SpectraFit
 * BoundsTransformTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class BoundsTransformTest {

	private static final double INF = Double.POSITIVE_INFINITY;

	@Test
	void unboundedValuesPassThrough() {
		assertThat(BoundsTransform.toInternal(3.5, -INF, INF)).isEqualTo(3.5);
		assertThat(BoundsTransform.toExternal(3.5, -INF, INF)).isEqualTo(3.5);
	}

	@Test
	void externalValuesStayInsideTwoSidedBounds() {
		for (double internal = -50; internal <= 50; internal += 0.7) {
			assertThat(BoundsTransform.toExternal(internal, 0.02, 1.0)).isBetween(
				0.02, 1.0);
		}
	}

	@Test
	void externalValuesStayAboveOneSidedLowerBound() {
		for (double internal = -50; internal <= 50; internal += 0.7) {
			assertThat(BoundsTransform.toExternal(internal, 2.0, INF))
				.isGreaterThanOrEqualTo(2.0);
			assertThat(BoundsTransform.toExternal(internal, -INF, 2.0))
				.isLessThanOrEqualTo(2.0);
		}
	}

	@Test
	void interiorValuesAreRecovered() {
		assertThat(BoundsTransform.toExternal(BoundsTransform.toInternal(0.3, 0.0,
			1.0), 0.0, 1.0)).isCloseTo(0.3, within(1e-12));
		assertThat(BoundsTransform.toExternal(BoundsTransform.toInternal(7.0, 2.0,
			INF), 2.0, INF)).isCloseTo(7.0, within(1e-12));
		assertThat(BoundsTransform.toExternal(BoundsTransform.toInternal(-7.0,
			-INF, 2.0), -INF, 2.0)).isCloseTo(-7.0, within(1e-12));
	}

	@Test
	void valuesOutsideBoundsAreClipped() {
		assertThat(BoundsTransform.toExternal(BoundsTransform.toInternal(5.0, 0.0,
			1.0), 0.0, 1.0)).isCloseTo(1.0, within(1e-12));
	}
}
