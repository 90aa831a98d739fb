/**
 * SpectraFit
 * BoundsTransform.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import org.apache.commons.math3.util.FastMath;

/**
 * MINUIT-style change of variables between a bounded external value and an
 * unbounded internal optimizer coordinate. Two-sided bounds use a sine
 * mapping, one-sided bounds a square-root mapping.
 */
public final class BoundsTransform {

	private BoundsTransform() {}

	public static double toInternal(final double value, final double min,
		final double max)
	{
		final boolean lower = !Double.isInfinite(min);
		final boolean upper = !Double.isInfinite(max);
		if (lower && upper) {
			if (max == min) return 0.0;
			final double s = 2.0 * (value - min) / (max - min) - 1.0;
			return FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, s)));
		}
		if (lower) {
			final double d = FastMath.max(value - min, 0.0) + 1.0;
			return FastMath.sqrt(d * d - 1.0);
		}
		if (upper) {
			final double d = FastMath.max(max - value, 0.0) + 1.0;
			return FastMath.sqrt(d * d - 1.0);
		}
		return value;
	}

	public static double toExternal(final double internal, final double min,
		final double max)
	{
		final boolean lower = !Double.isInfinite(min);
		final boolean upper = !Double.isInfinite(max);
		if (lower && upper) {
			return min + (FastMath.sin(internal) + 1.0) * (max - min) / 2.0;
		}
		if (lower) {
			return min - 1.0 + FastMath.sqrt(internal * internal + 1.0);
		}
		if (upper) {
			return max + 1.0 - FastMath.sqrt(internal * internal + 1.0);
		}
		return internal;
	}
}
