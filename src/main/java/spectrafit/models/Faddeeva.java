/**
 * SpectraFit
 * Faddeeva.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.models;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * Faddeeva function {@code w(z) = exp(-z^2) erfc(-iz)} for {@code Im z >= 0},
 * using Humlicek's four-region rational approximation (J. Quant. Spectrosc.
 * Radiat. Transfer 27, 437 (1982)). Relative accuracy is about 1e-4, which is
 * well below the noise of any measured line shape.
 */
final class Faddeeva {

	private Faddeeva() {}

	static Complex w(final double x, final double y) {
		final Complex t = new Complex(y, -x);
		final double s = FastMath.abs(x) + y;

		if (s >= 15.0) {
			// region I
			return t.multiply(0.5641896).divide(t.multiply(t).add(0.5));
		}
		if (s >= 5.5) {
			// region II
			final Complex u = t.multiply(t);
			return t.multiply(u.multiply(0.5641896).add(1.410474)).divide(u.add(3.0)
				.multiply(u).add(0.75));
		}
		if (y >= 0.195 * FastMath.abs(x) - 0.176) {
			// region III
			final Complex num = horner(t, 16.4955, 20.20933, 11.96482, 3.778987,
				0.5642236);
			final Complex den = horner(t, 16.4955, 38.82363, 39.27121, 21.69274,
				6.699398, 1.0);
			return num.divide(den);
		}
		// region IV
		final Complex u = t.multiply(t);
		final Complex num = horner(u, 36183.31, -3321.9905, 1540.787, -219.0313,
			35.76683, -1.320522, 0.56419);
		final Complex den = horner(u, 32066.6, -24322.84, 9022.228, -2186.181,
			364.2191, -61.57037, 1.841439, -1.0);
		return u.exp().subtract(t.multiply(num).divide(den));
	}

	/** Evaluates {@code c[0] + z*(c[1] + z*(c[2] + ...))}. */
	private static Complex horner(final Complex z, final double... c) {
		Complex acc = new Complex(c[c.length - 1]);
		for (int i = c.length - 2; i >= 0; i--) {
			acc = acc.multiply(z).add(c[i]);
		}
		return acc;
	}
}
