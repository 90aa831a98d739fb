/**
 * SpectraFit
 * Minimizer.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import java.util.Locale;

import spectrafit.exception.UnknownMethodException;

/** Minimization methods selectable by name. */
public enum Minimizer {
	LEASTSQ("leastsq", "least_squares"),
	GAUSS_NEWTON("gauss_newton"),
	NELDER("nelder", "nelder_mead"),
	POWELL("powell"),
	CMAES("cmaes"),
	DIFFERENTIAL_EVOLUTION("differential_evolution"),
	BASINHOPPING("basinhopping"),
	EMCEE("emcee");

	private final String[] names;

	Minimizer(final String... names) {
		this.names = names;
	}

	/** @throws UnknownMethodException if no method has this name */
	public static Minimizer fromName(final String name) {
		if (name != null) {
			final String key = name.trim().toLowerCase(Locale.ROOT);
			for (final Minimizer m : values()) {
				for (final String n : m.names) {
					if (n.equals(key)) return m;
				}
			}
		}
		throw new UnknownMethodException(name);
	}

	/** @return the canonical method name */
	public String key() {
		return names[0];
	}

	/** @return whether the method works on the residual vector rather than chi-square */
	public boolean isLeastSquares() {
		return this == LEASTSQ || this == GAUSS_NEWTON;
	}

	@Override
	public String toString() {
		return key();
	}
}
