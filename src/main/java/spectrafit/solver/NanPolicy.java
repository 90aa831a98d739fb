/**
 * SpectraFit
 * NanPolicy.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import java.util.Locale;

import spectrafit.exception.InvalidSettingsException;

/** Handling of NaN and infinite values in data and residuals. */
public enum NanPolicy {
	/** Non-finite values flow into the residual. */
	PROPAGATE,
	/** Non-finite data or residuals raise a NonFiniteDataException. */
	RAISE,
	/** Non-finite sample positions are dropped before fitting. */
	OMIT;

	public static NanPolicy fromString(final String name) {
		if (name == null) {
			throw new InvalidSettingsException("Missing nan_policy");
		}
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		}
		catch (final IllegalArgumentException e) {
			throw new InvalidSettingsException("Unknown nan_policy: " + name, e);
		}
	}

	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}
}
