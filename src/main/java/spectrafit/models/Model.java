/**
 * SpectraFit
 * Model.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.models;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.math3.exception.DimensionMismatchException;

import spectrafit.exception.UnknownAttributeException;
import spectrafit.exception.UnknownModelException;

/**
 * Closed registry of the supported model families. Each variant has a fixed
 * attribute signature with defaults; the tag is resolved once when a peak is
 * declared, so evaluation inside the optimizer never dispatches on strings.
 */
public enum Model {

	GAUSSIAN("gaussian", signature("amplitude", "center", "fwhmg"), initial(1, 0, 1)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.gaussian(x, p[0], p[1], p[2]);
		}
	},
	ORCAGAUSSIAN("orcagaussian", signature("amplitude", "center", "width"), initial(1,
		0, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.orcaGaussian(x, p[0], p[1], p[2]);
		}
	},
	LORENTZIAN("lorentzian", signature("amplitude", "center", "fwhml"), initial(1, 0,
		1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.lorentzian(x, p[0], p[1], p[2]);
		}
	},
	VOIGT("voigt", signature("amplitude", "center", "fwhmv", "gamma"), initial(1, 0, 1,
		Double.NaN))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.voigt(x, p[0], p[1], p[2], p[3]);
		}
	},
	PSEUDOVOIGT("pseudovoigt", signature("amplitude", "center", "fwhmg", "fwhml"),
		initial(1, 0, 1, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.pseudoVoigt(x, p[0], p[1], p[2], p[3]);
		}
	},
	EXPONENTIAL("exponential", signature("amplitude", "decay", "intercept"), initial(1,
		1, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.exponential(x, p[0], p[1], p[2]);
		}
	},
	POWER("power", signature("amplitude", "exponent", "intercept"), initial(1, 1, 0)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.power(x, p[0], p[1], p[2]);
		}
	},
	LINEAR("linear", signature("slope", "intercept"), initial(1, 0)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.polynomial(x, p[1], p[0]);
		}
	},
	CONSTANT("constant", signature("amplitude"), initial(1)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.constant(x, p[0]);
		}
	},
	POLYNOM2("polynom2", signature("coefficient0", "coefficient1", "coefficient2"),
		initial(0, 0, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.polynomial(x, p);
		}
	},
	POLYNOM3("polynom3", signature("coefficient0", "coefficient1", "coefficient2",
		"coefficient3"), initial(0, 0, 0, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.polynomial(x, p);
		}
	},
	ERF("erf", signature("amplitude", "center", "sigma"), initial(1, 0, 1)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.erfStep(x, p[0], p[1], p[2]);
		}
	},
	HEAVISIDE("heaviside", signature("amplitude", "center", "sigma"), initial(1, 0,
		1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.heaviside(x, p[0], p[1], p[2]);
		}
	},
	ATAN("atan", signature("amplitude", "center", "sigma"), initial(1, 0, 1)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.atanStep(x, p[0], p[1], p[2]);
		}
	},
	LOG("log", signature("amplitude", "center", "sigma"), initial(1, 0, 1)) {

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.logisticStep(x, p[0], p[1], p[2]);
		}
	},
	CGAUSSIAN("cgaussian", signature("amplitude", "center", "fwhmg"), initial(1, 0,
		1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.cumulativeGaussian(x, p[0], p[1], p[2]);
		}
	},
	CLORENTZIAN("clorentzian", signature("amplitude", "center", "fwhml"), initial(1,
		0, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.cumulativeLorentzian(x, p[0], p[1], p[2]);
		}
	},
	CVOIGT("cvoigt", signature("amplitude", "center", "fwhmv", "gamma"), initial(1, 0,
		1, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.cumulativeVoigt(x, p[0], p[1], p[2], p[3]);
		}
	},
	PEARSON1("pearson1", signature("amplitude", "center", "sigma", "exponent"),
		initial(1, 0, 1, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.pearson1(x, p[0], p[1], p[2], p[3]);
		}
	},
	PEARSON2("pearson2", signature("amplitude", "center", "sigma", "exponent"),
		initial(1, 0, 1, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.pearson2(x, p[0], p[1], p[2], p[3]);
		}
	},
	PEARSON3("pearson3", signature("amplitude", "center", "sigma", "exponent",
		"skewness"), initial(1, 0, 1, 1, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.pearson3(x, p[0], p[1], p[2], p[3], p[4]);
		}
	},
	PEARSON4("pearson4", signature("amplitude", "center", "sigma", "exponent",
		"skewness", "kurtosis"), initial(1, 0, 1, 1, 0, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return ModelFunctions.pearson4(x, p[0], p[1], p[2], p[3], p[4], p[5]);
		}
	},
	MOESSBAUERSINGLET("moessbauersinglet", signature("amplitude", "isomershift",
		"fwhml", "center", "background"), initial(1, 0, 0.25, 0, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return Moessbauer.singlet(x, p[0], p[1], p[2], p[3], p[4]);
		}
	},
	MOESSBAUERDOUBLET("moessbauerdoublet", signature("amplitude", "isomershift",
		"quadrupolesplitting", "fwhml", "center", "background"), initial(1, 0.4, 0.8,
			0.25, 0, 0))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return Moessbauer.doublet(x, p[0], p[1], p[2], p[3], p[4], p[5]);
		}
	},
	MOESSBAUERSEXTET("moessbauersextet", signature("amplitude", "isomershift",
		"fwhml", "magneticfield", "quadrupoleshift", "center", "background",
		"theta"), initial(1, 0, 0.25, 33, 0, 0, 0, Double.NaN))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return Moessbauer.sextet(x, p[0], p[1], p[2], p[3], p[4], p[5], p[6],
				p[7]);
		}
	},
	MOESSBAUEROCTET("moessbaueroctet", signature("amplitude", "isomershift", "fwhml",
		"magneticfield", "quadrupoleshift", "center", "background", "theta",
		"efgvzz", "efgeta", "phi", "temperature", "sodshift", "sitefraction"),
		initial(1, 0, 0.25, 33, 0, 0, 0, Double.NaN, 1e21, 0, 0, 300, 0, 1))
	{

		@Override
		double[] compute(final double[] x, final double[] p) {
			return Moessbauer.octet(x, p[0], p[1], p[2], p[3], p[4], p[5], p[6], p[7],
				p[8], p[9], p[10], p[11], p[12], p[13]);
		}
	};

	private final String tag;
	private final List<String> attributes;
	private final double[] defaults;

	Model(final String tag, final String[] attributes, final double[] defaults) {
		this.tag = tag;
		this.attributes = Collections.unmodifiableList(Arrays.asList(attributes));
		this.defaults = defaults;
	}

	private static String[] signature(final String... names) {
		return names;
	}

	private static double[] initial(final double... values) {
		return values;
	}

	/**
	 * @param x sample positions
	 * @param p attribute values in signature order
	 */
	abstract double[] compute(double[] x, double[] p);

	/**
	 * Resolves a model tag, ignoring case and surrounding whitespace.
	 *
	 * @throws UnknownModelException if no variant has this tag
	 */
	public static Model fromTag(final String tag) {
		if (tag != null) {
			final String key = tag.trim().toLowerCase(Locale.ROOT);
			for (final Model m : values()) {
				if (m.tag.equals(key)) return m;
			}
		}
		throw new UnknownModelException(tag);
	}

	public String tag() {
		return tag;
	}

	/** @return attribute names in signature order */
	public List<String> attributes() {
		return attributes;
	}

	/** @return position of {@code attribute} in the signature, or -1 */
	public int indexOf(final String attribute) {
		return attributes.indexOf(attribute.toLowerCase(Locale.ROOT));
	}

	public boolean hasAttribute(final String attribute) {
		return indexOf(attribute) >= 0;
	}

	public double defaultValue(final String attribute) {
		final int i = indexOf(attribute);
		if (i < 0) throw new UnknownAttributeException(tag, attribute);
		return defaults[i];
	}

	/** @return a copy of the default attribute values in signature order */
	public double[] defaults() {
		return defaults.clone();
	}

	/**
	 * Evaluates the model with positional attributes.
	 *
	 * @param x sample positions
	 * @param p attribute values, in the order of {@link #attributes()}
	 * @return a new array of model values
	 * @throws DimensionMismatchException if {@code p} does not match the
	 *           signature
	 */
	public double[] evaluate(final double[] x, final double... p) {
		if (p.length != defaults.length) {
			throw new DimensionMismatchException(p.length, defaults.length);
		}
		return compute(x, p);
	}

	/**
	 * Evaluates the model with named attributes; names are case-insensitive and
	 * missing attributes take their default value.
	 *
	 * @throws UnknownAttributeException for a name outside the signature
	 */
	public double[] evaluate(final double[] x,
		final Map<String, ? extends Number> named)
	{
		final double[] p = defaults();
		for (final Map.Entry<String, ? extends Number> e : named.entrySet()) {
			final int i = indexOf(e.getKey());
			if (i < 0) throw new UnknownAttributeException(tag, e.getKey());
			p[i] = e.getValue().doubleValue();
		}
		return compute(x, p);
	}

	@Override
	public String toString() {
		return tag;
	}
}
