/**
 * SpectraFit
 * ModelFunctions.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.models;

import java.util.Arrays;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.util.FastMath;

/**
 * Vectorized line-shape, background and step functions. Every function
 * returns a new array of the same length as {@code x}; widths are given as
 * full widths at half maximum unless the parameter is called {@code sigma}.
 */
public final class ModelFunctions {

	/** Floor applied to widths and scales before dividing by them. */
	public static final double MIN_SIGMA = 1.0e-13;

	static final double LN2 = FastMath.log(2.0);
	static final double SQ2 = FastMath.sqrt(2.0);
	static final double SQ2PI = FastMath.sqrt(2.0 * FastMath.PI);
	public static final double FWHMG2SIG = 1.0 / (2.0 * FastMath.sqrt(2.0 *
		LN2));
	public static final double FWHML2SIG = 0.5;
	public static final double FWHMV2SIG = 1.0 / (2.0 * 0.5346 + 2.0 * FastMath
		.sqrt(0.2166 + 2.0 * LN2));

	private ModelFunctions() {}

	static double guard(final double width) {
		if (Double.isNaN(width)) return width;
		return FastMath.abs(width) < MIN_SIGMA ? MIN_SIGMA : width;
	}

	/** Gaussian with area {@code amplitude}. */
	public static double[] gaussian(final double[] x, final double amplitude,
		final double center, final double fwhmg)
	{
		final double sigma = guard(fwhmg * FWHMG2SIG);
		final double norm = amplitude / (SQ2PI * sigma);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - center) / sigma;
			y[i] = norm * FastMath.exp(-0.5 * u * u);
		}
		return y;
	}

	/** Gaussian with peak height {@code amplitude} and standard deviation {@code width}. */
	public static double[] orcaGaussian(final double[] x, final double amplitude,
		final double center, final double width)
	{
		final double sigma = guard(width);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - center) / sigma;
			y[i] = amplitude * FastMath.exp(-0.5 * u * u);
		}
		return y;
	}

	/** Lorentzian with area {@code amplitude}. */
	public static double[] lorentzian(final double[] x, final double amplitude,
		final double center, final double fwhml)
	{
		final double[] y = new double[x.length];
		addLorentzian(x, amplitude, center, fwhml, y);
		return y;
	}

	static void addLorentzian(final double[] x, final double amplitude,
		final double center, final double fwhml, final double[] out)
	{
		final double sigma = guard(fwhml * FWHML2SIG);
		final double norm = amplitude / (FastMath.PI * sigma);
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - center) / sigma;
			out[i] += norm / (1.0 + u * u);
		}
	}

	/**
	 * Voigt profile with area {@code amplitude}: the real part of the Faddeeva
	 * function of {@code (x - center + i*gamma) / (sigma*sqrt(2))}. A NaN
	 * {@code gamma} means {@code gamma = sigma}.
	 */
	public static double[] voigt(final double[] x, final double amplitude,
		final double center, final double fwhmv, final double gamma)
	{
		final double sigma = guard(fwhmv * FWHMV2SIG);
		final double g = Double.isNaN(gamma) ? sigma : FastMath.abs(gamma);
		final double scale = sigma * SQ2;
		final double norm = amplitude / (sigma * SQ2PI);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = norm * Faddeeva.w((x[i] - center) / scale, g / scale).getReal();
		}
		return y;
	}

	/**
	 * Pseudo-Voigt with Thompson-Cox-Hastings mixing of a Gaussian and a
	 * Lorentzian of the same area and center.
	 */
	public static double[] pseudoVoigt(final double[] x, final double amplitude,
		final double center, final double fwhmg, final double fwhml)
	{
		final double g = fwhmg;
		final double l = fwhml;
		final double f = guard(FastMath.pow(FastMath.pow(g, 5) + 2.69269 * FastMath
			.pow(g, 4) * l + 2.42843 * FastMath.pow(g, 3) * l * l + 4.47163 * g * g *
				FastMath.pow(l, 3) + 0.07842 * g * FastMath.pow(l, 4) + FastMath.pow(l,
					5), 0.2));
		final double r = l / f;
		final double eta = 1.36603 * r - 0.47719 * r * r + 0.11116 * r * r * r;
		final double[] lor = lorentzian(x, amplitude, center, fwhml);
		final double[] gau = gaussian(x, amplitude, center, fwhmg);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = eta * lor[i] + (1.0 - eta) * gau[i];
		}
		return y;
	}

	public static double[] exponential(final double[] x, final double amplitude,
		final double decay, final double intercept)
	{
		final double d = guard(decay);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * FastMath.exp(-x[i] / d) + intercept;
		}
		return y;
	}

	public static double[] power(final double[] x, final double amplitude,
		final double exponent, final double intercept)
	{
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * FastMath.pow(x[i], exponent) + intercept;
		}
		return y;
	}

	/** Polynomial {@code c[0] + c[1]*x + c[2]*x^2 + ...}. */
	public static double[] polynomial(final double[] x, final double... c) {
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			double acc = 0;
			for (int k = c.length - 1; k >= 0; k--) {
				acc = acc * x[i] + c[k];
			}
			y[i] = acc;
		}
		return y;
	}

	public static double[] constant(final double[] x, final double amplitude) {
		final double[] y = new double[x.length];
		Arrays.fill(y, amplitude);
		return y;
	}

	private static double norm(final double x, final double center,
		final double sigma)
	{
		return (x - center) / guard(sigma);
	}

	/** Error-function step from 0 to {@code amplitude}. */
	public static double[] erfStep(final double[] x, final double amplitude,
		final double center, final double sigma)
	{
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * 0.5 * (1.0 + Erf.erf(norm(x[i], center, sigma)));
		}
		return y;
	}

	/** Sharp step; half height exactly at {@code center}. */
	public static double[] heaviside(final double[] x, final double amplitude,
		final double center, final double sigma)
	{
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * 0.5 * (1.0 + FastMath.signum(norm(x[i], center,
				sigma)));
		}
		return y;
	}

	/** Arctangent step from 0 to {@code amplitude}. */
	public static double[] atanStep(final double[] x, final double amplitude,
		final double center, final double sigma)
	{
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * (0.5 + FastMath.atan(norm(x[i], center, sigma)) /
				FastMath.PI);
		}
		return y;
	}

	/** Logistic step {@code amplitude / (1 + exp(-(x - center)/sigma))}. */
	public static double[] logisticStep(final double[] x, final double amplitude,
		final double center, final double sigma)
	{
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude / (1.0 + FastMath.exp(-norm(x[i], center, sigma)));
		}
		return y;
	}

	/** Cumulative Gaussian, rising to {@code amplitude}. */
	public static double[] cumulativeGaussian(final double[] x,
		final double amplitude, final double center, final double fwhmg)
	{
		final double sigma = guard(fwhmg * FWHMG2SIG);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * 0.5 * (1.0 + Erf.erf((x[i] - center) / (sigma *
				SQ2)));
		}
		return y;
	}

	/** Cumulative Lorentzian, rising to {@code amplitude}. */
	public static double[] cumulativeLorentzian(final double[] x,
		final double amplitude, final double center, final double fwhml)
	{
		final double sigma = guard(fwhml * FWHML2SIG);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			y[i] = amplitude * (FastMath.atan((x[i] - center) / sigma) / FastMath.PI +
				0.5);
		}
		return y;
	}

	/** Gaussian error step damped by {@code exp(-((x - center)/gamma)^2)}. */
	public static double[] cumulativeVoigt(final double[] x,
		final double amplitude, final double center, final double fwhmv,
		final double gamma)
	{
		final double sigma = guard(fwhmv * FWHMV2SIG);
		final double g = guard(gamma);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - center) / g;
			y[i] = amplitude * 0.5 * (1.0 + Erf.erf((x[i] - center) / (sigma *
				SQ2))) * FastMath.exp(-u * u);
		}
		return y;
	}

	public static double[] pearson1(final double[] x, final double amplitude,
		final double center, final double sigma, final double exponent)
	{
		final double s = guard(sigma);
		final double norm = amplitude / (s * SQ2PI);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - center) / s;
			y[i] = norm * FastMath.pow(1.0 + u * u, -1.0 / exponent);
		}
		return y;
	}

	public static double[] pearson2(final double[] x, final double amplitude,
		final double center, final double sigma, final double exponent)
	{
		return pearson4(x, amplitude, center, sigma, exponent, 0.0, 0.0);
	}

	public static double[] pearson3(final double[] x, final double amplitude,
		final double center, final double sigma, final double exponent,
		final double skewness)
	{
		return pearson4(x, amplitude, center, sigma, exponent, skewness, 0.0);
	}

	/**
	 * Pearson type IV style profile. With {@code skewness = kurtosis = 0} it
	 * reduces to the type II profile and with {@code kurtosis = 0} to type III.
	 */
	public static double[] pearson4(final double[] x, final double amplitude,
		final double center, final double sigma, final double exponent,
		final double skewness, final double kurtosis)
	{
		final double s = guard(sigma);
		final double m = guard(exponent);
		final double norm = amplitude / (s * SQ2PI);
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - center) / s;
			final double half = (x[i] - center) / (2.0 * s);
			double v = norm * FastMath.pow(1.0 + half * half, -m);
			if (skewness != 0.0) {
				v *= FastMath.pow(1.0 + skewness / m * u, -m - 1.0);
			}
			if (kurtosis != 0.0) {
				v *= FastMath.pow(1.0 + kurtosis / m * u * u, -m - 0.5);
			}
			y[i] = v;
		}
		return y;
	}
}
