/**
 * SpectraFit
 * Moessbauer.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.models;

import java.util.Arrays;

import org.apache.commons.math3.util.FastMath;

/**
 * 57Fe Moessbauer multiplets built from Lorentzian lines on a constant
 * background. Velocities are in mm/s, fields in tesla, electric field
 * gradients in V/m^2 and temperatures in kelvin.
 */
public final class Moessbauer {

	/** Nuclear magneton, eV/T. */
	public static final double NUCLEAR_MAGNETON = 3.152451258e-8;
	/** g-factor of the I=1/2 ground state. */
	public static final double G_GROUND = 0.18088;
	/** g-factor of the I=3/2 excited state. */
	public static final double G_EXCITED = -0.10327;
	/** Energy of the Moessbauer transition, eV. */
	public static final double GAMMA_ENERGY = 14412.5;
	/** Speed of light, mm/s. */
	public static final double SPEED_OF_LIGHT = 2.99792458e11;
	/** Approximate second-order Doppler coefficient, mm/s per K. */
	public static final double SOD_PER_KELVIN = -1.2e-4;
	public static final double EFG_THRESHOLD = 1e20;
	public static final double FIELD_THRESHOLD = 1.0;

	// (m_ground, m_excited) of the six allowed transitions, ordered by velocity
	private static final double[][] TRANSITIONS = { { -0.5, -1.5 }, { -0.5,
		-0.5 }, { -0.5, 0.5 }, { 0.5, -0.5 }, { 0.5, 0.5 }, { 0.5, 1.5 } };

	private Moessbauer() {}

	public static double[] singlet(final double[] x, final double amplitude,
		final double isomerShift, final double fwhml, final double center,
		final double background)
	{
		final double[] y = background(x, background);
		ModelFunctions.addLorentzian(x, amplitude, center + isomerShift, fwhml, y);
		return y;
	}

	/** Two lines of equal area at {@code center + isomerShift -+ splitting/2}. */
	public static double[] doublet(final double[] x, final double amplitude,
		final double isomerShift, final double quadrupoleSplitting,
		final double fwhml, final double center, final double background)
	{
		final double[] y = background(x, background);
		final double mid = center + isomerShift;
		ModelFunctions.addLorentzian(x, 0.5 * amplitude, mid - 0.5 *
			quadrupoleSplitting, fwhml, y);
		ModelFunctions.addLorentzian(x, 0.5 * amplitude, mid + 0.5 *
			quadrupoleSplitting, fwhml, y);
		return y;
	}

	/**
	 * Magnetic sextet. A NaN {@code theta} selects the powder intensities
	 * 3:2:1:1:2:3; otherwise {@code theta} is the angle in radians between the
	 * field and the gamma-ray direction.
	 */
	public static double[] sextet(final double[] x, final double amplitude,
		final double isomerShift, final double fwhml, final double magneticField,
		final double quadrupoleShift, final double center, final double background,
		final double theta)
	{
		final double[] y = background(x, background);
		final double[] pos = sextetPositions(center + isomerShift, magneticField,
			quadrupoleShift);
		final double[] w = sextetIntensities(theta);
		for (int i = 0; i < pos.length; i++) {
			ModelFunctions.addLorentzian(x, amplitude * w[i], pos[i], fwhml, y);
		}
		return y;
	}

	/**
	 * Sextet with second-order Doppler shift and site fraction. When both the
	 * electric field gradient and the field are significant, lines 1 and 6 are
	 * split into two halves each, giving eight lines of unchanged total area.
	 */
	public static double[] octet(final double[] x, final double amplitude,
		final double isomerShift, final double fwhml, final double magneticField,
		final double quadrupoleShift, final double center, final double background,
		final double theta, final double efgVzz, final double efgEta,
		final double phi, final double temperature, final double sodShift,
		final double siteFraction)
	{
		double sod = sodShift;
		if (sod == 0.0 && temperature > 0) {
			sod = SOD_PER_KELVIN * temperature;
		}
		final double area = amplitude * siteFraction;
		final double[] pos = sextetPositions(center + isomerShift + sod,
			magneticField, quadrupoleShift);
		final double[] w = sextetIntensities(theta);
		final double[] y = background(x, background);

		if (FastMath.abs(efgVzz) > EFG_THRESHOLD && FastMath.abs(
			magneticField) > FIELD_THRESHOLD)
		{
			final double split = octetSplitting(efgVzz, efgEta, theta, phi);
			for (int i = 0; i < pos.length; i++) {
				if (i == 0 || i == pos.length - 1) {
					ModelFunctions.addLorentzian(x, 0.5 * area * w[i], pos[i] - split,
						fwhml, y);
					ModelFunctions.addLorentzian(x, 0.5 * area * w[i], pos[i] + split,
						fwhml, y);
				}
				else {
					ModelFunctions.addLorentzian(x, area * w[i], pos[i], fwhml, y);
				}
			}
			return y;
		}
		for (int i = 0; i < pos.length; i++) {
			ModelFunctions.addLorentzian(x, area * w[i], pos[i], fwhml, y);
		}
		return y;
	}

	/**
	 * Line positions of the six Zeeman transitions, in ascending velocity for a
	 * positive field. The first-order quadrupole shift moves the outer lines by
	 * {@code +quadrupoleShift} and the four inner lines by its negative.
	 */
	public static double[] sextetPositions(final double shift,
		final double magneticField, final double quadrupoleShift)
	{
		final double toVelocity = NUCLEAR_MAGNETON * magneticField /
			GAMMA_ENERGY * SPEED_OF_LIGHT;
		final double[] pos = new double[TRANSITIONS.length];
		for (int i = 0; i < TRANSITIONS.length; i++) {
			final double mg = TRANSITIONS[i][0];
			final double me = TRANSITIONS[i][1];
			final double q = FastMath.abs(me) > 1 ? quadrupoleShift
				: -quadrupoleShift;
			pos[i] = shift - (G_EXCITED * me - G_GROUND * mg) * toVelocity + q;
		}
		return pos;
	}

	/** Relative line intensities, normalized to a sum of one. */
	public static double[] sextetIntensities(final double theta) {
		final double[] w;
		if (Double.isNaN(theta)) {
			w = new double[] { 3, 2, 1, 1, 2, 3 };
		}
		else {
			final double c2 = FastMath.cos(theta) * FastMath.cos(theta);
			final double outer = 3 * (1 + c2);
			final double middle = 4 * (1 - c2);
			final double inner = 1 + c2;
			w = new double[] { outer, middle, inner, inner, middle, outer };
		}
		final double sum = Arrays.stream(w).sum();
		for (int i = 0; i < w.length; i++) {
			w[i] /= sum;
		}
		return w;
	}

	static double octetSplitting(final double efgVzz, final double efgEta,
		final double theta, final double phi)
	{
		final double orientation = Double.isNaN(theta) ? 0.0 : FastMath.abs(
			FastMath.sin(theta) * FastMath.cos(phi));
		return 0.1 * FastMath.abs(efgVzz) * efgEta / 1e21 * (1 + orientation);
	}

	private static double[] background(final double[] x, final double level) {
		final double[] y = new double[x.length];
		Arrays.fill(y, level);
		return y;
	}
}
