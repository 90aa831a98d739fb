/**
 * SpectraFit
 * PeakDetector.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.FastMath;

import spectrafit.models.Model;

/**
 * Finds the peaks of a spectrum and turns them into starting peaks. A peak is
 * a local maximum (the center of a flat top) that passes the height,
 * threshold, distance, prominence and width windows of the settings; windows
 * that are not set are estimated from the data.
 */
public final class PeakDetector {

	private final PeakDetectionSettings settings;

	public PeakDetector(final PeakDetectionSettings settings) {
		this.settings = settings;
	}

	/** A detected peak; the width is measured along the energy axis. */
	public static final class Peak {

		private final int position;
		private final double center;
		private final double height;
		private final double prominence;
		private final double width;

		Peak(final int position, final double center, final double height,
			final double prominence, final double width)
		{
			this.position = position;
			this.center = center;
			this.height = height;
			this.prominence = prominence;
			this.width = width;
		}

		public int getPosition() {
			return position;
		}

		public double getCenter() {
			return center;
		}

		public double getHeight() {
			return height;
		}

		public double getProminence() {
			return prominence;
		}

		public double getWidth() {
			return width;
		}
	}

	/**
	 * @param x energy axis, finite and increasing
	 * @param y intensity, finite
	 * @return detected peaks in order of position
	 */
	public List<Peak> detect(final double[] x, final double[] y) {
		if (x.length != y.length) throw new DimensionMismatchException(y.length,
			x.length);
		if (y.length < 3) return Collections.emptyList();

		final double[] height = window(settings.getHeight(), estimateHeight(y));
		final double[] threshold = window(settings.getThreshold(), new double[] {
			StatUtils.min(y), StatUtils.max(y) });
		final double distance = settings.getDistance() != null ? settings
			.getDistance() : FastMath.max(minStep(x), 1.0);
		final double[] prominence = window(settings.getProminence(),
			estimateProminence(y));
		final double[] width = window(settings.getWidth(), estimateWidth(x, y));

		final List<Integer> candidates = new ArrayList<>();
		for (final int p : localMaxima(y)) {
			if (y[p] < height[0] || y[p] > height[1]) continue;
			final double left = y[p] - y[plateauStart(y, p) - 1];
			final double right = y[p] - y[plateauEnd(y, p) + 1];
			if (FastMath.min(left, right) < threshold[0] || FastMath.max(left,
				right) > threshold[1]) continue;
			candidates.add(p);
		}

		final List<Peak> peaks = new ArrayList<>();
		for (final int p : byDistance(candidates, y, distance)) {
			final int[] bases = bases(y, p);
			final double prom = y[p] - FastMath.max(y[bases[0]], y[bases[1]]);
			if (prom < prominence[0] || prom > prominence[1]) continue;
			final double w = width(x, y, p, bases, prom);
			if (!(w > 0) || w < width[0] || w > width[1]) continue;
			peaks.add(new Peak(p, x[p], y[p], prom, w));
		}
		return peaks;
	}

	/**
	 * Detects the peaks and declares one starting peak for each, numbered from
	 * 1. Amplitudes may move by 125 % of the detected height, centers between
	 * half and twice their position, widths up to twice the detected width.
	 */
	public List<PeakSpec> peaks(final double[] x, final double[] y) {
		final Model model = settings.getModel();
		final List<PeakSpec> out = new ArrayList<>();
		int index = 1;
		for (final Peak peak : detect(x, y)) {
			final double h = peak.getHeight();
			final double c = peak.getCenter();
			final double w = peak.getWidth();
			final AttributeSpec center = c != 0 ? AttributeSpec.of(c, FastMath.min(
				0.5 * c, 2 * c), FastMath.max(0.5 * c, 2 * c)) : AttributeSpec.of(c,
					-w, w);
			PeakSpec spec = PeakSpec.of(index++, model) //
				.with("amplitude", AttributeSpec.of(h, -FastMath.abs(1.25 * h),
					FastMath.abs(1.25 * h))) //
				.with("center", center);
			switch (model) {
				case ORCAGAUSSIAN:
					spec = spec.with("width", AttributeSpec.of(w, 0, 2 * w));
					break;
				case LORENTZIAN:
					spec = spec.with("fwhml", AttributeSpec.of(w, 0, 2 * w));
					break;
				case VOIGT:
					spec = spec.with("fwhmv", AttributeSpec.of(w, 0, 2 * w));
					break;
				case PSEUDOVOIGT:
					spec = spec.with("fwhmg", AttributeSpec.of(0.5 * w, 0, w)).with(
						"fwhml", AttributeSpec.of(0.5 * w, 0, 2 * w));
					break;
				default:
					spec = spec.with("fwhmg", AttributeSpec.of(w, 0, 2 * w));
					break;
			}
			out.add(spec);
		}
		return out;
	}

	private static double[] window(final double[] given, final double[] estimate) {
		return given != null ? given : estimate;
	}

	/** Inverse signal-to-noise ratio up to the maximum. */
	private static double[] estimateHeight(final double[] y) {
		final DescriptiveStatistics stats = new DescriptiveStatistics(y);
		final double sd = FastMath.sqrt(stats.getPopulationVariance());
		final double low = sd > 0 ? 1 - stats.getMean() / sd
			: Double.NEGATIVE_INFINITY;
		return new double[] { low, stats.getMax() };
	}

	/** Harmonic mean (mean if any value is not positive) up to the maximum. */
	private static double[] estimateProminence(final double[] y) {
		double inverse = 0;
		boolean positive = true;
		for (final double v : y) {
			if (!(v > 0)) {
				positive = false;
				break;
			}
			inverse += 1 / v;
		}
		final double low = positive ? y.length / inverse : StatUtils.mean(y);
		return new double[] { low, StatUtils.max(y) };
	}

	/** Smallest step up to half the distance between the extremes. */
	private static double[] estimateWidth(final double[] x, final double[] y) {
		int argMax = 0;
		int argMin = 0;
		for (int i = 1; i < y.length; i++) {
			if (y[i] > y[argMax]) argMax = i;
			if (y[i] < y[argMin]) argMin = i;
		}
		return new double[] { minStep(x), FastMath.abs(x[argMax] - x[argMin]) /
			2 };
	}

	private static double minStep(final double[] x) {
		double step = Double.POSITIVE_INFINITY;
		for (int i = 1; i < x.length; i++) {
			step = FastMath.min(step, x[i] - x[i - 1]);
		}
		return step;
	}

	/** Strict local maxima; flat tops are marked at their centers. */
	static int[] localMaxima(final double[] y) {
		final int[] found = new int[y.length];
		int count = 0;
		int i = 1;
		while (i < y.length - 1) {
			if (y[i - 1] < y[i]) {
				int end = i;
				while (end + 1 < y.length - 1 && y[end + 1] == y[i]) {
					end++;
				}
				if (y[end + 1] < y[end]) {
					found[count++] = (i + end) / 2;
					i = end;
				}
			}
			i++;
		}
		return Arrays.copyOf(found, count);
	}

	private static int plateauStart(final double[] y, final int p) {
		int s = p;
		while (s > 1 && y[s - 1] == y[p]) {
			s--;
		}
		return s;
	}

	private static int plateauEnd(final double[] y, final int p) {
		int e = p;
		while (e < y.length - 2 && y[e + 1] == y[p]) {
			e++;
		}
		return e;
	}

	/** Keeps the highest peaks first, dropping any closer than the distance. */
	private static List<Integer> byDistance(final List<Integer> candidates,
		final double[] y, final double distance)
	{
		final List<Integer> order = new ArrayList<>(candidates);
		order.sort(Comparator.comparingDouble((Integer p) -> y[p]).reversed());
		final List<Integer> kept = new ArrayList<>();
		for (final int p : order) {
			boolean free = true;
			for (final int k : kept) {
				if (FastMath.abs(p - k) < distance) {
					free = false;
					break;
				}
			}
			if (free) kept.add(p);
		}
		Collections.sort(kept);
		return kept;
	}

	/**
	 * Lowest points between the peak and the nearest higher sample on each side
	 * (or the ends of the signal).
	 */
	private static int[] bases(final double[] y, final int p) {
		int left = p;
		for (int i = p - 1; i >= 0 && y[i] <= y[p]; i--) {
			if (y[i] < y[left]) left = i;
		}
		int right = p;
		for (int i = p + 1; i < y.length && y[i] <= y[p]; i++) {
			if (y[i] < y[right]) right = i;
		}
		return new int[] { left, right };
	}

	/** Width at {@code relHeight} of the prominence below the top. */
	private double width(final double[] x, final double[] y, final int p,
		final int[] bases, final double prominence)
	{
		final double level = y[p] - prominence * settings.getRelHeight();
		int i = p;
		while (i > bases[0] && y[i] > level) {
			i--;
		}
		double left = x[i];
		if (y[i] < level) {
			left += (level - y[i]) / (y[i + 1] - y[i]) * (x[i + 1] - x[i]);
		}
		int j = p;
		while (j < bases[1] && y[j] > level) {
			j++;
		}
		double right = x[j];
		if (y[j] < level) {
			right -= (level - y[j]) / (y[j - 1] - y[j]) * (x[j] - x[j - 1]);
		}
		return right - left;
	}
}
