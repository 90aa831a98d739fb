/**
 * SpectraFit
 * PeakDetectionSettings.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.models.Model;

/**
 * Settings of the automatic peak detection. Immutable; disabled by default.
 * Every window is a {@code [min, max]} pair; a window that is not set is
 * estimated from the data.
 */
public final class PeakDetectionSettings {

	/** Line shapes a detected peak can be modelled with. */
	public static final Set<Model> MODELS = EnumSet.of(Model.GAUSSIAN,
		Model.ORCAGAUSSIAN, Model.LORENTZIAN, Model.VOIGT, Model.PSEUDOVOIGT);

	private static final PeakDetectionSettings DISABLED =
		new PeakDetectionSettings(false, Model.GAUSSIAN, null, null, null, null,
			null, 0.5);

	private final boolean enabled;
	private final Model model;
	private final double[] height;
	private final double[] threshold;
	private final Double distance;
	private final double[] prominence;
	private final double[] width;
	private final double relHeight;

	private PeakDetectionSettings(final boolean enabled, final Model model,
		final double[] height, final double[] threshold, final Double distance,
		final double[] prominence, final double[] width, final double relHeight)
	{
		this.enabled = enabled;
		this.model = model;
		this.height = height;
		this.threshold = threshold;
		this.distance = distance;
		this.prominence = prominence;
		this.width = width;
		this.relHeight = relHeight;
	}

	public static PeakDetectionSettings disabled() {
		return DISABLED;
	}

	/** @return detection with every window estimated from the data */
	public static PeakDetectionSettings create() {
		return new PeakDetectionSettings(true, Model.GAUSSIAN, null, null, null,
			null, null, 0.5);
	}

	/** @throws InvalidSettingsException if the model has no width to detect */
	public PeakDetectionSettings withModel(final Model newModel) {
		if (!MODELS.contains(newModel)) {
			throw new InvalidSettingsException(newModel.tag() +
				" is not supported for peak detection; use one of " + MODELS);
		}
		return new PeakDetectionSettings(enabled, newModel, height, threshold,
			distance, prominence, width, relHeight);
	}

	/** Window of the peak height. */
	public PeakDetectionSettings withHeight(final double min, final double max) {
		return new PeakDetectionSettings(enabled, model, window("height", min,
			max), threshold, distance, prominence, width, relHeight);
	}

	/** Window of the vertical drop from a peak to its direct neighbours. */
	public PeakDetectionSettings withThreshold(final double min,
		final double max)
	{
		return new PeakDetectionSettings(enabled, model, height, window(
			"threshold", min, max), distance, prominence, width, relHeight);
	}

	/** Smallest distance between two peaks, in samples. */
	public PeakDetectionSettings withDistance(final double newDistance) {
		if (!(newDistance >= 1)) {
			throw new InvalidSettingsException("distance must be >= 1: " +
				newDistance);
		}
		return new PeakDetectionSettings(enabled, model, height, threshold,
			newDistance, prominence, width, relHeight);
	}

	public PeakDetectionSettings withProminence(final double min,
		final double max)
	{
		return new PeakDetectionSettings(enabled, model, height, threshold,
			distance, window("prominence", min, max), width, relHeight);
	}

	/** Window of the peak width, in units of the energy axis. */
	public PeakDetectionSettings withWidth(final double min, final double max) {
		return new PeakDetectionSettings(enabled, model, height, threshold,
			distance, prominence, window("width", min, max), relHeight);
	}

	/**
	 * @param newRelHeight fraction of the prominence below the top at which the
	 *          width is measured, in [0, 1]
	 */
	public PeakDetectionSettings withRelHeight(final double newRelHeight) {
		if (!(newRelHeight >= 0 && newRelHeight <= 1)) {
			throw new InvalidSettingsException("rel_height must be in [0, 1]: " +
				newRelHeight);
		}
		return new PeakDetectionSettings(enabled, model, height, threshold,
			distance, prominence, width, newRelHeight);
	}

	private static double[] window(final String what, final double min,
		final double max)
	{
		if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
			throw new InvalidSettingsException("Invalid " + what + " window [" +
				min + ", " + max + "]");
		}
		return new double[] { min, max };
	}

	public boolean isEnabled() {
		return enabled;
	}

	public Model getModel() {
		return model;
	}

	/** @return the height window, or {@code null} to estimate it */
	public double[] getHeight() {
		return height == null ? null : height.clone();
	}

	public double[] getThreshold() {
		return threshold == null ? null : threshold.clone();
	}

	/** @return the smallest peak distance, or {@code null} to estimate it */
	public Double getDistance() {
		return distance;
	}

	public double[] getProminence() {
		return prominence == null ? null : prominence.clone();
	}

	public double[] getWidth() {
		return width == null ? null : width.clone();
	}

	public double getRelHeight() {
		return relHeight;
	}

	@Override
	public String toString() {
		if (!enabled) return "autopeak=off";
		return "autopeak[model=" + model.tag() + ", height=" + Arrays.toString(
			height) + ", threshold=" + Arrays.toString(threshold) + ", distance=" +
			distance + ", prominence=" + Arrays.toString(prominence) + ", width=" +
			Arrays.toString(width) + ", rel_height=" + relHeight + "]";
	}
}
