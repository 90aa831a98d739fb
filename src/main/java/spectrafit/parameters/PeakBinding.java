/**
 * SpectraFit
 * PeakBinding.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import spectrafit.models.Model;

/**
 * A peak resolved against a parameter graph: its model and, for every
 * attribute of the model's signature, the slot of the parameter feeding it
 * (or -1 when the attribute keeps its model default).
 */
public final class PeakBinding {

	private final int peak;
	private final int dataset;
	private final Model model;
	private final int[] slots;
	private final double[] defaults;

	PeakBinding(final int peak, final int dataset, final Model model,
		final int[] slots, final double[] defaults)
	{
		this.peak = peak;
		this.dataset = dataset;
		this.model = model;
		this.slots = slots;
		this.defaults = defaults;
	}

	/**
	 * @param resolved values of every parameter of the graph, by slot
	 * @return attribute values in the model's signature order
	 */
	public double[] attributeValues(final double[] resolved) {
		final double[] p = defaults.clone();
		for (int i = 0; i < slots.length; i++) {
			if (slots[i] >= 0) p[i] = resolved[slots[i]];
		}
		return p;
	}

	public double[] evaluate(final double[] x, final double[] resolved) {
		return model.evaluate(x, attributeValues(resolved));
	}

	/** @return {@code {model}_{peak}}, with a dataset suffix in global fits */
	public String componentName() {
		final String local = model.tag() + "_" + peak;
		return dataset > 0 ? local + "_" + dataset : local;
	}

	public int getPeak() {
		return peak;
	}

	public int getDataset() {
		return dataset;
	}

	public Model getModel() {
		return model;
	}
}
