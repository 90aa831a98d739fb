/**
 * SpectraFit
 * ParameterName.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.Locale;
import java.util.Objects;

import spectrafit.models.Model;

/**
 * Flattened parameter name {@code {model}_{attribute}_{peak}}, with a
 * {@code _{dataset}} suffix in global fits. Doubles as the reverse index
 * entry from a name back to its peak, model and attribute.
 */
public final class ParameterName {

	private final Model model;
	private final String attribute;
	private final int peak;
	private final int dataset;
	private final String name;

	public ParameterName(final Model model, final String attribute,
		final int peak, final int dataset)
	{
		this.model = model;
		this.attribute = attribute.toLowerCase(Locale.ROOT);
		this.peak = peak;
		this.dataset = dataset;
		this.name = format(model, this.attribute, peak, dataset);
	}

	static String format(final Model model, final String attribute,
		final int peak, final int dataset)
	{
		final String local = model.tag() + "_" + attribute + "_" + peak;
		return dataset > 0 ? local + "_" + dataset : local;
	}

	/** @return the name of the same attribute in another dataset */
	public ParameterName inDataset(final int otherDataset) {
		return new ParameterName(model, attribute, peak, otherDataset);
	}

	public Model getModel() {
		return model;
	}

	public String getAttribute() {
		return attribute;
	}

	public int getPeak() {
		return peak;
	}

	/** @return 1-based dataset index, 0 in a local fit */
	public int getDataset() {
		return dataset;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof ParameterName)) return false;
		return name.equals(((ParameterName) o).name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public String toString() {
		return name;
	}
}
