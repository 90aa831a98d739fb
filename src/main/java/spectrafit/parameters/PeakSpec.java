/**
 * SpectraFit
 * PeakSpec.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import spectrafit.exception.UnknownAttributeException;
import spectrafit.models.Model;

/**
 * One additive peak: an index, a model and its attribute declarations, in
 * declaration order. Immutable; {@link #with(String, AttributeSpec)} returns a
 * new instance.
 */
public final class PeakSpec {

	private final int index;
	private final Model model;
	private final int dataset;
	private final Map<String, AttributeSpec> attributes;

	private PeakSpec(final int index, final Model model, final int dataset,
		final Map<String, AttributeSpec> attributes)
	{
		this.index = index;
		this.model = model;
		this.dataset = dataset;
		this.attributes = Collections.unmodifiableMap(attributes);
	}

	/**
	 * @param tag model tag, case-insensitive
	 * @throws spectrafit.exception.UnknownModelException for an unknown tag
	 */
	public static PeakSpec of(final int index, final String tag) {
		return of(index, Model.fromTag(tag));
	}

	public static PeakSpec of(final int index, final Model model) {
		return new PeakSpec(index, model, 0, new LinkedHashMap<>());
	}

	/**
	 * @param attribute attribute name, case-insensitive
	 * @throws UnknownAttributeException if the model has no such attribute
	 */
	public PeakSpec with(final String attribute, final AttributeSpec spec) {
		final String key = attribute.trim().toLowerCase(Locale.ROOT);
		if (!model.hasAttribute(key)) {
			throw new UnknownAttributeException(model.tag(), attribute);
		}
		final Map<String, AttributeSpec> copy = new LinkedHashMap<>(attributes);
		copy.put(key, spec);
		return new PeakSpec(index, model, dataset, copy);
	}

	/**
	 * Assigns the peak to one dataset of a global fit whose peaks are declared
	 * per dataset.
	 *
	 * @param newDataset 1-based dataset index
	 */
	public PeakSpec forDataset(final int newDataset) {
		if (newDataset < 1) {
			throw new IllegalArgumentException("Dataset index must be >= 1: " +
				newDataset);
		}
		return new PeakSpec(index, model, newDataset, new LinkedHashMap<>(
			attributes));
	}

	public int getIndex() {
		return index;
	}

	public Model getModel() {
		return model;
	}

	/** @return 1-based dataset index, or 0 when the peak is not dataset specific */
	public int getDataset() {
		return dataset;
	}

	public Map<String, AttributeSpec> getAttributes() {
		return attributes;
	}

	@Override
	public String toString() {
		return model.tag() + "_" + index + (dataset > 0 ? "_" + dataset : "") +
			attributes;
	}
}
