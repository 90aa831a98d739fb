/**
 * SpectraFit
 * UnknownAttributeException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when a peak declares an attribute its model does not have.
 */
public class UnknownAttributeException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final String model;
	private final String attribute;

	public UnknownAttributeException(final String model, final String attribute) {
		super("Model '" + model + "' has no attribute '" + attribute + "'");
		this.model = model;
		this.attribute = attribute;
	}

	public String getModel() {
		return model;
	}

	public String getAttribute() {
		return attribute;
	}
}
