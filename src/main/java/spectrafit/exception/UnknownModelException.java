/**
 * SpectraFit
 * UnknownModelException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when a peak names a model tag that is not part of the registry.
 */
public class UnknownModelException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final String tag;

	public UnknownModelException(final String tag) {
		super("Unknown model: '" + tag + "'");
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}
}
