/**
 * SpectraFit
 * NonFiniteDataException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown under the {@code raise} NaN policy when data or residuals contain
 * NaN or infinite values.
 */
public class NonFiniteDataException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final int index;

	public NonFiniteDataException(final String message, final int index) {
		super(message + " (index " + index + ")");
		this.index = index;
	}

	/** @return position of the first non-finite sample */
	public int getIndex() {
		return index;
	}
}
