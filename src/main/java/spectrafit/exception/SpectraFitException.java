/**
 * SpectraFit
 * SpectraFitException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Base class of every error raised by the fitting engine. Validation errors
 * are raised before any numerical work starts; numerical degeneracies are
 * reported as sentinel values on the result instead.
 */
public class SpectraFitException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public SpectraFitException(final String message) {
		super(message);
	}

	public SpectraFitException(final String message, final Throwable cause) {
		super(message, cause);
	}

	public SpectraFitException(final Throwable cause) {
		super(cause);
	}
}
