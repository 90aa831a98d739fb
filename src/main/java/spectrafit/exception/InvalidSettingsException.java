/**
 * SpectraFit
 * InvalidSettingsException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when the declarative input mapping does not have the expected shape.
 */
public class InvalidSettingsException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	public InvalidSettingsException(final String message) {
		super(message);
	}

	public InvalidSettingsException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
