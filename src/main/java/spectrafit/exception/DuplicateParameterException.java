/**
 * SpectraFit
 * DuplicateParameterException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when two peaks flatten to the same parameter name.
 */
public class DuplicateParameterException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final String parameterName;

	public DuplicateParameterException(final String parameterName) {
		super("Duplicate parameter: " + parameterName);
		this.parameterName = parameterName;
	}

	public String getParameterName() {
		return parameterName;
	}
}
