/**
 * SpectraFit
 * InvalidBoundsException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when a varying parameter violates {@code min <= value <= max}.
 */
public class InvalidBoundsException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final String parameterName;

	public InvalidBoundsException(final String parameterName, final double value,
		final double min, final double max)
	{
		super(String.format("Invalid bounds for %s: value=%s, min=%s, max=%s",
			parameterName, value, min, max));
		this.parameterName = parameterName;
	}

	public String getParameterName() {
		return parameterName;
	}
}
