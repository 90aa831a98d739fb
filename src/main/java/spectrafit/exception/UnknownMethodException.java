/**
 * SpectraFit
 * UnknownMethodException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when the solver settings name a minimization method that is not
 * registered.
 */
public class UnknownMethodException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final String method;

	public UnknownMethodException(final String method) {
		super("Unknown minimization method: '" + method + "'");
		this.method = method;
	}

	public String getMethod() {
		return method;
	}
}
