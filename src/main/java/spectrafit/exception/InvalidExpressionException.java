/**
 * SpectraFit
 * InvalidExpressionException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

/**
 * Thrown when a parameter expression is not plain arithmetic over known
 * parameter names.
 */
public class InvalidExpressionException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final String expression;

	public InvalidExpressionException(final String expression,
		final String reason)
	{
		super("Invalid expression '" + expression + "': " + reason);
		this.expression = expression;
	}

	public String getExpression() {
		return expression;
	}
}
