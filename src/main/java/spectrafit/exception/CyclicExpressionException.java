/**
 * SpectraFit
 * CyclicExpressionException.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when derived parameters reference each other in a cycle.
 */
public class CyclicExpressionException extends SpectraFitException {

	private static final long serialVersionUID = 1L;

	private final List<String> cycle;

	public CyclicExpressionException(final List<String> cycle) {
		super("Cyclic parameter expressions: " + String.join(" -> ", cycle));
		this.cycle = Collections.unmodifiableList(new ArrayList<>(cycle));
	}

	/** @return the parameter names along the cycle, first name repeated last */
	public List<String> getCycle() {
		return cycle;
	}
}
