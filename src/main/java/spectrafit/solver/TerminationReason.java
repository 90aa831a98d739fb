/**
 * SpectraFit
 * TerminationReason.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

/** Why an optimizer run stopped. Non-convergence is never an exception. */
public enum TerminationReason {
	CONVERGED, MAX_EVALS_REACHED, USER_ABORT
}
