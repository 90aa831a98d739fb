/**
 * SpectraFit
 * StatusMonitor.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import org.scijava.app.StatusService;
import org.scijava.log.LogService;

/**
 * Forwards optimizer progress to the SciJava status bar and the debug log.
 * {@link #abort()} may be called from another thread to stop the run before
 * its next evaluation.
 */
public class StatusMonitor implements FitMonitor {

	private final StatusService statusServ;
	private final LogService log;
	private volatile boolean aborted;

	public StatusMonitor(final StatusService statusServ, final LogService log) {
		this.statusServ = statusServ;
		this.log = log;
	}

	@Override
	public void evaluated(final int nfev, final int maxNfev,
		final double[] values, final double chiSquare)
	{
		if (maxNfev < Integer.MAX_VALUE) statusServ.showProgress(nfev, maxNfev);
		if (log.isDebug()) {
			log.debug(String.format("Evaluation %d: chi-square %.6g", nfev,
				chiSquare));
		}
	}

	@Override
	public boolean isAborted() {
		return aborted;
	}

	public void abort() {
		aborted = true;
	}
}
