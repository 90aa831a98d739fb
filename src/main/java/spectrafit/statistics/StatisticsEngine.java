/**
 * SpectraFit
 * StatisticsEngine.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.scijava.log.LogService;

/**
 * Computes the {@link StatisticsBlock} of a fit from its table and covariance.
 */
public class StatisticsEngine {

	private final LogService log;

	public StatisticsEngine(final LogService log) {
		this.log = log;
	}

	/**
	 * @param nvarys number of varying parameters
	 * @param names parameter names of the correlation table
	 * @param freeNames varying parameter names, in covariance order
	 * @param covariance covariance of the varying parameters, or {@code null}
	 * @param confidence confidence intervals, or {@code null} if not computed
	 */
	public StatisticsBlock compute(final FitTable table, final int nvarys,
		final List<String> names, final List<String> freeNames,
		final RealMatrix covariance, final ConfidenceResult confidence)
	{
		final GoodnessOfFit gof = GoodnessOfFit.of(table.getResidual(), table
			.getObserved(), nvarys);
		if (gof.getDegreesOfFreedom() <= 0) {
			log.warn("No degrees of freedom left: " + gof.getNdata() +
				" data points, " + nvarys + " varying parameters.");
		}
		return new StatisticsBlock(gof, DataStatistics.of(table.getInput()),
			DataStatistics.of(table.getResult()), CorrelationMatrix.parameters(names,
				freeNames, covariance), CorrelationMatrix.components(table
					.getResult()), RegressionMetrics.of(table.getObserved(), table
						.getFit()), confidence == null ? ConfidenceResult.empty()
							: confidence);
	}
}
