/**
 * SpectraFit
 * FitResult.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.RealMatrix;

import spectrafit.solver.Minimizer;
import spectrafit.solver.TerminationReason;
import spectrafit.statistics.FitTable;
import spectrafit.statistics.StatisticsBlock;

/**
 * Outcome of one optimizer run: parameter table, result columns, optimizer
 * outcome, covariance and statistics. A global fit additionally carries one
 * result per dataset, cut from the aggregate at the dataset boundaries.
 */
public final class FitResult {

	private final int dataset;
	private final Minimizer method;
	private final List<ParameterEstimate> parameters;
	private final FitTable table;
	private final int nfev;
	private final int maxNfev;
	private final TerminationReason reason;
	private final boolean success;
	private final String message;
	private final List<String> freeNames;
	private final RealMatrix covariance;
	private final StatisticsBlock statistics;
	private final List<FitResult> datasets;

	FitResult(final int dataset, final Minimizer method,
		final List<ParameterEstimate> parameters, final FitTable table,
		final int nfev, final int maxNfev, final TerminationReason reason,
		final boolean success, final String message,
		final List<String> freeNames, final RealMatrix covariance,
		final StatisticsBlock statistics,
		final List<FitResult> datasets)
	{
		this.dataset = dataset;
		this.method = method;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(
			parameters));
		this.table = table;
		this.nfev = nfev;
		this.maxNfev = maxNfev;
		this.reason = reason;
		this.success = success;
		this.message = message;
		this.freeNames = Collections.unmodifiableList(new ArrayList<>(freeNames));
		this.covariance = covariance;
		this.statistics = statistics;
		this.datasets = Collections.unmodifiableList(new ArrayList<>(datasets));
	}

	/** @return 1-based dataset of a per-dataset result, 0 otherwise */
	public int getDataset() {
		return dataset;
	}

	public boolean isGlobal() {
		return !datasets.isEmpty();
	}

	public Minimizer getMethod() {
		return method;
	}

	public List<ParameterEstimate> getParameters() {
		return parameters;
	}

	/** @throws IllegalArgumentException if there is no such parameter */
	public ParameterEstimate getParameter(final String name) {
		for (final ParameterEstimate p : parameters) {
			if (p.getName().equals(name)) return p;
		}
		throw new IllegalArgumentException("Unknown parameter: " + name);
	}

	/** @return best value of every parameter, in table order */
	public Map<String, Double> getBestValues() {
		final Map<String, Double> m = new LinkedHashMap<>();
		for (final ParameterEstimate p : parameters) {
			m.put(p.getName(), p.getBestValue());
		}
		return m;
	}

	public FitTable getTable() {
		return table;
	}

	public int getNfev() {
		return nfev;
	}

	public int getMaxNfev() {
		return maxNfev;
	}

	public TerminationReason getReason() {
		return reason;
	}

	public boolean isSuccess() {
		return success;
	}

	public String getMessage() {
		return message;
	}

	/** @return names of the varying parameters, in covariance order */
	public List<String> getFreeNames() {
		return freeNames;
	}

	/** @return the covariance of the varying parameters, or {@code null} */
	public RealMatrix getCovariance() {
		return covariance == null ? null : covariance.copy();
	}

	/** @return whether standard errors could be estimated */
	public boolean hasErrorbars() {
		return covariance != null;
	}

	public StatisticsBlock getStatistics() {
		return statistics;
	}

	/** @return per-dataset results of a global fit, empty for a local fit */
	public List<FitResult> getDatasets() {
		return datasets;
	}
}
