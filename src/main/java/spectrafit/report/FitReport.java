/**
 * SpectraFit
 * FitReport.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.report;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Versioned, serializable record of a fit. Optional sections are
 * {@code null} and left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "version", "settings", "data_statistic",
	"descriptive_statistic", "fit_insights", "confidence_interval",
	"confidence_trace", "linear_correlation", "regression_metrics",
	"fit_result", "datasets" })
public class FitReport {

	public static final String VERSION = "1.0";

	@JsonProperty("version")
	private String version;
	@JsonProperty("settings")
	private Map<String, Object> settings;
	@JsonProperty("data_statistic")
	private Map<String, Map<String, Double>> dataStatistic;
	@JsonProperty("descriptive_statistic")
	private Map<String, Map<String, Double>> descriptiveStatistic;
	@JsonProperty("fit_insights")
	private FitInsights fitInsights;
	@JsonProperty("confidence_interval")
	private Map<String, List<Level>> confidenceInterval;
	@JsonProperty("confidence_trace")
	private Map<String, Map<String, double[]>> confidenceTrace;
	@JsonProperty("linear_correlation")
	private Map<String, Map<String, Double>> linearCorrelation;
	@JsonProperty("regression_metrics")
	private Map<String, Double> regressionMetrics;
	@JsonProperty("fit_result")
	private Map<String, double[]> fitResult;
	@JsonProperty("datasets")
	private Map<String, DatasetReport> datasets;

	private FitReport() {}

	FitReport(final Map<String, Object> settings,
		final Map<String, Map<String, Double>> dataStatistic,
		final Map<String, Map<String, Double>> descriptiveStatistic,
		final FitInsights fitInsights,
		final Map<String, List<Level>> confidenceInterval,
		final Map<String, Map<String, double[]>> confidenceTrace,
		final Map<String, Map<String, Double>> linearCorrelation,
		final Map<String, Double> regressionMetrics,
		final Map<String, double[]> fitResult,
		final Map<String, DatasetReport> datasets)
	{
		this.version = VERSION;
		this.settings = settings;
		this.dataStatistic = dataStatistic;
		this.descriptiveStatistic = descriptiveStatistic;
		this.fitInsights = fitInsights;
		this.confidenceInterval = confidenceInterval;
		this.confidenceTrace = confidenceTrace;
		this.linearCorrelation = linearCorrelation;
		this.regressionMetrics = regressionMetrics;
		this.fitResult = fitResult;
		this.datasets = datasets;
	}

	public String getVersion() {
		return version;
	}

	public Map<String, Object> getSettings() {
		return settings;
	}

	public Map<String, Map<String, Double>> getDataStatistic() {
		return dataStatistic;
	}

	public Map<String, Map<String, Double>> getDescriptiveStatistic() {
		return descriptiveStatistic;
	}

	public FitInsights getFitInsights() {
		return fitInsights;
	}

	public Map<String, List<Level>> getConfidenceInterval() {
		return confidenceInterval;
	}

	public Map<String, Map<String, double[]>> getConfidenceTrace() {
		return confidenceTrace;
	}

	public Map<String, Map<String, Double>> getLinearCorrelation() {
		return linearCorrelation;
	}

	public Map<String, Double> getRegressionMetrics() {
		return regressionMetrics;
	}

	public Map<String, double[]> getFitResult() {
		return fitResult;
	}

	public Map<String, DatasetReport> getDatasets() {
		return datasets;
	}

	/** Optimizer configuration, statistics and parameter table. */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "configurations", "statistics", "variables",
		"errorbars", "correlations", "covariance_matrix", "computational" })
	public static class FitInsights {

		@JsonProperty("configurations")
		private Map<String, Object> configurations;
		@JsonProperty("statistics")
		private Map<String, Double> statistics;
		@JsonProperty("variables")
		private Map<String, Variable> variables;
		@JsonProperty("errorbars")
		private Map<String, Object> errorbars;
		@JsonProperty("correlations")
		private Map<String, Map<String, Double>> correlations;
		@JsonProperty("covariance_matrix")
		private Map<String, Map<String, Double>> covarianceMatrix;
		@JsonProperty("computational")
		private Map<String, Object> computational;

		private FitInsights() {}

		FitInsights(final Map<String, Object> configurations,
			final Map<String, Double> statistics,
			final Map<String, Variable> variables,
			final Map<String, Object> errorbars,
			final Map<String, Map<String, Double>> correlations,
			final Map<String, Map<String, Double>> covarianceMatrix,
			final Map<String, Object> computational)
		{
			this.configurations = configurations;
			this.statistics = statistics;
			this.variables = variables;
			this.errorbars = errorbars;
			this.correlations = correlations;
			this.covarianceMatrix = covarianceMatrix;
			this.computational = computational;
		}

		public Map<String, Object> getConfigurations() {
			return configurations;
		}

		public Map<String, Double> getStatistics() {
			return statistics;
		}

		public Map<String, Variable> getVariables() {
			return variables;
		}

		public Map<String, Object> getErrorbars() {
			return errorbars;
		}

		public Map<String, Map<String, Double>> getCorrelations() {
			return correlations;
		}

		/** @return covariance of the varying parameters, or {@code null} */
		public Map<String, Map<String, Double>> getCovarianceMatrix() {
			return covarianceMatrix;
		}

		public Map<String, Object> getComputational() {
			return computational;
		}
	}

	/** One row of the parameter table. */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "init_value", "model_value", "best_value",
		"error_absolute", "error_relative", "vary", "expr" })
	public static class Variable {

		@JsonProperty("init_value")
		private double initValue;
		@JsonProperty("model_value")
		private double modelValue;
		@JsonProperty("best_value")
		private double bestValue;
		@JsonProperty("error_absolute")
		private double errorAbsolute;
		@JsonProperty("error_relative")
		private double errorRelative;
		@JsonProperty("vary")
		private boolean vary;
		@JsonProperty("expr")
		private String expr;

		private Variable() {}

		Variable(final double initValue, final double modelValue,
			final double bestValue, final double errorAbsolute,
			final double errorRelative, final boolean vary, final String expr)
		{
			this.initValue = initValue;
			this.modelValue = modelValue;
			this.bestValue = bestValue;
			this.errorAbsolute = errorAbsolute;
			this.errorRelative = errorRelative;
			this.vary = vary;
			this.expr = expr;
		}

		public double getInitValue() {
			return initValue;
		}

		public double getModelValue() {
			return modelValue;
		}

		public double getBestValue() {
			return bestValue;
		}

		/** @return the standard error */
		public double getErrorAbsolute() {
			return errorAbsolute;
		}

		/** @return the standard error in percent of the best value */
		public double getErrorRelative() {
			return errorRelative;
		}

		public boolean isVary() {
			return vary;
		}

		public String getExpr() {
			return expr;
		}
	}

	/** A confidence limit: probability level and parameter value. */
	@JsonPropertyOrder({ "prob", "value" })
	public static class Level {

		@JsonProperty("prob")
		private double prob;
		@JsonProperty("value")
		private double value;

		private Level() {}

		Level(final double prob, final double value) {
			this.prob = prob;
			this.value = value;
		}

		public double getProb() {
			return prob;
		}

		public double getValue() {
			return value;
		}
	}

	/** Parameter table and statistics of one dataset of a global fit. */
	@JsonPropertyOrder({ "variables", "statistics", "correlations",
		"regression_metrics", "descriptive_statistic" })
	public static class DatasetReport {

		@JsonProperty("variables")
		private Map<String, Variable> variables;
		@JsonProperty("statistics")
		private Map<String, Double> statistics;
		@JsonProperty("correlations")
		private Map<String, Map<String, Double>> correlations;
		@JsonProperty("regression_metrics")
		private Map<String, Double> regressionMetrics;
		@JsonProperty("descriptive_statistic")
		private Map<String, Map<String, Double>> descriptiveStatistic;

		private DatasetReport() {}

		DatasetReport(final Map<String, Variable> variables,
			final Map<String, Double> statistics,
			final Map<String, Map<String, Double>> correlations,
			final Map<String, Double> regressionMetrics,
			final Map<String, Map<String, Double>> descriptiveStatistic)
		{
			this.variables = variables;
			this.statistics = statistics;
			this.correlations = correlations;
			this.regressionMetrics = regressionMetrics;
			this.descriptiveStatistic = descriptiveStatistic;
		}

		public Map<String, Variable> getVariables() {
			return variables;
		}

		public Map<String, Double> getStatistics() {
			return statistics;
		}

		public Map<String, Map<String, Double>> getCorrelations() {
			return correlations;
		}

		public Map<String, Double> getRegressionMetrics() {
			return regressionMetrics;
		}

		public Map<String, Map<String, Double>> getDescriptiveStatistic() {
			return descriptiveStatistic;
		}
	}
}
