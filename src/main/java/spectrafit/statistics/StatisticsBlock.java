/**
 * SpectraFit
 * StatisticsBlock.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.Map;

/**
 * All statistics of one fit, computed once after the optimizer terminated.
 */
public final class StatisticsBlock {

	private final GoodnessOfFit goodness;
	private final Map<String, DataStatistics> dataStatistic;
	private final Map<String, DataStatistics> descriptiveStatistic;
	private final Map<String, Map<String, Double>> parameterCorrelation;
	private final Map<String, Map<String, Double>> componentCorrelation;
	private final RegressionMetrics regression;
	private final ConfidenceResult confidence;

	StatisticsBlock(final GoodnessOfFit goodness,
		final Map<String, DataStatistics> dataStatistic,
		final Map<String, DataStatistics> descriptiveStatistic,
		final Map<String, Map<String, Double>> parameterCorrelation,
		final Map<String, Map<String, Double>> componentCorrelation,
		final RegressionMetrics regression, final ConfidenceResult confidence)
	{
		this.goodness = goodness;
		this.dataStatistic = dataStatistic;
		this.descriptiveStatistic = descriptiveStatistic;
		this.parameterCorrelation = parameterCorrelation;
		this.componentCorrelation = componentCorrelation;
		this.regression = regression;
		this.confidence = confidence;
	}

	public GoodnessOfFit getGoodness() {
		return goodness;
	}

	/** @return statistics of the input columns */
	public Map<String, DataStatistics> getDataStatistic() {
		return dataStatistic;
	}

	/** @return statistics of the result table columns */
	public Map<String, DataStatistics> getDescriptiveStatistic() {
		return descriptiveStatistic;
	}

	public Map<String, Map<String, Double>> getParameterCorrelation() {
		return parameterCorrelation;
	}

	public Map<String, Map<String, Double>> getComponentCorrelation() {
		return componentCorrelation;
	}

	public RegressionMetrics getRegression() {
		return regression;
	}

	/** @return confidence intervals, empty when they were not requested */
	public ConfidenceResult getConfidence() {
		return confidence;
	}
}
