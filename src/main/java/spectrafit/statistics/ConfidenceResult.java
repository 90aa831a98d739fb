/**
 * SpectraFit
 * ConfidenceResult.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Confidence intervals of the varying parameters and, when requested, the
 * trace of the search. The trace is columnar: for every stepped parameter,
 * one array per varying parameter plus {@code prob}, all of equal length.
 */
public final class ConfidenceResult {

	private static final ConfidenceResult EMPTY = new ConfidenceResult(
		Collections.<ConfidenceInterval> emptyList(), Collections
			.<String, Map<String, double[]>> emptyMap());

	private final List<ConfidenceInterval> intervals;
	private final Map<String, Map<String, double[]>> trace;

	ConfidenceResult(final List<ConfidenceInterval> intervals,
		final Map<String, Map<String, double[]>> trace)
	{
		this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
		this.trace = Collections.unmodifiableMap(new LinkedHashMap<>(trace));
	}

	public static ConfidenceResult empty() {
		return EMPTY;
	}

	public List<ConfidenceInterval> getIntervals() {
		return intervals;
	}

	/** @return interval of {@code parameter}, or {@code null} */
	public ConfidenceInterval interval(final String parameter) {
		for (final ConfidenceInterval ci : intervals) {
			if (ci.getParameter().equals(parameter)) return ci;
		}
		return null;
	}

	public Map<String, Map<String, double[]>> getTrace() {
		return trace;
	}

	public boolean isEmpty() {
		return intervals.isEmpty();
	}
}
