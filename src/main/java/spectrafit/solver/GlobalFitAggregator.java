/**
 * SpectraFit
 * GlobalFitAggregator.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.parameters.ParameterGraph;
import spectrafit.parameters.ParameterGraphBuilder;
import spectrafit.parameters.PeakSpec;

/**
 * Decides once, from the shape of the data, whether a fit is local or global
 * and wires the matching parameter graph and objective.
 */
public final class GlobalFitAggregator {

	/** Global setting: a single dataset. */
	public static final int LOCAL_FIT = 0;
	/** Global setting: peaks replicated per dataset, shared attributes linked. */
	public static final int AUTO_SHARED = 1;
	/** Global setting: peaks declared per dataset. */
	public static final int PREDEFINED = 2;

	public enum Mode {
		LOCAL, GLOBAL
	}

	private GlobalFitAggregator() {}

	/**
	 * @param global one of {@link #LOCAL_FIT}, {@link #AUTO_SHARED} or
	 *          {@link #PREDEFINED}; multi-column data is fitted globally even
	 *          when {@link #LOCAL_FIT} is requested
	 * @throws InvalidSettingsException for an unknown global setting or when
	 *           predefined peaks do not match the number of columns
	 */
	public static FitPlan plan(final List<PeakSpec> peaks,
		final Dataset dataset, final int global, final NanPolicy policy)
	{
		if (global < LOCAL_FIT || global > PREDEFINED) {
			throw new InvalidSettingsException("Unknown global setting: " + global);
		}
		if (!dataset.isGlobal() && global != PREDEFINED) {
			final ParameterGraph graph = ParameterGraphBuilder.build(peaks);
			final CompositeObjective part = new CompositeObjective(graph, dataset
				.column(0), 0, policy);
			return new FitPlan(Mode.LOCAL, graph, part, Collections.singletonList(
				part));
		}

		final ParameterGraph graph;
		if (global == PREDEFINED) {
			graph = ParameterGraphBuilder.buildPredefined(peaks);
			if (graph.datasetCount() != dataset.size()) {
				throw new InvalidSettingsException("Peaks are declared for " + graph
					.datasetCount() + " datasets but " + dataset.size() +
					" columns were given");
			}
		}
		else {
			graph = ParameterGraphBuilder.buildGlobal(peaks, dataset.size());
		}
		final List<CompositeObjective> parts = new ArrayList<>(dataset.size());
		for (int d = 1; d <= dataset.size(); d++) {
			parts.add(new CompositeObjective(graph, dataset.column(d - 1), d,
				policy));
		}
		return new FitPlan(Mode.GLOBAL, graph, new GlobalObjective(graph, parts),
			parts);
	}

	/** Graph and objective of one fit, with the per-dataset pieces. */
	public static final class FitPlan {

		private final Mode mode;
		private final ParameterGraph graph;
		private final Objective objective;
		private final List<CompositeObjective> parts;

		FitPlan(final Mode mode, final ParameterGraph graph,
			final Objective objective, final List<CompositeObjective> parts)
		{
			this.mode = mode;
			this.graph = graph;
			this.objective = objective;
			this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
		}

		public Mode getMode() {
			return mode;
		}

		public boolean isGlobal() {
			return mode == Mode.GLOBAL;
		}

		public ParameterGraph getGraph() {
			return graph;
		}

		public Objective getObjective() {
			return objective;
		}

		/** @return one objective per dataset; a single entry for a local fit */
		public List<CompositeObjective> parts() {
			return parts;
		}

		/** Re-slices an aggregate array at the dataset boundaries. */
		public List<double[]> split(final double[] aggregate) {
			if (objective instanceof GlobalObjective) {
				return ((GlobalObjective) objective).split(aggregate);
			}
			return Collections.singletonList(aggregate.clone());
		}
	}
}
