/**
 * SpectraFit
 * GlobalObjective.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;

import spectrafit.parameters.ParameterGraph;

/**
 * Concatenation of the per-dataset objectives of a global fit over one
 * merged parameter graph. The dataset boundaries are recorded here so that
 * aggregate arrays can be split back exactly.
 */
public final class GlobalObjective implements Objective {

	private final ParameterGraph graph;
	private final List<CompositeObjective> parts;
	private final int[] offsets;

	public GlobalObjective(final ParameterGraph graph,
		final List<CompositeObjective> parts)
	{
		this.graph = graph;
		this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
		this.offsets = new int[parts.size() + 1];
		for (int i = 0; i < parts.size(); i++) {
			offsets[i + 1] = offsets[i] + parts.get(i).length();
		}
	}

	@Override
	public double[] residual(final double[] values) {
		final double[] r = new double[length()];
		for (int i = 0; i < parts.size(); i++) {
			final double[] part = parts.get(i).residual(values);
			System.arraycopy(part, 0, r, offsets[i], part.length);
		}
		return r;
	}

	@Override
	public int length() {
		return offsets[offsets.length - 1];
	}

	@Override
	public ParameterGraph graph() {
		return graph;
	}

	@Override
	public GlobalObjective withGraph(final ParameterGraph newGraph) {
		final List<CompositeObjective> rebound = new ArrayList<>(parts.size());
		for (final CompositeObjective part : parts) {
			rebound.add(part.withGraph(newGraph));
		}
		return new GlobalObjective(newGraph, rebound);
	}

	/**
	 * Cuts an aggregate array at the recorded dataset boundaries.
	 *
	 * @throws DimensionMismatchException if {@code aggregate} is not as long as
	 *           the concatenated residual
	 */
	public List<double[]> split(final double[] aggregate) {
		if (aggregate.length != length()) {
			throw new DimensionMismatchException(aggregate.length, length());
		}
		final List<double[]> out = new ArrayList<>(parts.size());
		for (int i = 0; i < parts.size(); i++) {
			final double[] slice = new double[offsets[i + 1] - offsets[i]];
			System.arraycopy(aggregate, offsets[i], slice, 0, slice.length);
			out.add(slice);
		}
		return out;
	}

	public List<CompositeObjective> parts() {
		return parts;
	}

	/** @return start offset of each dataset, plus the total length */
	public int[] offsets() {
		return offsets.clone();
	}
}
