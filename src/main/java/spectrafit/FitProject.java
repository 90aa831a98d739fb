/**
 * SpectraFit
 * FitProject.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import spectrafit.parameters.PeakSpec;
import spectrafit.solver.Dataset;

/**
 * Everything a fit needs: peaks in evaluation order, solver settings and the
 * data.
 */
public final class FitProject {

	private final List<PeakSpec> peaks;
	private final SolverSettings settings;
	private final Dataset dataset;

	private FitProject(final List<PeakSpec> peaks,
		final SolverSettings settings, final Dataset dataset)
	{
		this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
		this.settings = settings;
		this.dataset = dataset;
	}

	public static FitProject create(final List<PeakSpec> peaks,
		final SolverSettings settings, final Dataset dataset)
	{
		return new FitProject(peaks, settings, dataset);
	}

	public FitProject withSettings(final SolverSettings newSettings) {
		return new FitProject(peaks, newSettings, dataset);
	}

	public FitProject withDataset(final Dataset newDataset) {
		return new FitProject(peaks, settings, newDataset);
	}

	public List<PeakSpec> getPeaks() {
		return peaks;
	}

	public SolverSettings getSettings() {
		return settings;
	}

	public Dataset getDataset() {
		return dataset;
	}
}
