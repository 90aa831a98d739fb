/**
 * SpectraFit
 * Dataset.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Target data of a fit: one column for a local fit, several named columns for
 * a global fit. Columns may share their energy axis or carry their own.
 * Arrays are copied on the way in and out.
 */
public final class Dataset {

	public static final String ENERGY = "energy";
	public static final String INTENSITY = "intensity";

	/** One spectrum: label, energy axis, intensities and weights. */
	public static final class Column {

		private final String label;
		private final double[] x;
		private final double[] y;
		private final double[] weights;

		Column(final String label, final double[] x, final double[] y,
			final double[] weights)
		{
			if (x.length != y.length) {
				throw new DimensionMismatchException(y.length, x.length);
			}
			if (weights.length != x.length) {
				throw new DimensionMismatchException(weights.length, x.length);
			}
			this.label = label;
			this.x = x.clone();
			this.y = y.clone();
			this.weights = weights.clone();
		}

		public String getLabel() {
			return label;
		}

		public double[] getX() {
			return x.clone();
		}

		public double[] getY() {
			return y.clone();
		}

		public double[] getWeights() {
			return weights.clone();
		}

		public int size() {
			return x.length;
		}
	}

	private final List<Column> columns;

	private Dataset(final List<Column> columns) {
		this.columns = Collections.unmodifiableList(columns);
	}

	/** Single spectrum labelled {@value #INTENSITY}. */
	public static Dataset of(final double[] x, final double[] y) {
		final List<Column> c = new ArrayList<>();
		c.add(new Column(INTENSITY, x, y, ones(x.length)));
		return new Dataset(c);
	}

	/** Several spectra sharing one energy axis, in map iteration order. */
	public static Dataset of(final double[] x, final Map<String, double[]> ys) {
		final List<Column> c = new ArrayList<>();
		for (final Map.Entry<String, double[]> e : ys.entrySet()) {
			c.add(new Column(e.getKey(), x, e.getValue(), ones(x.length)));
		}
		return new Dataset(c);
	}

	/** @return a dataset with one more column */
	public Dataset with(final String label, final double[] x, final double[] y) {
		final List<Column> c = new ArrayList<>(columns);
		c.add(new Column(label, x, y, ones(x.length)));
		return new Dataset(c);
	}

	/** @return a dataset in which column {@code index} uses {@code weights} */
	public Dataset withWeights(final int index, final double[] weights) {
		final List<Column> c = new ArrayList<>(columns);
		final Column old = c.get(index);
		c.set(index, new Column(old.label, old.x, old.y, weights));
		return new Dataset(c);
	}

	public List<Column> columns() {
		return columns;
	}

	public Column column(final int index) {
		return columns.get(index);
	}

	public int size() {
		return columns.size();
	}

	public boolean isGlobal() {
		return columns.size() > 1;
	}

	/** @return whether every column has the same energy axis */
	public boolean sharesX() {
		for (final Column c : columns) {
			if (!Arrays.equals(c.x, columns.get(0).x)) return false;
		}
		return true;
	}

	private static double[] ones(final int n) {
		final double[] w = new double[n];
		Arrays.fill(w, 1.0);
		return w;
	}
}
