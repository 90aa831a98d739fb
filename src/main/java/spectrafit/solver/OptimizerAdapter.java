/**
 * SpectraFit
 * OptimizerAdapter.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.fitting.leastsquares.GaussNewtonOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.SimpleVectorValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.MultiStartMultivariateOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.CMAESOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.random.GaussianRandomGenerator;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.UncorrelatedRandomVectorGenerator;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;
import org.scijava.log.LogService;

import spectrafit.exception.InvalidBoundsException;
import spectrafit.parameters.ParameterGraph;

/**
 * Drives a minimization method over an {@link Objective}. Bounded parameters
 * are optimized in unbounded internal coordinates (see
 * {@link ParameterGraph#toInternal(double[])}); the adapter counts
 * evaluations itself, remembers the best point seen, and turns budget
 * exhaustion and caller aborts into termination reasons instead of
 * exceptions.
 */
public class OptimizerAdapter {

	/** Square root of the machine epsilon, forward-difference step. */
	private static final double SQRT_EPS = FastMath.sqrt(FastMath.ulp(1.0));
	/** Relative step of the central differences used for the covariance. */
	private static final double COVAR_STEP = 1e-6;
	/** Smallest accepted ratio of extreme singular values of J^T J. */
	private static final double SINGULAR_RATIO = 1e-13;
	private static final long SEED = 20170101L;

	private final LogService log;
	private final boolean verbose;

	public OptimizerAdapter(final LogService log) {
		this(log, true);
	}

	/**
	 * @param verbose whether termination is logged at info level; nested fits
	 *          log it at debug level
	 */
	public OptimizerAdapter(final LogService log, final boolean verbose) {
		this.log = log;
		this.verbose = verbose;
	}

	/**
	 * Minimizes {@code objective} starting from the graph's initial values.
	 *
	 * @param maxNfev evaluation budget; non-positive means unlimited
	 * @param calcCovar whether to estimate the covariance at the optimum
	 * @param monitor observer of every evaluation, may abort the run
	 * @return the optimum, never {@code null}; non-convergence is reported as a
	 *         termination reason
	 */
	public Optimum minimize(final Objective objective, final Minimizer method,
		final int maxNfev, final boolean calcCovar, final FitMonitor monitor)
	{
		final ParameterGraph graph = objective.graph();
		final int budget = maxNfev > 0 ? maxNfev : Integer.MAX_VALUE;
		if (method == Minimizer.DIFFERENTIAL_EVOLUTION) requireFiniteBounds(
			graph);

		final Evaluator ev = new Evaluator(objective, budget, monitor);
		final double[] start = graph.initialValues();
		double[] best = start;
		TerminationReason reason = TerminationReason.CONVERGED;
		String message = "Fit succeeded.";
		boolean stopped = false;
		boolean failed = false;

		if (graph.freeCount() == 0) {
			message = "No varying parameters; model evaluated once.";
			ev.residual(start);
		}
		else {
			try {
				best = run(method, ev, graph, start);
			}
			catch (final TooManyEvaluationsException e) {
				stopped = true;
				message = "Maximum number of function evaluations (" + budget +
					") reached.";
			}
			catch (final AbortException e) {
				stopped = true;
				message = "Fit aborted by caller.";
			}
			catch (final MaxCountExceededException e) {
				stopped = true;
				ev.exhausted = true;
				message = "Iteration limit reached: " + e.getMessage();
			}
			catch (final ConvergenceException | SingularMatrixException
					| MathArithmeticException e)
			{
				stopped = true;
				failed = true;
				message = "Stopped, no further improvement possible: " + e
					.getMessage();
				log.warn(method + ": " + message);
			}
			if (ev.aborted) {
				reason = TerminationReason.USER_ABORT;
				message = "Fit aborted by caller.";
			}
			else if (ev.exhausted) {
				reason = TerminationReason.MAX_EVALS_REACHED;
				if (!stopped) message = "Maximum number of function evaluations (" +
					budget + ") reached.";
			}
			// the last accepted point is lost when a method is interrupted
			if ((stopped || reason != TerminationReason.CONVERGED) &&
				ev.best != null) best = ev.best;
		}

		final double[] residual = objective.residual(best);
		RealMatrix covariance = null;
		if (calcCovar && graph.freeCount() > 0) {
			covariance = covariance(objective, best, residual);
			if (covariance == null && verbose) {
				log.warn("Covariance matrix could not be estimated; " +
					"standard errors are unavailable.");
			}
		}
		final String summary = String.format("%s: %s after %d evaluations (%s)",
			method, reason, ev.nfev, message);
		if (verbose) log.info(summary);
		else log.debug(summary);
		return new Optimum(method, best, covariance, ev.nfev, budget, reason,
			!failed, message, residual);
	}

	private double[] run(final Minimizer method, final Evaluator ev,
		final ParameterGraph graph, final double[] start)
	{
		final double[] internal = graph.toInternal(start);
		final MultivariateFunction chiSquare = p -> ev.chiSquare(graph.toExternal(
			p));
		switch (method) {
			case LEASTSQ:
				return graph.toExternal(leastSquares(ev, graph, internal,
					new LevenbergMarquardtOptimizer()
						.withCostRelativeTolerance(1.49012e-8)
						.withParameterRelativeTolerance(1.49012e-8)
						.withOrthoTolerance(1e-10)));
			case GAUSS_NEWTON:
				return graph.toExternal(leastSquares(ev, graph, internal,
					new GaussNewtonOptimizer(GaussNewtonOptimizer.Decomposition.QR)));
			case NELDER: {
				final PointValuePair p = new SimplexOptimizer(1e-10, 1e-14).optimize(
					new MaxEval(Integer.MAX_VALUE), new ObjectiveFunction(chiSquare),
					GoalType.MINIMIZE, new InitialGuess(internal), new NelderMeadSimplex(
						simplexSteps(internal)));
				return graph.toExternal(p.getPoint());
			}
			case POWELL: {
				final PointValuePair p = new PowellOptimizer(1e-10, 1e-14).optimize(
					new MaxEval(Integer.MAX_VALUE), new ObjectiveFunction(chiSquare),
					GoalType.MINIMIZE, new InitialGuess(internal));
				return graph.toExternal(p.getPoint());
			}
			case CMAES: {
				final int n = internal.length;
				final double[] sigma = new double[n];
				for (int i = 0; i < n; i++) {
					sigma[i] = 0.1 * FastMath.max(FastMath.abs(internal[i]), 1.0);
				}
				final CMAESOptimizer cmaes = new CMAESOptimizer(30000, 0.0, true, 0, 0,
					new MersenneTwister(SEED), false, new SimpleValueChecker(1e-12,
						1e-14));
				final PointValuePair p = cmaes.optimize(new MaxEval(Integer.MAX_VALUE),
					new ObjectiveFunction(chiSquare), GoalType.MINIMIZE,
					new InitialGuess(internal), SimpleBounds.unbounded(n),
					new CMAESOptimizer.Sigma(sigma), new CMAESOptimizer.PopulationSize(4 +
						(int) (3 * FastMath.log(n))));
				return graph.toExternal(p.getPoint());
			}
			case DIFFERENTIAL_EVOLUTION:
				return new DifferentialEvolution(15, 0.8, 0.7, 0.01, 1000,
					new MersenneTwister(SEED)).minimize(ev::chiSquare, start, graph
						.lowerBounds(), graph.upperBounds());
			case BASINHOPPING: {
				final double[] sd = new double[internal.length];
				for (int i = 0; i < sd.length; i++) {
					sd[i] = 0.5 * FastMath.max(FastMath.abs(internal[i]), 0.1);
				}
				final MultiStartMultivariateOptimizer multi =
					new MultiStartMultivariateOptimizer(new SimplexOptimizer(1e-10,
						1e-14), 10, new UncorrelatedRandomVectorGenerator(internal, sd,
							new GaussianRandomGenerator(new MersenneTwister(SEED))));
				final PointValuePair p = multi.optimize(new MaxEval(Integer.MAX_VALUE),
					new ObjectiveFunction(chiSquare), GoalType.MINIMIZE,
					new InitialGuess(internal), new NelderMeadSimplex(simplexSteps(
						internal)));
				return graph.toExternal(p.getPoint());
			}
			case EMCEE:
				return new EnsembleSampler(100, 1000, new MersenneTwister(SEED))
					.sample(ev::chiSquare, start, graph.lowerBounds(), graph
						.upperBounds());
			default:
				throw new IllegalStateException("Unhandled method " + method);
		}
	}

	private double[] leastSquares(final Evaluator ev, final ParameterGraph graph,
		final double[] internal, final LeastSquaresOptimizer optimizer)
	{
		final MultivariateJacobianFunction model = point -> {
			final double[] p = point.toArray();
			final double[] r = ev.residual(graph.toExternal(p));
			final RealMatrix jac = new Array2DRowRealMatrix(r.length, p.length);
			for (int j = 0; j < p.length; j++) {
				final double h = SQRT_EPS * FastMath.max(FastMath.abs(p[j]), 1.0);
				final double[] q = p.clone();
				q[j] += h;
				final double[] rq = ev.residual(graph.toExternal(q));
				for (int i = 0; i < r.length; i++) {
					jac.setEntry(i, j, (rq[i] - r[i]) / h);
				}
			}
			return new Pair<RealVector, RealMatrix>(new ArrayRealVector(r, false),
				jac);
		};
		final LeastSquaresProblem problem = new LeastSquaresBuilder()
			.maxEvaluations(Integer.MAX_VALUE).maxIterations(Integer.MAX_VALUE)
			.lazyEvaluation(false).checkerPair(new SimpleVectorValueChecker(1e-10,
				1e-14)).start(internal).target(new double[ev.objective.length()])
			.model(model).build();
		return optimizer.optimize(problem).getPoint().toArray();
	}

	private static double[] simplexSteps(final double[] internal) {
		final double[] steps = new double[internal.length];
		for (int i = 0; i < steps.length; i++) {
			steps[i] = internal[i] != 0.0 ? 0.05 * FastMath.abs(internal[i]) : 0.00025;
		}
		return steps;
	}

	private static void requireFiniteBounds(final ParameterGraph graph) {
		final double[] lo = graph.lowerBounds();
		final double[] hi = graph.upperBounds();
		final double[] v = graph.initialValues();
		for (int i = 0; i < lo.length; i++) {
			if (Double.isInfinite(lo[i]) || Double.isInfinite(hi[i])) {
				throw new InvalidBoundsException(graph.freeNames().get(i), v[i], lo[i],
					hi[i]);
			}
		}
	}

	/**
	 * Covariance {@code (J^T J)^-1 * chi^2 / (n - k)} from a central-difference
	 * Jacobian in external coordinates, or {@code null} if the problem is
	 * singular or has no degrees of freedom.
	 */
	RealMatrix covariance(final Objective objective, final double[] best,
		final double[] residual)
	{
		final int m = residual.length;
		final int n = best.length;
		if (m <= n) return null;
		final RealMatrix jac = new Array2DRowRealMatrix(m, n);
		for (int j = 0; j < n; j++) {
			final double h = COVAR_STEP * FastMath.max(FastMath.abs(best[j]), 1e-3);
			final double[] up = best.clone();
			final double[] down = best.clone();
			up[j] += h;
			down[j] -= h;
			final double[] ru = objective.residual(up);
			final double[] rd = objective.residual(down);
			for (int i = 0; i < m; i++) {
				jac.setEntry(i, j, (ru[i] - rd[i]) / (2 * h));
			}
		}
		final RealMatrix jtj = jac.transpose().multiply(jac);
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				final double v = jtj.getEntry(i, j);
				if (Double.isNaN(v) || Double.isInfinite(v)) return null;
			}
		}
		final SingularValueDecomposition svd = new SingularValueDecomposition(jtj);
		final double[] s = svd.getSingularValues();
		if (s[0] <= 0 || s[s.length - 1] <= SINGULAR_RATIO * s[0]) return null;

		double chi = 0;
		for (final double r : residual) {
			chi += r * r;
		}
		final RealMatrix inverse = svd.getSolver().getInverse();
		// the SVD inverse is symmetric only up to round-off
		final RealMatrix cov = inverse.add(inverse.transpose()).scalarMultiply(0.5 *
			chi / (m - n));
		for (int i = 0; i < n; i++) {
			final double d = cov.getEntry(i, i);
			if (!(d > 0) || Double.isInfinite(d)) return null;
		}
		return cov;
	}

	private static final class AbortException extends RuntimeException {

		private static final long serialVersionUID = 1L;

		AbortException() {
			super("aborted by monitor");
		}
	}

	/** Counting, best-tracking front of an objective, in external coordinates. */
	private static final class Evaluator {

		private final Objective objective;
		private final int budget;
		private final FitMonitor monitor;
		private int nfev;
		private double bestChi = Double.POSITIVE_INFINITY;
		private double[] best;
		private boolean exhausted;
		private boolean aborted;

		Evaluator(final Objective objective, final int budget,
			final FitMonitor monitor)
		{
			this.objective = objective;
			this.budget = budget;
			this.monitor = monitor;
		}

		double[] residual(final double[] values) {
			if (monitor.isAborted()) {
				aborted = true;
				throw new AbortException();
			}
			if (nfev >= budget) {
				exhausted = true;
				throw new TooManyEvaluationsException(budget);
			}
			nfev++;
			final double[] r = objective.residual(values);
			double chi = 0;
			for (final double v : r) {
				chi += v * v;
			}
			if (best == null || chi < bestChi) {
				bestChi = chi;
				best = values.clone();
			}
			monitor.evaluated(nfev, budget, values.clone(), chi);
			return r;
		}

		/** Chi-square for scalar methods; NaN is mapped to +Infinity. */
		double chiSquare(final double[] values) {
			double chi = 0;
			for (final double v : residual(values)) {
				chi += v * v;
			}
			return Double.isNaN(chi) ? Double.POSITIVE_INFINITY : chi;
		}
	}
}
