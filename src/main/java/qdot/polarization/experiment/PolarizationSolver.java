package qdot.polarization.experiment;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import qdot.polarization.output.PolarizationParameters;

/**
 * Least-squares solver for the polarization line model, using the Apache Commons
 * Levenberg-Marquardt optimizer with the analytic Jacobian of {@link PolarizationModel}.
 *
 * The sum of squared residuals is not convex in the tunnel coupling, and a seed much narrower
 * than the true transition can leave the optimizer in a poor minimum. The solver therefore
 * starts from the given seed and from the same seed with the coupling widened by each factor of
 * {@link #TUNNEL_SEED_LADDER}, keeping the run with the lowest cost. The ladder is fixed, so
 * identical input always produces identical output.
 *
 * If a run reaches the iteration or evaluation cap of its {@link SolverSettings}, the best point
 * evaluated so far is used and the run is marked as not converged; this is not an error.
 *
 * The solver holds no state between calls and can be shared between threads.
 */
public class PolarizationSolver {

  /**
   * Multiples of the seed tunnel coupling each solve starts from, in order
   */
  static final double[] TUNNEL_SEED_LADDER = {1., 4., 16.};

  private static final Logger logger = Logger.getLogger(PolarizationSolver.class);

  private final SolverSettings settings;

  public PolarizationSolver() {
    this(SolverSettings.DEFAULT);
  }

  public PolarizationSolver(SolverSettings settings) {
    this.settings = settings;
  }

  public SolverSettings getSettings() {
    return settings;
  }

  /**
   * Fit the model to the data starting from the given seed.
   *
   * @param detuning Detuning values (micro-eV), already validated
   * @param signal Sensor values, already validated
   * @param kT Thermal energy (micro-eV), already validated
   * @param seed Initial parameters
   * @return Best solution found over all starting points
   */
  public Solution solve(double[] detuning, double[] signal, double kT,
      PolarizationParameters seed) {

    MultivariateJacobianFunction model = PolarizationModel.asJacobianFunction(detuning, kT);
    RealVector observed = MatrixUtils.createRealVector(signal);

    Solution best = null;
    for (double factor : TUNNEL_SEED_LADDER) {
      PolarizationParameters start =
          seed.withTunnelCoupling(seed.getTunnelCoupling() * factor);
      Solution candidate = solveFrom(model, observed, start);
      logger.debug("Run from coupling seed " + start.getTunnelCoupling() + " gave RMS "
          + candidate.getRms() + (candidate.isConverged() ? "" : " (not converged)"));
      // strict comparison keeps the earliest run on ties
      if (best == null || candidate.getRms() < best.getRms()
          || (Double.isNaN(best.getRms()) && !Double.isNaN(candidate.getRms()))) {
        best = candidate;
      }
    }
    return best;
  }

  /**
   * Run one Levenberg-Marquardt optimization.
   *
   * @param model Model function over the detuning values
   * @param observed Measured signal
   * @param start Starting parameters
   * @return Converged solution, or the best point evaluated if a cap was reached
   */
  private Solution solveFrom(MultivariateJacobianFunction model, RealVector observed,
      PolarizationParameters start) {

    BestPointTracker tracker = new BestPointTracker(model, observed);
    RealVector startVector = MatrixUtils.createRealVector(start.toArray());

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(startVector).
        target(observed).
        model(tracker).
        lazyEvaluation(false).
        maxEvaluations(settings.getMaxEvaluations()).
        maxIterations(settings.getMaxIterations()).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(settings.getCostTolerance()).
        withParameterRelativeTolerance(settings.getParameterTolerance());

    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
      return new Solution(optimum.getPoint().toArray(), optimum.getRMS(), true,
          optimum.getIterations(), optimum.getEvaluations());
    } catch (TooManyIterationsException e) {
      logger.warn("Iteration cap of " + settings.getMaxIterations()
          + " reached before convergence, using best point found");
      return tracker.bestSolution(settings.getMaxIterations());
    } catch (TooManyEvaluationsException e) {
      logger.warn("Evaluation cap of " + settings.getMaxEvaluations()
          + " reached before convergence, using best point found");
      // each iteration takes at least one evaluation
      return tracker.bestSolution(tracker.getEvaluations());
    } catch (ConvergenceException e) {
      // the optimizer can no longer reduce the cost at machine precision
      logger.debug("Solver stopped at machine precision: " + e.getMessage());
      Solution stalled = tracker.bestSolution(tracker.getEvaluations());
      return new Solution(stalled.getPoint(), stalled.getRms(), true,
          stalled.getIterations(), stalled.getEvaluations());
    }
  }

  /**
   * Outcome of a solver run: the parameter vector with its RMS residual, whether the run met its
   * tolerances, and how much work it took.
   */
  public static final class Solution {

    private final double[] point;
    private final double rms;
    private final boolean converged;
    private final int iterations;
    private final int evaluations;

    Solution(double[] point, double rms, boolean converged, int iterations, int evaluations) {
      this.point = point;
      this.rms = rms;
      this.converged = converged;
      this.iterations = iterations;
      this.evaluations = evaluations;
    }

    /**
     * @return copy of the solution's parameter vector, in solver order
     */
    public double[] getPoint() {
      return point.clone();
    }

    public PolarizationParameters getParameters() {
      return PolarizationParameters.fromArray(point);
    }

    public double getRms() {
      return rms;
    }

    public boolean isConverged() {
      return converged;
    }

    /**
     * @return iterations used; for a run stopped by its evaluation cap this is an upper bound
     */
    public int getIterations() {
      return iterations;
    }

    public int getEvaluations() {
      return evaluations;
    }
  }

  /**
   * Model wrapper that remembers the lowest-cost point the optimizer has evaluated, so that a run
   * stopped by a cap can still report its best point. One tracker belongs to one run.
   */
  private static class BestPointTracker implements MultivariateJacobianFunction {

    private final MultivariateJacobianFunction model;
    private final RealVector observed;
    private double[] bestPoint;
    private double bestCost = Double.POSITIVE_INFINITY;
    private int evaluations;

    BestPointTracker(MultivariateJacobianFunction model, RealVector observed) {
      this.model = model;
      this.observed = observed;
    }

    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      ++evaluations;
      Pair<RealVector, RealMatrix> result = model.value(point);
      RealVector residuals = observed.subtract(result.getFirst());
      double cost = residuals.dotProduct(residuals);
      if (bestPoint == null || cost < bestCost) {
        bestCost = cost;
        bestPoint = point.toArray();
      }
      return result;
    }

    int getEvaluations() {
      return evaluations;
    }

    Solution bestSolution(int iterations) {
      double rms = Math.sqrt(bestCost / observed.getDimension());
      return new Solution(bestPoint.clone(), rms, false, iterations, evaluations);
    }
  }
}
