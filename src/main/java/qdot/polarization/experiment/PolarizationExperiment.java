package qdot.polarization.experiment;

import java.util.function.UnaryOperator;
import org.apache.log4j.Logger;
import qdot.polarization.input.InvalidInputException;
import qdot.polarization.input.NonPositiveTemperatureException;
import qdot.polarization.input.PolarizationLine;
import qdot.polarization.output.PolarizationFit;
import qdot.polarization.output.PolarizationFitResult;
import qdot.polarization.output.PolarizationParameters;
import qdot.polarization.utils.NumericUtils;

/**
 * Fits the tunnel coupling between two quantum dots from a polarization line, the sensor signal
 * measured as a function of inter-dot detuning across a charge transition.
 *
 * A fit proceeds in a fixed order: the thermal energy and the data are validated (failing before
 * any solver work), starting parameters are estimated from the data unless given, the
 * Levenberg-Marquardt solver is run, and the tunnel coupling of the solution is reflected to be
 * non-negative (the model only depends on its square). The outcome is packaged as a
 * {@link PolarizationFit} holding the fitted parameters, the fitted model as a function of
 * detuning, and a {@link PolarizationFitResult} record.
 *
 * An experiment only holds its settings; each call to a fit method works on its own copies of the
 * data, so one experiment can serve any number of fits, including from several threads at once.
 * Reaching the solver's iteration cap does not fail the fit: the best parameters found are
 * returned, flagged as not converged in the result.
 *
 * @see PolarizationModel for the model being fit
 */
public class PolarizationExperiment {

  private static final Logger logger = Logger.getLogger(PolarizationExperiment.class);

  private final SolverSettings settings;
  private final InitialGuessEstimator estimator;
  private final PolarizationSolver solver;

  public PolarizationExperiment() {
    this(SolverSettings.DEFAULT);
  }

  public PolarizationExperiment(SolverSettings settings) {
    this.settings = settings;
    estimator = new InitialGuessEstimator(settings);
    solver = new PolarizationSolver(settings);
  }

  /**
   * Fit a polarization line with default settings and estimated starting parameters
   *
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values, one per detuning value
   * @param kT Thermal energy (micro-eV)
   * @return fitted parameters, fitted model and result record
   * @throws NonPositiveTemperatureException if kT is not positive
   * @throws InvalidInputException if the series cannot be fit
   */
  public static PolarizationFit fitPolAll(double[] detuning, double[] signal, double kT) {
    return new PolarizationExperiment().fit(detuning, signal, kT);
  }

  /**
   * Evaluate the two-slope polarization model
   *
   * @param detuning Detuning values (micro-eV)
   * @param parameters The six model parameters in the order of {@link PolarizationParameters}
   * @param kT Thermal energy (micro-eV)
   * @return predicted sensor signal at each detuning value
   * @throws NonPositiveTemperatureException if kT is not positive
   * @throws InvalidInputException if there are not six parameters
   */
  public static double[] polmodAll2Slopes(double[] detuning, double[] parameters, double kT) {
    return PolarizationModel.evaluate(detuning,
        PolarizationParameters.fromArray(parameters), kT);
  }

  public SolverSettings getSettings() {
    return settings;
  }

  /**
   * Fit a polarization line, estimating the starting parameters from the data
   *
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values, one per detuning value
   * @param kT Thermal energy (micro-eV)
   * @return fitted parameters, fitted model and result record
   */
  public PolarizationFit fit(double[] detuning, double[] signal, double kT) {
    return fit(detuning, signal, kT, null);
  }

  /**
   * Fit a polarization line from given starting parameters
   *
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values, one per detuning value
   * @param kT Thermal energy (micro-eV)
   * @param seed Starting parameters, or null to estimate them from the data
   * @return fitted parameters, fitted model and result record
   */
  public PolarizationFit fit(double[] detuning, double[] signal, double kT,
      PolarizationParameters seed) {
    NonPositiveTemperatureException.requirePositive(kT);
    return fit(new PolarizationLine(detuning, signal), kT, seed);
  }

  /**
   * Fit a polarization line
   *
   * @param line Measured data
   * @param kT Thermal energy (micro-eV)
   * @param seed Starting parameters, or null to estimate them from the data
   * @return fitted parameters, fitted model and result record
   * @throws NonPositiveTemperatureException if kT is not positive
   * @throws InvalidInputException if a seed has non-finite values
   */
  public PolarizationFit fit(PolarizationLine line, double kT, PolarizationParameters seed) {
    NonPositiveTemperatureException.requirePositive(kT);
    double[] detuning = line.getDetuning();
    double[] signal = line.getSignal();

    logger.debug("Seeding fit of " + line.getName() + " (" + line.size() + " samples)");
    PolarizationParameters initial = seed;
    if (initial == null) {
      initial = estimator.estimate(detuning, signal);
    } else if (!initial.isFinite()) {
      throw new InvalidInputException("Starting parameters must be finite: " + initial);
    } else if (initial.getTunnelCoupling() == 0.) {
      // the cost is stationary in the coupling at zero, so the solver could never move it
      double coupling = estimator.estimate(detuning, signal).getTunnelCoupling();
      logger.info("Zero tunnel coupling seed replaced by " + coupling + " ueV");
      initial = initial.withTunnelCoupling(coupling);
    }
    logger.debug("Starting parameters: " + initial);

    double initialResidual =
        NumericUtils.rmsDifference(signal, PolarizationModel.evaluate(detuning, initial, kT));

    logger.debug("Iterating solver...");
    PolarizationSolver.Solution solution = solver.solve(detuning, signal, kT, initial);

    PolarizationParameters fitted = solution.getParameters().withNonNegativeCoupling();
    if (!solution.isConverged()) {
      logger.warn("Fit of " + line.getName() + " did not converge; returning best effort "
          + fitted);
    }

    PolarizationFitResult result = new PolarizationFitResult(fitted, initial, kT,
        solution.isConverged(), solution.getIterations(), solution.getEvaluations(),
        initialResidual, solution.getRms());
    logger.info("Fit " + line.getName() + ": tunnel coupling " + fitted.getTunnelCoupling()
        + " ueV, center " + fitted.getCenterOffset() + " ueV, RMS residual "
        + solution.getRms() + (solution.isConverged() ? "" : " [not converged]"));

    UnaryOperator<double[]> model = x -> PolarizationModel.evaluate(x, fitted, kT);
    return new PolarizationFit(line, model, result);
  }

}
