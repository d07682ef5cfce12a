package qdot.polarization.output;

import java.text.DecimalFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import qdot.polarization.utils.NumericUtils;

/**
 * Record of a single polarization line fit: the best-fit and initial parameters, the model tag,
 * and the thermal energy the fit was done at, along with how the solver finished.
 * Instances are created once per fit and never change afterwards.
 *
 * A fit that hit the solver's iteration or evaluation cap still produces a result holding the
 * best parameters found, with {@link #isConverged()} returning false; callers wanting strict
 * results should reject those.
 */
public final class PolarizationFitResult {

  /**
   * Tag identifying results produced by the two-slope polarization model
   */
  public static final String MODEL_TAG = "polarization fit";

  private final PolarizationParameters fittedParameters;
  private final PolarizationParameters initialParameters;
  private final double kT;
  private final boolean converged;
  private final int iterations;
  private final int evaluations;
  private final double initialResidual;
  private final double fitResidual;

  /**
   * @param fittedParameters best-fit parameters, tunnel coupling already non-negative
   * @param initialParameters parameters the solver was seeded with
   * @param kT thermal energy of the fit (micro-eV)
   * @param converged true if the solver met its tolerances before reaching a cap
   * @param iterations solver iterations used
   * @param evaluations model evaluations used
   * @param initialResidual RMS residual of the initial parameters
   * @param fitResidual RMS residual of the fitted parameters
   */
  public PolarizationFitResult(PolarizationParameters fittedParameters,
      PolarizationParameters initialParameters, double kT, boolean converged, int iterations,
      int evaluations, double initialResidual, double fitResidual) {
    this.fittedParameters = fittedParameters;
    this.initialParameters = initialParameters;
    this.kT = kT;
    this.converged = converged;
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.initialResidual = initialResidual;
    this.fitResidual = fitResidual;
  }

  public PolarizationParameters getFittedParameters() {
    return fittedParameters;
  }

  public PolarizationParameters getInitialParameters() {
    return initialParameters;
  }

  public String getModelTag() {
    return MODEL_TAG;
  }

  /**
   * @return thermal energy kT used in the fit (micro-eV)
   */
  public double getKT() {
    return kT;
  }

  public boolean isConverged() {
    return converged;
  }

  public int getIterations() {
    return iterations;
  }

  public int getEvaluations() {
    return evaluations;
  }

  public double getInitialResidual() {
    return initialResidual;
  }

  public double getFitResidual() {
    return fitResidual;
  }

  /**
   * Return the numeric results keyed by description, for consumers (such as plotting or
   * database code reached through the processing server) that want named values.
   * Fitted parameters are keyed by their name prefixed with "Fit_", initial ones with
   * "Initial_"; "kT", "Fit_residual", "Initial_residual" and "Converged" (1 or 0) are included.
   * @return new insertion-ordered, unmodifiable map of descriptions to values
   */
  public Map<String, double[]> getNumerMap() {
    Map<String, double[]> numerMap = new LinkedHashMap<>();
    double[] fit = fittedParameters.toArray();
    double[] init = initialParameters.toArray();
    for (int i = 0; i < PolarizationParameters.COUNT; ++i) {
      numerMap.put("Fit_" + PolarizationParameters.NAMES[i].toLowerCase(),
          new double[]{fit[i]});
    }
    for (int i = 0; i < PolarizationParameters.COUNT; ++i) {
      numerMap.put("Initial_" + PolarizationParameters.NAMES[i].toLowerCase(),
          new double[]{init[i]});
    }
    numerMap.put("kT", new double[]{kT});
    numerMap.put("Fit_residual", new double[]{fitResidual});
    numerMap.put("Initial_residual", new double[]{initialResidual});
    numerMap.put("Converged", new double[]{converged ? 1. : 0.});
    return Collections.unmodifiableMap(numerMap);
  }

  /**
   * Produce human-readable lines describing the fit, one string per block
   * @return Array of the fit-parameter block, the initial-parameter block and the solver block
   */
  public String[] getDataStrings() {
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    double[] fit = fittedParameters.toArray();
    double[] init = initialParameters.toArray();

    StringBuilder fitString = new StringBuilder();
    StringBuilder initString = new StringBuilder();
    for (int i = 0; i < PolarizationParameters.COUNT; ++i) {
      String name = PolarizationParameters.NAMES[i].replace('_', ' ');
      fitString.append("Fit ").append(name.toLowerCase()).append(": ")
          .append(df.format(fit[i])).append('\n');
      initString.append("Initial ").append(name.toLowerCase()).append(": ")
          .append(df.format(init[i])).append('\n');
    }
    fitString.append("Fit residual (RMS): ").append(df.format(fitResidual));
    initString.append("Initial residual (RMS): ").append(df.format(initialResidual));

    String solverString = MODEL_TAG + " at kT = " + df.format(kT) + " ueV\n"
        + (converged ? "Converged" : "NOT converged (iteration cap reached)")
        + " after " + iterations + " iterations, " + evaluations + " evaluations";

    return new String[]{fitString.toString(), initString.toString(), solverString};
  }

  /**
   * Get the data strings joined into a single report
   * @return report text
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      // add space between blocks
      if (i + 1 < strings.length) {
        sb.append("\n\n");
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "PolarizationFitResult{" + MODEL_TAG + ", fitted=" + fittedParameters
        + ", initial=" + initialParameters + ", kT=" + kT + ", converged=" + converged + '}';
  }
}
