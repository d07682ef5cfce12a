package qdot.polarization.output;

import java.util.function.UnaryOperator;
import qdot.polarization.input.PolarizationLine;

/**
 * Everything returned from fitting a polarization line: the fitted parameters, the model bound
 * to those parameters and the fit's thermal energy (mapping detuning values to predicted
 * signal), and the result record.
 */
public final class PolarizationFit {

  private final PolarizationLine line;
  private final UnaryOperator<double[]> model;
  private final PolarizationFitResult result;

  public PolarizationFit(PolarizationLine line, UnaryOperator<double[]> model,
      PolarizationFitResult result) {
    this.line = line;
    this.model = model;
    this.result = result;
  }

  /**
   * @return fitted parameters (tunnel coupling non-negative)
   */
  public PolarizationParameters getFittedParameters() {
    return result.getFittedParameters();
  }

  /**
   * Get the fitted model as a function of detuning, such as for plotting the fit over a denser
   * grid than the data
   * @return function from detuning values (micro-eV) to predicted signal values
   */
  public UnaryOperator<double[]> getModel() {
    return model;
  }

  public PolarizationFitResult getResult() {
    return result;
  }

  /**
   * @return the data that was fit
   */
  public PolarizationLine getLine() {
    return line;
  }

  /**
   * Hand the fitted data and its result to a plotter
   * @param plotter Plotting implementation
   * @param figureId Figure to draw into
   */
  public void plot(PolarizationPlotter plotter, int figureId) {
    plotter.plotPolarizationFit(line.getDetuning(), line.getSignal(), result, figureId);
  }
}
