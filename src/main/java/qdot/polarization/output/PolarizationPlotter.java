package qdot.polarization.output;

/**
 * Consumer of fit results that draws a polarization line together with its fitted model.
 * Plotting is done outside this library (for instance in the Python session talking to the
 * processing server); implementations receive the raw series and the result record only.
 */
public interface PolarizationPlotter {

  /**
   * Draw measured data and fit
   * @param detuning Detuning values of the measured line (micro-eV)
   * @param signal Measured sensor values
   * @param result Fit of the line
   * @param figureId Identifier of the figure to draw into
   */
  void plotPolarizationFit(double[] detuning, double[] signal, PolarizationFitResult result,
      int figureId);

}
