package qdot.polarization;

import java.io.IOException;
import org.apache.log4j.Logger;
import py4j.GatewayServer;
import py4j.Py4JNetworkException;
import qdot.polarization.experiment.PolarizationExperiment;
import qdot.polarization.experiment.SolverSettings;
import qdot.polarization.input.Configuration;
import qdot.polarization.input.PolarizationLine;
import qdot.polarization.output.PolarizationFit;
import qdot.polarization.output.PolarizationFitResult;
import qdot.polarization.output.PolarizationParameters;

/**
 * PolarizationProcessingServer allows fitting polarization lines from a Python environment (such
 * as the measurement notebooks that do the plotting) using Py4J.
 *
 * It uses the Py4J default port: 25333. If a process is already using that port it silently
 * terminates.
 *
 * Fits run with the settings of the configuration file read when the server is created.
 */
public class PolarizationProcessingServer {

  private static final Logger logger = Logger.getLogger(PolarizationProcessingServer.class);

  private final PolarizationExperiment experiment;

  public PolarizationProcessingServer() {
    this(Configuration.getInstance().getSolverSettings());
  }

  public PolarizationProcessingServer(SolverSettings settings) {
    experiment = new PolarizationExperiment(settings);
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new PolarizationProcessingServer());
    try {
      gatewayServer.start();
    } catch (Py4JNetworkException e) {
      logger.error("Could not start gateway server", e);
      System.exit(0);
    }
    logger.info("Gateway Server Started");
  }

  /**
   * Fit a polarization line held in a two-column text file (detuning, signal)
   *
   * @param filename Name of the data file
   * @param kT Thermal energy (micro-eV)
   * @return Result record of the fit
   * @throws IOException If the file cannot be read
   */
  public PolarizationFitResult runPolarizationFit(String filename, double kT)
      throws IOException {
    PolarizationLine line = PolarizationLine.fromFile(filename);
    return experiment.fit(line, kT, null).getResult();
  }

  /**
   * Fit a polarization line passed in as arrays
   *
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values
   * @param kT Thermal energy (micro-eV)
   * @return Result record of the fit
   */
  public PolarizationFitResult runPolarizationFit(double[] detuning, double[] signal,
      double kT) {
    return experiment.fit(detuning, signal, kT).getResult();
  }

  /**
   * Fit a polarization line passed in as arrays, from given starting parameters
   *
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values
   * @param kT Thermal energy (micro-eV)
   * @param seed The six starting parameters in model order
   * @return Result record of the fit
   */
  public PolarizationFitResult runPolarizationFit(double[] detuning, double[] signal, double kT,
      double[] seed) {
    return experiment.fit(detuning, signal, kT, PolarizationParameters.fromArray(seed))
        .getResult();
  }

  /**
   * Evaluate a fit's model over a set of detuning values, such as a dense grid for plotting
   *
   * @param detuning Detuning values (micro-eV)
   * @param result Result of an earlier fit
   * @return Model signal at each detuning value
   */
  public double[] evaluateFit(double[] detuning, PolarizationFitResult result) {
    return PolarizationExperiment.polmodAll2Slopes(detuning,
        result.getFittedParameters().toArray(), result.getKT());
  }

  /**
   * Evaluate the polarization model for given parameters
   *
   * @param detuning Detuning values (micro-eV)
   * @param parameters The six model parameters in model order
   * @param kT Thermal energy (micro-eV)
   * @return Model signal at each detuning value
   */
  public double[] evaluateModel(double[] detuning, double[] parameters, double kT) {
    return PolarizationExperiment.polmodAll2Slopes(detuning, parameters, kT);
  }

  /**
   * Get the names of the model parameters in the order used by arrays passed to this server
   * @return Parameter names
   */
  public static String[] getParameterNames() {
    return PolarizationParameters.NAMES.clone();
  }

  /**
   * Get the settings fits run with
   * @return solver settings
   */
  public SolverSettings getSettings() {
    return experiment.getSettings();
  }
}
