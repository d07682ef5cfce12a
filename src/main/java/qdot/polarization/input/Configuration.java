package qdot.polarization.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.ConversionException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;
import qdot.polarization.experiment.SolverSettings;

/**
 * Configuration file holding the tuning knobs of the polarization fit that users have asked to
 * be able to change without recompiling: the relative tolerances and caps of the least-squares
 * solver and the two choices made when seeding it (fraction of each scan edge treated as
 * plateau, and how many sample spacings the tunnel coupling seed spans).
 * Values missing from the file, or all of them when the file cannot be read, fall back to the
 * defaults of {@link SolverSettings#DEFAULT}.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "polarization-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private double costTolerance = SolverSettings.DEFAULT.getCostTolerance();
  private double parameterTolerance = SolverSettings.DEFAULT.getParameterTolerance();
  private int maxIterations = SolverSettings.DEFAULT.getMaxIterations();
  private int maxEvaluations = SolverSettings.DEFAULT.getMaxEvaluations();
  private double edgeFraction = SolverSettings.DEFAULT.getEdgeFraction();
  private double tunnelSeedSpacings = SolverSettings.DEFAULT.getTunnelSeedSpacings();

  /**
   * Read in configuration from the given XML file; exposed to the package so a specific file can
   * be loaded without touching the shared instance
   * @param configLocation path of the XML file
   */
  Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      // read everything first so a bad value leaves all settings at their defaults
      double cost = config.getDouble("Solver.CostTolerance", costTolerance);
      double parameter = config.getDouble("Solver.ParameterTolerance", parameterTolerance);
      int iterations = config.getInt("Solver.MaxIterations", maxIterations);
      int evaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);
      double edge = config.getDouble("Estimator.EdgeFraction", edgeFraction);
      double spacings = config.getDouble("Estimator.TunnelSeedSpacings", tunnelSeedSpacings);

      costTolerance = cost;
      parameterTolerance = parameter;
      maxIterations = iterations;
      maxEvaluations = evaluations;
      edgeFraction = edge;
      tunnelSeedSpacings = spacings;

      if (config.getFile() != null) {
        try {
          loadedConfigPath = config.getFile().getCanonicalPath();
        } catch (IOException e) {
          logger.warn("Could not resolve canonical path of " + configLocation, e);
          loadedConfigPath = configLocation;
        }
      }
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    } catch (ConversionException e) {
      logger.error("Malformed value in " + configLocation + ", using defaults", e);
    }
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Config XML file " + DEFAULT_CONFIG_PATH + " not part of resources");
        return false;
      }
      logger.info("Copying over embedded config file to absolute path "
          + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the file...", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. A missing file is first written out from the embedded default; if that location
   * cannot be written the user's home directory is tried instead.
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = new Configuration(locateConfigFile(configLocation));
    }
    return instance;
  }

  /**
   * Drop the shared instance so the next {@link #getInstance()} reads its file again
   */
  synchronized static void resetInstance() {
    instance = null;
  }

  /**
   * Find or create the configuration file to read
   * @param configLocation preferred location
   * @return the preferred location if it exists or could be created, else the home directory one
   */
  private static String locateConfigFile(String configLocation) {
    if (new File(configLocation).exists() || copyEmbedXML(configLocation)) {
      return configLocation;
    }
    logger.warn("Could not find or write to specified config location: " + configLocation
        + "; trying the user home directory");
    String homeLocation = System.getProperty("user.home") + File.separator + DEFAULT_CONFIG_PATH;
    if (!new File(homeLocation).exists() && !copyEmbedXML(homeLocation)) {
      logger.warn("Could not write a config file to " + homeLocation + " either");
    }
    return homeLocation;
  }

  /**
   * Get the solver and estimator settings described by this configuration.
   * @return immutable settings object to pass to a polarization experiment
   */
  public SolverSettings getSolverSettings() {
    return SolverSettings.builder()
        .costTolerance(costTolerance)
        .parameterTolerance(parameterTolerance)
        .maxIterations(maxIterations)
        .maxEvaluations(maxEvaluations)
        .edgeFraction(edgeFraction)
        .tunnelSeedSpacings(tunnelSeedSpacings)
        .build();
  }

  /**
   * Relative change in cost below which the solver stops.
   *
   * The property is defined from Configuration.Solver.CostTolerance
   * @return cost relative tolerance
   */
  public double getCostTolerance() {
    return costTolerance;
  }

  public void setCostTolerance(double replacement) {
    costTolerance = replacement;
  }

  /**
   * Relative change in the parameter vector below which the solver stops.
   *
   * The property is defined from Configuration.Solver.ParameterTolerance
   * @return parameter relative tolerance
   */
  public double getParameterTolerance() {
    return parameterTolerance;
  }

  public void setParameterTolerance(double replacement) {
    parameterTolerance = replacement;
  }

  /**
   * Iteration cap of a single solver run; reaching it gives a best-effort (unconverged) fit.
   *
   * The property is defined from Configuration.Solver.MaxIterations
   * @return maximum number of solver iterations
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int replacement) {
    maxIterations = replacement;
  }

  /**
   * Model evaluation cap of a single solver run.
   *
   * The property is defined from Configuration.Solver.MaxEvaluations
   * @return maximum number of model evaluations
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public void setMaxEvaluations(int replacement) {
    maxEvaluations = replacement;
  }

  /**
   * Fraction of the samples on each end of the scan used as plateau when seeding the fit.
   *
   * The property is defined from Configuration.Estimator.EdgeFraction
   * @return edge fraction, between 0.1 and 0.2 once applied
   */
  public double getEdgeFraction() {
    return edgeFraction;
  }

  public void setEdgeFraction(double replacement) {
    edgeFraction = replacement;
  }

  /**
   * Number of detuning sample spacings spanned by the initial tunnel coupling.
   *
   * The property is defined from Configuration.Estimator.TunnelSeedSpacings
   * @return spacing multiple for the coupling seed
   */
  public double getTunnelSeedSpacings() {
    return tunnelSeedSpacings;
  }

  public void setTunnelSeedSpacings(double replacement) {
    tunnelSeedSpacings = replacement;
  }

  /**
   * Writes out the current configuration to the file it was loaded from.
   */
  public void saveCurrentConfig() {
    XMLConfiguration config;
    try {
      config = new XMLConfiguration(loadedConfigPath);

      config.setProperty("Solver.CostTolerance", costTolerance);
      config.setProperty("Solver.ParameterTolerance", parameterTolerance);
      config.setProperty("Solver.MaxIterations", maxIterations);
      config.setProperty("Solver.MaxEvaluations", maxEvaluations);
      config.setProperty("Estimator.EdgeFraction", edgeFraction);
      config.setProperty("Estimator.TunnelSeedSpacings", tunnelSeedSpacings);

      config.save();
    } catch (ConfigurationException e) {
      logger.error("Could not save configuration to " + loadedConfigPath, e);
    }
  }

}
