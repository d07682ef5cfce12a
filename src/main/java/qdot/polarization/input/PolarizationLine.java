package qdot.polarization.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * A measured polarization line: sensor signal sampled at a set of inter-dot detuning values.
 * Detuning is in micro-eV and the signal in the sensor's arbitrary units; the two series are
 * index-aligned. Construction validates the pair so that anything holding an instance can be
 * handed to the solver directly. Both arrays are copied on the way in and on the way out, so
 * the caller's data is never modified.
 */
public class PolarizationLine {

  /**
   * Number of free parameters in the transition model; lines must have at least this many points
   */
  public static final int MIN_SAMPLES = 6;

  private static final Logger logger = Logger.getLogger(PolarizationLine.class);

  private final double[] detuning;
  private final double[] signal;
  private final String name;

  /**
   * Construct a polarization line from detuning and signal series
   * @param detuning Detuning values (micro-eV), conventionally increasing
   * @param signal Sensor values, one per detuning value
   * @throws InvalidInputException if the series cannot be fit (see {@link #validate})
   */
  public PolarizationLine(double[] detuning, double[] signal) {
    this(detuning, signal, "polarization line");
  }

  /**
   * Construct a named polarization line (the name is used in log messages and reports)
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values, one per detuning value
   * @param name Label of the data, such as its source file name
   */
  public PolarizationLine(double[] detuning, double[] signal, String name) {
    validate(detuning, signal);
    this.detuning = detuning.clone();
    this.signal = signal.clone();
    this.name = name;
  }

  /**
   * Check that a detuning/signal pair can be passed to the fit.
   * @param detuning Detuning series
   * @param signal Signal series
   * @throws InvalidInputException if either is null or empty, lengths differ, there are fewer
   * than {@link #MIN_SAMPLES} points, or a value is NaN or infinite
   */
  public static void validate(double[] detuning, double[] signal) {
    if (detuning == null || signal == null) {
      throw new InvalidInputException("Detuning and signal series must both be given");
    }
    if (detuning.length == 0 || signal.length == 0) {
      throw new InvalidInputException("Detuning and signal series must not be empty");
    }
    if (detuning.length != signal.length) {
      throw new InvalidInputException("Detuning has " + detuning.length
          + " samples but signal has " + signal.length);
    }
    if (detuning.length < MIN_SAMPLES) {
      throw new InvalidInputException("Need at least " + MIN_SAMPLES
          + " samples to fit the transition model, got " + detuning.length);
    }
    for (int i = 0; i < detuning.length; ++i) {
      if (!Double.isFinite(detuning[i])) {
        throw new InvalidInputException("Non-finite detuning value at index " + i);
      }
      if (!Double.isFinite(signal[i])) {
        throw new InvalidInputException("Non-finite signal value at index " + i);
      }
    }
  }

  /**
   * Read a polarization line from a text file with two columns per line, detuning then signal,
   * separated by commas and/or whitespace. A first line that does not parse as numbers is treated
   * as a header; blank lines and lines starting with '#' are skipped.
   * @param filename Name of file to read in
   * @return Polarization line holding the file's data
   * @throws IOException If the file cannot be read
   * @throws InvalidInputException If a data line is malformed or the data cannot be fit
   */
  public static PolarizationLine fromFile(String filename) throws IOException {
    File file = new File(filename);
    List<Double> detuningList = new ArrayList<>();
    List<Double> signalList = new ArrayList<>();

    try (BufferedReader br = new BufferedReader(new FileReader(file))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        String[] fields = line.split("[,\\s]+");
        if (fields.length < 2) {
          if (detuningList.isEmpty()) {
            logger.debug("Skipping header of " + file.getName() + ": " + line);
            continue;
          }
          throw new InvalidInputException("Expected detuning and signal on line " + lineNumber
              + " of " + file.getName());
        }
        try {
          double x = Double.parseDouble(fields[0]);
          double y = Double.parseDouble(fields[1]);
          detuningList.add(x);
          signalList.add(y);
        } catch (NumberFormatException e) {
          if (detuningList.isEmpty()) {
            // header line
            logger.debug("Skipping header of " + file.getName() + ": " + line);
            continue;
          }
          throw new InvalidInputException("Could not parse line " + lineNumber + " of "
              + file.getName() + ": " + line);
        }
      }
    }

    double[] detuning = new double[detuningList.size()];
    double[] signal = new double[signalList.size()];
    for (int i = 0; i < detuning.length; ++i) {
      detuning[i] = detuningList.get(i);
      signal[i] = signalList.get(i);
    }
    logger.info("Read " + detuning.length + " samples from " + file.getName());
    return new PolarizationLine(detuning, signal, file.getName());
  }

  /**
   * @return copy of the detuning values (micro-eV)
   */
  public double[] getDetuning() {
    return detuning.clone();
  }

  /**
   * @return copy of the sensor signal values
   */
  public double[] getSignal() {
    return signal.clone();
  }

  public String getName() {
    return name;
  }

  public int size() {
    return detuning.length;
  }

}
