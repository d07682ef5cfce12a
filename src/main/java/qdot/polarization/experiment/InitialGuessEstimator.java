package qdot.polarization.experiment;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import qdot.polarization.input.PolarizationLine;
import qdot.polarization.output.PolarizationParameters;
import qdot.polarization.utils.NumericUtils;

/**
 * Derives a starting point for the polarization fit from simple statistics of the data, with no
 * optimization and no dependence on the thermal energy.
 *
 * The samples are taken in order of increasing detuning (the caller's arrays are not touched).
 * A fraction of the samples at each end of the scan is treated as plateau: a straight line fit to
 * each end gives the left and right slopes, and the two lines give the plateau levels. The
 * center is the sample whose de-trended signal is closest to halfway between the plateaus; the
 * background offset and height are the plateau levels referred to that center. The tunnel
 * coupling seed spans only a few sample spacings, since a seed wider than the true transition
 * tends to pull the solver into the wrong minimum.
 */
public class InitialGuessEstimator {

  /**
   * Smallest fraction of the samples on each side treated as plateau
   */
  public static final double MIN_EDGE_FRACTION = 0.1;
  /**
   * Largest fraction of the samples on each side treated as plateau
   */
  public static final double MAX_EDGE_FRACTION = 0.2;
  /**
   * Scan range divisor giving the coupling seed if the sample spacing is degenerate
   */
  static final double RANGE_DIVISOR = 30.;

  private final double edgeFraction;
  private final double tunnelSeedSpacings;

  public InitialGuessEstimator() {
    this(SolverSettings.DEFAULT);
  }

  /**
   * Create an estimator using the seeding values of the given settings. The edge fraction is
   * clamped to [{@link #MIN_EDGE_FRACTION}, {@link #MAX_EDGE_FRACTION}].
   * @param settings Settings to take edge fraction and coupling seed spacing multiple from
   */
  public InitialGuessEstimator(SolverSettings settings) {
    this.edgeFraction = Math.max(MIN_EDGE_FRACTION,
        Math.min(MAX_EDGE_FRACTION, settings.getEdgeFraction()));
    this.tunnelSeedSpacings = settings.getTunnelSeedSpacings();
  }

  public double getEdgeFraction() {
    return edgeFraction;
  }

  /**
   * Number of samples on each side treated as plateau for a line of the given length
   * @param length number of samples in the line
   * @return plateau sample count, at least 2
   */
  int edgeCount(int length) {
    return Math.max(2, (int) Math.round(length * edgeFraction));
  }

  /**
   * Estimate starting parameters for the given polarization line
   * @param detuning Detuning values (micro-eV)
   * @param signal Sensor values
   * @return Seed parameters with a positive tunnel coupling
   * @throws qdot.polarization.input.InvalidInputException if the data cannot be fit
   */
  public PolarizationParameters estimate(double[] detuning, double[] signal) {
    PolarizationLine.validate(detuning, signal);

    int[] order = NumericUtils.sortedOrder(detuning);
    double[] x = NumericUtils.reorder(detuning, order);
    double[] y = NumericUtils.reorder(signal, order);
    int length = x.length;
    int edge = edgeCount(length);

    SimpleRegression left = new SimpleRegression();
    SimpleRegression right = new SimpleRegression();
    for (int i = 0; i < edge; ++i) {
      left.addData(x[i], y[i]);
      right.addData(x[length - 1 - i], y[length - 1 - i]);
    }
    double leftSlope = slopeOf(left);
    double rightSlope = slopeOf(right);

    // plateau levels compared at the middle of the scan
    double middle = (x[0] + x[length - 1]) / 2;
    double leftLevel = levelOf(x, y, 0, edge, leftSlope, middle);
    double rightLevel = levelOf(x, y, length - edge, length, rightSlope, middle);
    double halfway = (leftLevel + rightLevel) / 2;

    // look between the plateaus for the sample closest to halfway
    double meanSlope = (leftSlope + rightSlope) / 2;
    int from = edge;
    int to = length - edge;
    if (from >= to) {
      from = 0;
      to = length;
    }
    int centerIndex = from;
    double closest = Double.POSITIVE_INFINITY;
    for (int i = from; i < to; ++i) {
      double distance = Math.abs(y[i] - meanSlope * (x[i] - middle) - halfway);
      if (distance < closest) {
        closest = distance;
        centerIndex = i;
      }
    }
    double center = x[centerIndex];

    double background = levelOf(x, y, 0, edge, leftSlope, center);
    double height = levelOf(x, y, length - edge, length, rightSlope, center) - background;

    double tunnelCoupling = tunnelSeedSpacings * NumericUtils.medianSpacing(x);
    if (!(tunnelCoupling > 0.)) {
      tunnelCoupling = (x[length - 1] - x[0]) / RANGE_DIVISOR;
    }
    if (!(tunnelCoupling > 0.)) {
      // every detuning value is the same; any positive width will do
      tunnelCoupling = 1.;
    }

    return new PolarizationParameters(tunnelCoupling, center, background,
        leftSlope, rightSlope, height);
  }

  /**
   * Slope of a plateau regression, or zero when the plateau has no spread in detuning
   */
  private static double slopeOf(SimpleRegression regression) {
    double slope = regression.getSlope();
    return Double.isNaN(slope) ? 0. : slope;
  }

  /**
   * Mean signal of samples [from, to) after removing the given slope about a pivot detuning,
   * i.e. the plateau level at the pivot
   */
  private static double levelOf(double[] x, double[] y, int from, int to, double slope,
      double pivot) {
    double[] detrended = new double[to - from];
    for (int i = from; i < to; ++i) {
      detrended[i - from] = y[i] - slope * (x[i] - pivot);
    }
    return NumericUtils.getMean(detrended);
  }

}
