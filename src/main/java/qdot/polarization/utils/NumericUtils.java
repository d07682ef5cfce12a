package qdot.polarization.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import java.util.Comparator;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Class containing small numeric helpers shared by the polarization fit: ordering and spacing of
 * detuning samples, means and residual statistics, and number formatting for reports.
 *
 * None of these methods modify the arrays passed in.
 */
public class NumericUtils {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        setInfinityPrintable(format);
        return format;
      });

  private NumericUtils() {
  }

  /**
   * Return the calculation of the arithmetic mean (using a recursive definition for stability)
   *
   * @param dataSet Range of data to get the mean value from
   * @return the arithmetic mean
   */
  public static double getMean(double[] dataSet) {
    double mean = 0.0;
    double inc = 1;

    for (double data : dataSet) {
      mean = mean + ((data - mean) / inc);
      ++inc;
    }
    return mean;
  }

  /**
   * Root-mean-square difference between two equal-length series
   *
   * @param observed Measured values
   * @param predicted Model values at the same points
   * @return sqrt(mean((observed - predicted)^2))
   */
  public static double rmsDifference(double[] observed, double[] predicted) {
    double mean = 0.0;
    double inc = 1;
    for (int i = 0; i < observed.length; ++i) {
      double diff = observed[i] - predicted[i];
      mean = mean + ((diff * diff - mean) / inc);
      ++inc;
    }
    return Math.sqrt(mean);
  }

  /**
   * Get the indices that would sort the given data in increasing order. Equal values keep their
   * original relative order, so the result is deterministic.
   *
   * @param data Values to get the sort order of
   * @return Index array such that data[order[0]] <= data[order[1]] <= ...
   */
  public static int[] sortedOrder(final double[] data) {
    Integer[] boxed = new Integer[data.length];
    for (int i = 0; i < boxed.length; ++i) {
      boxed[i] = i;
    }
    Arrays.sort(boxed, Comparator.comparingDouble(i -> data[i]));
    int[] order = new int[boxed.length];
    for (int i = 0; i < order.length; ++i) {
      order[i] = boxed[i];
    }
    return order;
  }

  /**
   * Rearrange data according to an index order, as produced by {@link #sortedOrder(double[])}
   *
   * @param data Data to rearrange
   * @param order Indices into data
   * @return new array where entry i is data[order[i]]
   */
  public static double[] reorder(double[] data, int[] order) {
    double[] out = new double[order.length];
    for (int i = 0; i < order.length; ++i) {
      out[i] = data[order[i]];
    }
    return out;
  }

  /**
   * Median distance between neighboring points of a sorted series; used as the sampling interval
   * of detuning scans that may not be perfectly even.
   *
   * @param sorted Data sorted in increasing order, at least two points
   * @return median of the absolute first differences
   */
  public static double medianSpacing(double[] sorted) {
    double[] diffs = new double[sorted.length - 1];
    for (int i = 0; i < diffs.length; ++i) {
      diffs[i] = Math.abs(sorted[i + 1] - sorted[i]);
    }
    return new Median().evaluate(diffs);
  }

  /**
   * Sets the symbol used for infinite values in a decimal format, so that unconverged or
   * degenerate numbers still print legibly in reports.
   *
   * @param df Decimal format to modify
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

}
