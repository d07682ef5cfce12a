package qdot.polarization.output;

import java.util.Arrays;
import qdot.polarization.input.InvalidInputException;

/**
 * The six parameters of the two-slope polarization line model, in the fixed order used by the
 * solver vectors:
 * tunnel coupling (micro-eV), center offset (micro-eV), background offset (sensor units),
 * left slope and right slope (sensor units per micro-eV), and transition height (sensor units).
 * The model depends on the tunnel coupling only through its square, so a negative coupling is a
 * valid point of the parameter space but is never reported.
 */
public final class PolarizationParameters {

  public static final int TUNNEL_COUPLING = 0;
  public static final int CENTER_OFFSET = 1;
  public static final int BACKGROUND_OFFSET = 2;
  public static final int LEFT_SLOPE = 3;
  public static final int RIGHT_SLOPE = 4;
  public static final int HEIGHT = 5;

  /**
   * Number of parameters in the model
   */
  public static final int COUNT = 6;

  /**
   * Parameter names in vector order, used as keys in result maps and in reports
   */
  public static final String[] NAMES = {
      "Tunnel_coupling", "Center_offset", "Background_offset",
      "Left_slope", "Right_slope", "Height"};

  private final double tunnelCoupling;
  private final double centerOffset;
  private final double backgroundOffset;
  private final double leftSlope;
  private final double rightSlope;
  private final double height;

  public PolarizationParameters(double tunnelCoupling, double centerOffset,
      double backgroundOffset, double leftSlope, double rightSlope, double height) {
    this.tunnelCoupling = tunnelCoupling;
    this.centerOffset = centerOffset;
    this.backgroundOffset = backgroundOffset;
    this.leftSlope = leftSlope;
    this.rightSlope = rightSlope;
    this.height = height;
  }

  /**
   * Create a parameter set from an array in solver order
   * @param values Array of length {@link #COUNT}
   * @return parameters holding those values
   * @throws InvalidInputException if the array is null or of the wrong length
   */
  public static PolarizationParameters fromArray(double[] values) {
    if (values == null || values.length != COUNT) {
      throw new InvalidInputException("Polarization model takes exactly " + COUNT
          + " parameters, got " + (values == null ? "none" : values.length));
    }
    return new PolarizationParameters(values[TUNNEL_COUPLING], values[CENTER_OFFSET],
        values[BACKGROUND_OFFSET], values[LEFT_SLOPE], values[RIGHT_SLOPE], values[HEIGHT]);
  }

  /**
   * @return new array of the parameters in solver order
   */
  public double[] toArray() {
    return new double[]{tunnelCoupling, centerOffset, backgroundOffset,
        leftSlope, rightSlope, height};
  }

  /**
   * Get this parameter set with the tunnel coupling reflected to be non-negative; the model
   * output is unchanged by doing so.
   * @return parameters with |tunnel coupling|, or this object if already non-negative
   */
  public PolarizationParameters withNonNegativeCoupling() {
    if (tunnelCoupling >= 0.) {
      return this;
    }
    return new PolarizationParameters(-tunnelCoupling, centerOffset, backgroundOffset,
        leftSlope, rightSlope, height);
  }

  /**
   * Get this parameter set with a different tunnel coupling, all else equal
   * @param replacement New tunnel coupling (micro-eV)
   * @return new parameter set
   */
  public PolarizationParameters withTunnelCoupling(double replacement) {
    return new PolarizationParameters(replacement, centerOffset, backgroundOffset,
        leftSlope, rightSlope, height);
  }

  /**
   * @return true if every parameter is a finite number
   */
  public boolean isFinite() {
    for (double value : toArray()) {
      if (!Double.isFinite(value)) {
        return false;
      }
    }
    return true;
  }

  public double getTunnelCoupling() {
    return tunnelCoupling;
  }

  public double getCenterOffset() {
    return centerOffset;
  }

  public double getBackgroundOffset() {
    return backgroundOffset;
  }

  public double getLeftSlope() {
    return leftSlope;
  }

  public double getRightSlope() {
    return rightSlope;
  }

  public double getHeight() {
    return height;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PolarizationParameters)) {
      return false;
    }
    return Arrays.equals(toArray(), ((PolarizationParameters) o).toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(toArray());
  }

  @Override
  public String toString() {
    return "PolarizationParameters" + Arrays.toString(toArray());
  }
}
