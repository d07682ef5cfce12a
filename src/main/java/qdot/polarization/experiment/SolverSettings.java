package qdot.polarization.experiment;

/**
 * Immutable set of tuning values for one polarization fit: the Levenberg-Marquardt stopping
 * criteria and caps, plus the seeding choices of {@link InitialGuessEstimator}.
 * Instances are built with {@link #builder()}; every field not given keeps its default.
 */
public final class SolverSettings {

  /**
   * Settings used when nothing else is specified
   */
  public static final SolverSettings DEFAULT = builder().build();

  private final double costTolerance;
  private final double parameterTolerance;
  private final int maxIterations;
  private final int maxEvaluations;
  private final double edgeFraction;
  private final double tunnelSeedSpacings;

  private SolverSettings(Builder builder) {
    costTolerance = builder.costTolerance;
    parameterTolerance = builder.parameterTolerance;
    maxIterations = builder.maxIterations;
    maxEvaluations = builder.maxEvaluations;
    edgeFraction = builder.edgeFraction;
    tunnelSeedSpacings = builder.tunnelSeedSpacings;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Get a builder starting from the values of this object
   * @return builder with this object's values
   */
  public Builder toBuilder() {
    return new Builder()
        .costTolerance(costTolerance)
        .parameterTolerance(parameterTolerance)
        .maxIterations(maxIterations)
        .maxEvaluations(maxEvaluations)
        .edgeFraction(edgeFraction)
        .tunnelSeedSpacings(tunnelSeedSpacings);
  }

  public double getCostTolerance() {
    return costTolerance;
  }

  public double getParameterTolerance() {
    return parameterTolerance;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public double getEdgeFraction() {
    return edgeFraction;
  }

  public double getTunnelSeedSpacings() {
    return tunnelSeedSpacings;
  }

  @Override
  public String toString() {
    return "SolverSettings{costTolerance=" + costTolerance
        + ", parameterTolerance=" + parameterTolerance
        + ", maxIterations=" + maxIterations
        + ", maxEvaluations=" + maxEvaluations
        + ", edgeFraction=" + edgeFraction
        + ", tunnelSeedSpacings=" + tunnelSeedSpacings + '}';
  }

  public static final class Builder {

    private double costTolerance = 1.0E-10;
    private double parameterTolerance = 1.0E-10;
    private int maxIterations = 1000;
    private int maxEvaluations = 5000;
    private double edgeFraction = 0.1;
    private double tunnelSeedSpacings = 3.0;

    private Builder() {
    }

    public Builder costTolerance(double costTolerance) {
      this.costTolerance = costTolerance;
      return this;
    }

    public Builder parameterTolerance(double parameterTolerance) {
      this.parameterTolerance = parameterTolerance;
      return this;
    }

    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder maxEvaluations(int maxEvaluations) {
      this.maxEvaluations = maxEvaluations;
      return this;
    }

    public Builder edgeFraction(double edgeFraction) {
      this.edgeFraction = edgeFraction;
      return this;
    }

    public Builder tunnelSeedSpacings(double tunnelSeedSpacings) {
      this.tunnelSeedSpacings = tunnelSeedSpacings;
      return this;
    }

    /**
     * Build the settings object
     * @return settings with the values given to this builder
     * @throws IllegalArgumentException if a tolerance or spacing multiple is not positive, or a
     * cap is below one
     */
    public SolverSettings build() {
      if (!(costTolerance > 0.) || !(parameterTolerance > 0.)) {
        throw new IllegalArgumentException("Solver tolerances must be positive");
      }
      if (maxIterations < 1 || maxEvaluations < 1) {
        throw new IllegalArgumentException("Solver caps must be at least 1");
      }
      if (!(tunnelSeedSpacings > 0.)) {
        throw new IllegalArgumentException("Tunnel coupling seed must span a positive spacing");
      }
      if (!(edgeFraction > 0.) || edgeFraction >= 0.5) {
        throw new IllegalArgumentException("Edge fraction must be in (0, 0.5)");
      }
      return new SolverSettings(this);
    }
  }
}
