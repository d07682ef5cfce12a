package qdot.polarization.input;

/**
 * Thrown when the thermal energy kT handed to the model or the fit is zero, negative or not a
 * finite number; the thermal broadening term divides by kT.
 */
public class NonPositiveTemperatureException extends IllegalArgumentException {

  private static final long serialVersionUID = -6407781296334318135L;

  private final double thermalEnergy;

  public NonPositiveTemperatureException(double thermalEnergy) {
    super("Thermal energy kT must be strictly positive and finite, got " + thermalEnergy);
    this.thermalEnergy = thermalEnergy;
  }

  /**
   * Get the rejected value
   * @return kT value that caused this exception (micro-eV)
   */
  public double getThermalEnergy() {
    return thermalEnergy;
  }

  /**
   * Check the given thermal energy, throwing if it cannot be used by the transition model
   * @param kT thermal energy in micro-eV
   * @return the same value, for chaining into assignments
   */
  public static double requirePositive(double kT) {
    if (!(kT > 0.) || Double.isInfinite(kT)) {
      throw new NonPositiveTemperatureException(kT);
    }
    return kT;
  }
}
