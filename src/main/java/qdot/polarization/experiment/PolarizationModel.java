package qdot.polarization.experiment;

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import qdot.polarization.input.NonPositiveTemperatureException;
import qdot.polarization.output.PolarizationParameters;

/**
 * Two-slope model of a polarization line across an inter-dot charge transition.
 *
 * With e = detuning - center offset and Om = sqrt(e^2 + 4 t^2) for tunnel coupling t, the excess
 * charge occupation of a two-level system at thermal energy kT is
 * <pre>
 *   f(e) = (1 + (e / Om) * tanh(Om / (2 kT))) / 2
 * </pre>
 * which goes from 0 at large negative detuning to 1 at large positive detuning. The sensor signal
 * is modeled as
 * <pre>
 *   background + e * (leftSlope + (rightSlope - leftSlope) * f(e)) + height * f(e)
 * </pre>
 * so the background slope is blended by the same occupation, keeping the curve and its
 * derivative continuous through the transition (see DiCarlo et al., PRL 92, 226801 (2004)).
 *
 * All methods are static, side-effect free and leave their input arrays untouched.
 */
public class PolarizationModel {

  private PolarizationModel() {
  }

  /**
   * Evaluate the model at each detuning value
   *
   * @param detuning Detuning values (micro-eV)
   * @param parameters Model parameters
   * @param kT Thermal energy (micro-eV), strictly positive
   * @return Predicted sensor signal, one value per detuning value
   * @throws NonPositiveTemperatureException if kT is not positive
   */
  public static double[] evaluate(double[] detuning, PolarizationParameters parameters,
      double kT) {
    return evaluate(detuning, parameters.toArray(), kT);
  }

  /**
   * Evaluate the model at each detuning value, taking parameters in solver order
   * (see {@link PolarizationParameters})
   *
   * @param detuning Detuning values (micro-eV)
   * @param params Array of the six model parameters
   * @param kT Thermal energy (micro-eV), strictly positive
   * @return Predicted sensor signal, one value per detuning value
   */
  public static double[] evaluate(double[] detuning, double[] params, double kT) {
    NonPositiveTemperatureException.requirePositive(kT);
    double t = params[PolarizationParameters.TUNNEL_COUPLING];
    double center = params[PolarizationParameters.CENTER_OFFSET];
    double background = params[PolarizationParameters.BACKGROUND_OFFSET];
    double leftSlope = params[PolarizationParameters.LEFT_SLOPE];
    double rightSlope = params[PolarizationParameters.RIGHT_SLOPE];
    double height = params[PolarizationParameters.HEIGHT];

    double[] signal = new double[detuning.length];
    for (int i = 0; i < detuning.length; ++i) {
      double e = detuning[i] - center;
      double f = occupation(e, t, kT);
      signal[i] = background + e * (leftSlope + (rightSlope - leftSlope) * f) + height * f;
    }
    return signal;
  }

  /**
   * Excess charge occupation f(e) of the transition, between 0 and 1
   *
   * @param e Detuning relative to the center of the transition (micro-eV)
   * @param t Tunnel coupling (micro-eV); only its magnitude matters
   * @param kT Thermal energy (micro-eV)
   * @return occupation, 0.5 exactly at the center
   */
  public static double occupation(double e, double t, double kT) {
    double omega = Math.hypot(e, 2 * t);
    if (omega == 0.) {
      return 0.5;
    }
    return 0.5 * (1 + (e / omega) * Math.tanh(omega / (2 * kT)));
  }

  /**
   * Compute model values and the analytic derivatives of each value with respect to each
   * parameter
   *
   * @param detuning Detuning values (micro-eV)
   * @param params Array of the six model parameters
   * @param kT Thermal energy (micro-eV)
   * @return Pair of model value vector and Jacobian matrix (one row per detuning value, one
   * column per parameter in solver order)
   */
  public static Pair<RealVector, RealMatrix> jacobian(double[] detuning, double[] params,
      double kT) {
    NonPositiveTemperatureException.requirePositive(kT);
    double t = params[PolarizationParameters.TUNNEL_COUPLING];
    double center = params[PolarizationParameters.CENTER_OFFSET];
    double background = params[PolarizationParameters.BACKGROUND_OFFSET];
    double leftSlope = params[PolarizationParameters.LEFT_SLOPE];
    double rightSlope = params[PolarizationParameters.RIGHT_SLOPE];
    double height = params[PolarizationParameters.HEIGHT];
    double slopeChange = rightSlope - leftSlope;

    double[] values = new double[detuning.length];
    double[][] jacobian = new double[detuning.length][PolarizationParameters.COUNT];

    for (int i = 0; i < detuning.length; ++i) {
      double e = detuning[i] - center;
      double omega = Math.hypot(e, 2 * t);

      double f, dfde, dfdt;
      if (omega == 0.) {
        // zero-coupling limit at the center: f = (1 + tanh(e / 2kT)) / 2
        f = 0.5;
        dfde = 1. / (4 * kT);
        dfdt = 0.;
      } else {
        double tanh = Math.tanh(omega / (2 * kT));
        double ratio = e / omega;
        f = 0.5 * (1 + ratio * tanh);
        // derivative of (e / Om) * tanh(Om / 2kT) with respect to Om, e held fixed
        double dgdOmega = -ratio / omega * tanh + ratio * (1 - tanh * tanh) / (2 * kT);
        dfde = 0.5 * (tanh / omega + dgdOmega * ratio);
        dfdt = 0.5 * dgdOmega * 4 * t / omega;
      }

      // sensitivity of the signal to a change in occupation
      double dSdf = e * slopeChange + height;

      values[i] = background + e * (leftSlope + slopeChange * f) + height * f;
      jacobian[i][PolarizationParameters.TUNNEL_COUPLING] = dSdf * dfdt;
      jacobian[i][PolarizationParameters.CENTER_OFFSET] =
          -(leftSlope + slopeChange * f) - dSdf * dfde;
      jacobian[i][PolarizationParameters.BACKGROUND_OFFSET] = 1.;
      jacobian[i][PolarizationParameters.LEFT_SLOPE] = e * (1 - f);
      jacobian[i][PolarizationParameters.RIGHT_SLOPE] = e * f;
      jacobian[i][PolarizationParameters.HEIGHT] = f;
    }

    RealVector valueVector = MatrixUtils.createRealVector(values);
    RealMatrix jacobianMatrix = MatrixUtils.createRealMatrix(jacobian);
    return new Pair<>(valueVector, jacobianMatrix);
  }

  /**
   * Get the model over a fixed set of detuning values as a function of the parameter vector,
   * in the form taken by the least-squares solver
   *
   * @param detuning Detuning values (micro-eV); copied
   * @param kT Thermal energy (micro-eV)
   * @return function from a parameter vector to model values and Jacobian
   */
  public static MultivariateJacobianFunction asJacobianFunction(double[] detuning, double kT) {
    NonPositiveTemperatureException.requirePositive(kT);
    final double[] detuningSet = detuning.clone();
    return point -> jacobian(detuningSet, point.toArray(), kT);
  }

}
