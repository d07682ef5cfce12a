package qdot.polarization.experiment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import qdot.polarization.output.PolarizationParameters;
import qdot.polarization.test.TestUtils;

public class PolarizationSolverTest {

  @Test
  public void solverConvergesFromNearbySeed() {
    double[] detuning = TestUtils.referenceDetuning();
    double[] signal = TestUtils.referenceSignal();
    PolarizationParameters seed = new PolarizationParameters(15., 0., 110., -0.4, -0.3, 280.);

    PolarizationSolver.Solution solution =
        new PolarizationSolver().solve(detuning, signal, TestUtils.REFERENCE_KT, seed);

    assertTrue(solution.isConverged());
    assertEquals(20., Math.abs(solution.getParameters().getTunnelCoupling()), 0.01);
    assertEquals(2., solution.getParameters().getCenterOffset(), 0.01);
    assertEquals(0., solution.getRms(), 1E-6);
  }

  @Test
  public void solverCorrectsRoughEstimatedSeed() {
    double[] detuning = TestUtils.referenceDetuning();
    double[] signal = TestUtils.referenceSignal();
    PolarizationParameters seed = new InitialGuessEstimator().estimate(detuning, signal);

    PolarizationSolver.Solution solution =
        new PolarizationSolver().solve(detuning, signal, TestUtils.REFERENCE_KT, seed);

    assertTrue(solution.isConverged());
    PolarizationParameters fitted = solution.getParameters();
    assertEquals(20., Math.abs(fitted.getTunnelCoupling()), 0.01);
    assertEquals(-0.5, fitted.getLeftSlope(), 1E-4);
    assertEquals(-0.4, fitted.getRightSlope(), 1E-4);
    assertEquals(300., fitted.getHeight(), 0.01);
  }

  @Test
  public void iterationCapGivesBestEffort() {
    double[] detuning = TestUtils.referenceDetuning();
    double[] signal = TestUtils.referenceSignal();
    PolarizationParameters seed = new PolarizationParameters(3., -10., 150., 0., 0., 100.);
    double seedRms = Math.sqrt(sumOfSquares(signal,
        PolarizationModel.evaluate(detuning, seed, TestUtils.REFERENCE_KT)) / signal.length);

    SolverSettings capped = SolverSettings.builder().maxIterations(1).build();
    PolarizationSolver.Solution solution =
        new PolarizationSolver(capped).solve(detuning, signal, TestUtils.REFERENCE_KT, seed);

    assertFalse(solution.isConverged());
    assertEquals(1, solution.getIterations());
    assertTrue(solution.getParameters().isFinite());
    assertTrue(solution.getRms() <= seedRms);
  }

  @Test
  public void evaluationCapGivesBestEffort() {
    double[] detuning = TestUtils.referenceDetuning();
    double[] signal = TestUtils.referenceSignal();
    PolarizationParameters seed = new PolarizationParameters(3., -10., 150., 0., 0., 100.);

    SolverSettings capped = SolverSettings.builder().maxEvaluations(3).build();
    PolarizationSolver.Solution solution =
        new PolarizationSolver(capped).solve(detuning, signal, TestUtils.REFERENCE_KT, seed);

    assertFalse(solution.isConverged());
    assertTrue(solution.getEvaluations() <= 3);
  }

  @Test
  public void repeatedSolvesAreIdentical() {
    double[] detuning = TestUtils.referenceDetuning();
    double[] signal = TestUtils.addNoise(TestUtils.referenceSignal(), 1., 5);
    PolarizationParameters seed = new InitialGuessEstimator().estimate(detuning, signal);
    PolarizationSolver solver = new PolarizationSolver();

    PolarizationSolver.Solution first = solver.solve(detuning, signal, 6.46, seed);
    PolarizationSolver.Solution second = solver.solve(detuning, signal, 6.46, seed);
    assertArrayEquals(first.getPoint(), second.getPoint(), 0.);
    assertEquals(first.getRms(), second.getRms(), 0.);
  }

  private static double sumOfSquares(double[] a, double[] b) {
    double sum = 0.;
    for (int i = 0; i < a.length; ++i) {
      sum += (a[i] - b[i]) * (a[i] - b[i]);
    }
    return sum;
  }

}
