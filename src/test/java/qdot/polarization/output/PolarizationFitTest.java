package qdot.polarization.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;
import qdot.polarization.experiment.PolarizationExperiment;
import qdot.polarization.test.TestUtils;

public class PolarizationFitTest {

  @Test
  public void plotterReceivesFitData() {
    double[] detuning = TestUtils.referenceDetuning();
    double[] signal = TestUtils.referenceSignal();
    PolarizationFit fit =
        PolarizationExperiment.fitPolAll(detuning, signal, TestUtils.REFERENCE_KT);

    final Object[] received = new Object[4];
    PolarizationPlotter plotter = (x, y, result, figureId) -> {
      received[0] = x;
      received[1] = y;
      received[2] = result;
      received[3] = figureId;
    };
    fit.plot(plotter, 7);

    assertArrayEquals(detuning, (double[]) received[0], 0.);
    assertArrayEquals(signal, (double[]) received[1], 0.);
    assertSame(fit.getResult(), received[2]);
    assertEquals(Integer.valueOf(7), received[3]);
  }

}
