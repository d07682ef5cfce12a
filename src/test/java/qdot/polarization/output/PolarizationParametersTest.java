package qdot.polarization.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import qdot.polarization.input.InvalidInputException;

public class PolarizationParametersTest {

  private static final double[] VALUES = {20., 2., 100., -0.5, -0.4, 300.};

  @Test
  public void arrayOrderMatchesIndexConstants() {
    PolarizationParameters params = PolarizationParameters.fromArray(VALUES);
    assertEquals(20., params.getTunnelCoupling(), 0.);
    assertEquals(2., params.getCenterOffset(), 0.);
    assertEquals(100., params.getBackgroundOffset(), 0.);
    assertEquals(-0.5, params.getLeftSlope(), 0.);
    assertEquals(-0.4, params.getRightSlope(), 0.);
    assertEquals(300., params.getHeight(), 0.);
    assertArrayEquals(VALUES, params.toArray(), 0.);
    assertEquals(PolarizationParameters.COUNT, PolarizationParameters.NAMES.length);
    assertEquals("Height", PolarizationParameters.NAMES[PolarizationParameters.HEIGHT]);
  }

  @Test
  public void negativeCouplingIsReflected() {
    PolarizationParameters params = PolarizationParameters.fromArray(VALUES);
    assertSame(params, params.withNonNegativeCoupling());

    PolarizationParameters negative = params.withTunnelCoupling(-20.);
    assertEquals(params, negative.withNonNegativeCoupling());
    assertNotEquals(params, negative);
  }

  @Test
  public void finiteCheckCoversEveryParameter() {
    assertTrue(PolarizationParameters.fromArray(VALUES).isFinite());
    for (int i = 0; i < VALUES.length; ++i) {
      double[] bad = VALUES.clone();
      bad[i] = Double.NaN;
      assertFalse(PolarizationParameters.fromArray(bad).isFinite());
    }
  }

  @Test(expected = InvalidInputException.class)
  public void wrongLengthIsRejected() {
    PolarizationParameters.fromArray(new double[]{1., 2., 3., 4., 5.});
  }

  @Test(expected = InvalidInputException.class)
  public void nullArrayIsRejected() {
    PolarizationParameters.fromArray(null);
  }

}
