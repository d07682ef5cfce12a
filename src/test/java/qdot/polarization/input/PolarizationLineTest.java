package qdot.polarization.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PolarizationLineTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static final double[] X = {-3., -2., -1., 0., 1., 2., 3.};
  private static final double[] Y = {1., 1., 1.5, 2., 2.5, 3., 3.};

  private File writeLines(String... lines) throws IOException {
    File file = folder.newFile("line.csv");
    Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  @Test
  public void constructorCopiesData() {
    double[] x = X.clone();
    double[] y = Y.clone();
    PolarizationLine line = new PolarizationLine(x, y);
    x[0] = 100.;
    y[0] = 100.;
    assertArrayEquals(X, line.getDetuning(), 0.);
    assertArrayEquals(Y, line.getSignal(), 0.);
    assertEquals(7, line.size());

    line.getDetuning()[1] = 50.;
    assertEquals(-2., line.getDetuning()[1], 0.);
  }

  @Test
  public void lengthMismatchNamesBothLengths() {
    try {
      new PolarizationLine(X, Arrays.copyOf(Y, 6));
      fail();
    } catch (InvalidInputException e) {
      assertTrue(e.getMessage().contains("7"));
      assertTrue(e.getMessage().contains("6"));
    }
  }

  @Test(expected = InvalidInputException.class)
  public void nullSeriesIsRejected() {
    PolarizationLine.validate(null, Y);
  }

  @Test(expected = InvalidInputException.class)
  public void emptySeriesIsRejected() {
    PolarizationLine.validate(new double[0], new double[0]);
  }

  @Test(expected = InvalidInputException.class)
  public void fiveSamplesAreTooFew() {
    PolarizationLine.validate(Arrays.copyOf(X, 5), Arrays.copyOf(Y, 5));
  }

  @Test
  public void sixSamplesAreEnough() {
    PolarizationLine.validate(Arrays.copyOf(X, 6), Arrays.copyOf(Y, 6));
  }

  @Test(expected = InvalidInputException.class)
  public void infiniteDetuningIsRejected() {
    double[] x = X.clone();
    x[3] = Double.POSITIVE_INFINITY;
    PolarizationLine.validate(x, Y);
  }

  @Test(expected = InvalidInputException.class)
  public void nanSignalIsRejected() {
    double[] y = Y.clone();
    y[6] = Double.NaN;
    PolarizationLine.validate(X, y);
  }

  @Test
  public void fileWithHeaderAndCommentsIsRead() throws IOException {
    File file = writeLines(
        "detuning, signal",
        "# scan 12",
        "-3, 1",
        "-2,1",
        "",
        "-1 1.5",
        "0\t2",
        "1, 2.5",
        "2, 3",
        "3, 3");
    PolarizationLine line = PolarizationLine.fromFile(file.getAbsolutePath());
    assertArrayEquals(X, line.getDetuning(), 0.);
    assertArrayEquals(Y, line.getSignal(), 0.);
    assertEquals("line.csv", line.getName());
  }

  @Test
  public void fileWithoutHeaderIsRead() throws IOException {
    String[] lines = new String[X.length];
    for (int i = 0; i < X.length; ++i) {
      lines[i] = X[i] + "," + Y[i];
    }
    PolarizationLine line = PolarizationLine.fromFile(writeLines(lines).getAbsolutePath());
    assertArrayEquals(Y, line.getSignal(), 0.);
  }

  @Test(expected = InvalidInputException.class)
  public void malformedDataLineIsRejected() throws IOException {
    File file = writeLines("-3, 1", "-2, 1", "-1, one", "0, 2", "1, 2.5", "2, 3", "3, 3");
    PolarizationLine.fromFile(file.getAbsolutePath());
  }

  @Test(expected = InvalidInputException.class)
  public void fileWithTooFewSamplesIsRejected() throws IOException {
    File file = writeLines("x, y", "0, 1", "1, 2");
    PolarizationLine.fromFile(file.getAbsolutePath());
  }

  @Test(expected = IOException.class)
  public void missingFileThrows() throws IOException {
    PolarizationLine.fromFile(new File(folder.getRoot(), "absent.csv").getAbsolutePath());
  }

}
