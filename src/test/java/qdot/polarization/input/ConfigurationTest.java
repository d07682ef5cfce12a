package qdot.polarization.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import qdot.polarization.experiment.SolverSettings;

public class ConfigurationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Before
  @After
  public void dropSharedInstance() {
    Configuration.resetInstance();
  }

  private static String testConfigPath() throws Exception {
    return new File(ConfigurationTest.class.getClassLoader()
        .getResource("test-config.xml").toURI()).getAbsolutePath();
  }

  @Test
  public void valuesAreReadFromFile() throws Exception {
    Configuration config = new Configuration(testConfigPath());
    assertEquals(1E-8, config.getCostTolerance(), 0.);
    assertEquals(1E-9, config.getParameterTolerance(), 0.);
    assertEquals(250, config.getMaxIterations());
    assertEquals(900, config.getMaxEvaluations());
    assertEquals(0.15, config.getEdgeFraction(), 0.);
    // not in the file
    assertEquals(SolverSettings.DEFAULT.getTunnelSeedSpacings(),
        config.getTunnelSeedSpacings(), 0.);
  }

  @Test
  public void settingsMatchFileValues() throws Exception {
    SolverSettings settings = new Configuration(testConfigPath()).getSolverSettings();
    assertEquals(1E-8, settings.getCostTolerance(), 0.);
    assertEquals(250, settings.getMaxIterations());
    assertEquals(900, settings.getMaxEvaluations());
    assertEquals(0.15, settings.getEdgeFraction(), 0.);
  }

  @Test
  public void missingFileGivesDefaults() {
    String path = new File(folder.getRoot(), "nothing-here.xml").getAbsolutePath();
    SolverSettings settings = new Configuration(path).getSolverSettings();
    assertEquals(SolverSettings.DEFAULT.toString(), settings.toString());
  }

  @Test
  public void savedValuesAreReadBack() throws Exception {
    File copy = folder.newFile("saved-config.xml");
    Files.copy(new File(testConfigPath()).toPath(), copy.toPath(),
        StandardCopyOption.REPLACE_EXISTING);

    Configuration config = new Configuration(copy.getAbsolutePath());
    config.setMaxIterations(42);
    config.setTunnelSeedSpacings(5.);
    config.saveCurrentConfig();

    Configuration reread = new Configuration(copy.getAbsolutePath());
    assertEquals(42, reread.getMaxIterations());
    assertEquals(5., reread.getTunnelSeedSpacings(), 0.);
    assertEquals(900, reread.getMaxEvaluations());
  }

  @Test
  public void malformedValueGivesDefaults() throws Exception {
    File file = folder.newFile("malformed-config.xml");
    Files.write(file.toPath(), Arrays.asList(
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
        "<Configuration>",
        "  <Solver>",
        "    <CostTolerance>1.0E-6</CostTolerance>",
        "    <MaxIterations>many</MaxIterations>",
        "  </Solver>",
        "</Configuration>"), StandardCharsets.UTF_8);

    Configuration config = new Configuration(file.getAbsolutePath());
    assertEquals(SolverSettings.DEFAULT.toString(), config.getSolverSettings().toString());
  }

  @Test
  public void missingFileIsCreatedFromEmbeddedDefault() throws Exception {
    File file = new File(folder.getRoot(), "polarization-config.xml");
    assertFalse(file.exists());

    Configuration config = Configuration.getInstance(file.getAbsolutePath());
    assertTrue(file.exists());
    SolverSettings settings = config.getSolverSettings();
    assertEquals(SolverSettings.DEFAULT.getCostTolerance(), settings.getCostTolerance(), 0.);
    assertEquals(SolverSettings.DEFAULT.getParameterTolerance(),
        settings.getParameterTolerance(), 0.);
    assertEquals(SolverSettings.DEFAULT.getMaxIterations(), settings.getMaxIterations());
    assertEquals(SolverSettings.DEFAULT.getMaxEvaluations(), settings.getMaxEvaluations());
    assertEquals(SolverSettings.DEFAULT.getEdgeFraction(), settings.getEdgeFraction(), 0.);
    assertEquals(SolverSettings.DEFAULT.getTunnelSeedSpacings(),
        settings.getTunnelSeedSpacings(), 0.);

    // later lookups share the instance, whatever path they name
    assertSame(config, Configuration.getInstance(testConfigPath()));
  }

  @Test
  public void existingFileIsNotOverwritten() throws Exception {
    File copy = new File(folder.getRoot(), "kept-config.xml");
    Files.copy(new File(testConfigPath()).toPath(), copy.toPath());

    Configuration config = Configuration.getInstance(copy.getAbsolutePath());
    assertEquals(250, config.getMaxIterations());
  }

}
