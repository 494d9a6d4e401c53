package exm.skc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.skc.common.exceptions.InvalidOptionException;
import exm.skc.common.exceptions.SKCRuntimeError;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset();
    System.clearProperty(Settings.OMP_SCHEDULE);
  }

  private static InputStream props(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testDefaults() throws Exception {
    assertEquals("static", Settings.get(Settings.OMP_SCHEDULE));
    assertEquals(Arrays.asList("lat"),
                 Settings.getList(Settings.PARALLEL_LOOP_TYPES));
    assertTrue(Settings.getBoolean(Settings.VALIDATE_IR));
    assertEquals(0, Settings.getInt(Settings.BACKEND_INITIAL_DEPTH));
    assertTrue(Settings.getKeys().contains(Settings.GOCEAN_FIELD_TYPE));
  }

  @Test
  public void testMapping() throws Exception {
    Map<String, String> m = Settings.getMapping(
                                      Settings.NEMO_LOOP_TYPE_MAPPING);
    assertEquals(Arrays.asList("ji", "jj", "jk", "jt"),
                 Arrays.asList(m.keySet().toArray()));
    assertEquals("lat", m.get("jj"));

    Settings.set(Settings.NEMO_LOOP_TYPE_MAPPING, "JI : lon , jj");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Expected name:value pairs for " +
        Settings.NEMO_LOOP_TYPE_MAPPING + " but found 'jj'");
    Settings.getMapping(Settings.NEMO_LOOP_TYPE_MAPPING);
  }

  @Test
  public void testList() {
    Settings.set(Settings.PARALLEL_LOOP_TYPES, " lat, ,levels ,");
    assertEquals(Arrays.asList("lat", "levels"),
                 Settings.getList(Settings.PARALLEL_LOOP_TYPES));
  }

  @Test
  public void testSetAndReset() throws Exception {
    Settings.set(Settings.VALIDATE_IR, "False");
    assertFalse(Settings.getBoolean(Settings.VALIDATE_IR));
    Settings.reset();
    assertTrue(Settings.getBoolean(Settings.VALIDATE_IR));
  }

  @Test
  public void testLoad() throws Exception {
    Settings.load(props("skc.omp.schedule = dynamic\n" +
                        "skc.parallel.loop-types = lat,lon\n"));
    assertEquals("dynamic", Settings.get(Settings.OMP_SCHEDULE));
    assertEquals(Arrays.asList("lat", "lon"),
                 Settings.getList(Settings.PARALLEL_LOOP_TYPES));
  }

  @Test
  public void testLoadUnknownKey() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Unknown setting skc.omp.shedule");
    Settings.load(props("skc.omp.shedule = dynamic\n"));
  }

  @Test
  public void testLoadBadSchedule() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Expected property skc.omp.schedule to be one " +
                            "of: ");
    Settings.load(props("skc.omp.schedule = sometimes\n"));
  }

  @Test
  public void testBadValues() throws Exception {
    Settings.set(Settings.BACKEND_INITIAL_DEPTH, "two");
    try {
      Settings.getIntUnchecked(Settings.BACKEND_INITIAL_DEPTH);
    } catch (SKCRuntimeError e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith(
          "Invalid integral value for option " +
          Settings.BACKEND_INITIAL_DEPTH));
    }
    Settings.set(Settings.VALIDATE_IR, "yes");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("must be true or false, but was 'yes'");
    Settings.getBoolean(Settings.VALIDATE_IR);
  }

  @Test
  public void testSystemProperties() throws Exception {
    System.setProperty(Settings.OMP_SCHEDULE, "guided");
    Settings.initProperties();
    assertEquals("guided", Settings.get(Settings.OMP_SCHEDULE));
  }
}
