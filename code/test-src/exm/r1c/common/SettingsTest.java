package exm.r1c.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.r1c.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    System.clearProperty(Settings.PARTIAL_EVAL_FOLD_LET);
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertTrue(Settings.getBoolean(Settings.OPT_PARTIAL_EVAL));
    assertFalse(Settings.getBoolean(Settings.PARTIAL_EVAL_FOLD_LET));
    assertFalse(Settings.getBoolean(Settings.UNIQUIFY_RENAME_BOUND_EXPR));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    Settings.validateProperties();
  }

  @Test
  public void testKeysSorted() {
    List<String> keys = Settings.getKeys();
    assertTrue(keys.contains(Settings.LOG_TRACE));
    for (int i = 1; i < keys.size(); i++) {
      assertTrue(keys.get(i - 1).compareTo(keys.get(i)) < 0);
    }
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.PARTIAL_EVAL_FOLD_LET, "TRUE");
    Settings.initR1CProperties();
    assertTrue(Settings.getBoolean(Settings.PARTIAL_EVAL_FOLD_LET));
  }

  @Test
  public void testInvalidBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "yes");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.LOG_TRACE);
    Settings.validateProperties();
  }

  @Test
  public void testMissingKey() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean("r1c.no-such-setting");
  }
}
