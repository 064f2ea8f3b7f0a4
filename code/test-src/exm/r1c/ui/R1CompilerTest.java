package exm.r1c.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.r1c.common.Logging;
import exm.r1c.common.Settings;
import exm.r1c.common.exceptions.InvalidSyntaxException;
import exm.r1c.common.exceptions.R1Fatal;
import exm.r1c.common.exceptions.UserException;
import exm.r1c.ir.IRTree.IRProgram;

public class R1CompilerTest {

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("target/R1CompilerTest.r1c.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testEndToEnd() throws UserException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true);
    IRProgram prog = new R1Compiler(logger).compile(
                "(let ([x 32]) (+ (let ([x 10]) x) x))", out);
    out.flush();

    assertEquals("x1 := 32\nx2 := 10\nreturn (+ x2 x1)\n", prog.toString());

    String printed = bytes.toString();
    assertTrue(printed, printed.contains(
        "# input\n(program (let ([x 32]) (+ (let ([x 10]) x) x)))"));
    assertTrue("Partial eval leaves this program unchanged", printed.contains(
        "# after Partial evaluation\n"
        + "(program (let ([x 32]) (+ (let ([x 10]) x) x)))"));
    assertTrue(printed, printed.contains(
        "# after Uniquify variable names\n"
        + "(program (let ([x1 32]) (+ (let ([x2 10]) x2) x1)))"));
    assertTrue(printed, printed.contains("# after Flatten\nx1 := 32\n"));
  }

  @Test
  public void testFoldThenFlatten() throws UserException {
    IRProgram prog = new R1Compiler(logger).compile(
                  "(+ (read) (- (+ 5 3)))", null);
    assertEquals("tmp:1 := (read)\nreturn (+ tmp:1 -8)\n", prog.toString());
  }

  @Test
  public void testFoldLetSetting() throws UserException {
    String src = "(let ([x (+ 1 2)]) (+ x 4))";
    assertEquals("x1 := (+ 1 2)\nreturn (+ x1 4)\n",
        new R1Compiler(logger).compile(src, null).toString());

    Settings.set(Settings.PARTIAL_EVAL_FOLD_LET, "true");
    assertEquals("x1 := 3\nreturn (+ x1 4)\n",
        new R1Compiler(logger).compile(src, null).toString());
  }

  @Test
  public void testParseError() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    new R1Compiler(logger).compile("(+ 1", null);
  }

  @Test
  public void testParseErrorExitCode() {
    try {
      new R1Compiler(logger).compileOrFail("(+ 1", null);
      fail("Expected fatal error");
    } catch (R1Fatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
  }

  @Test
  public void testUnrenamedInitializerIsInternalError() {
    // Bound expressions are not uniquified by default, so x is unresolved
    try {
      new R1Compiler(logger).compileOrFail(
          "(let ([x 1]) (let ([y x]) y))", null);
      fail("Expected fatal error");
    } catch (R1Fatal e) {
      assertEquals(ExitCode.ERROR_INTERNAL.code(), e.exitCode);
    }
  }

  @Test
  public void testInitializerNameClashIsInternalError() {
    try {
      new R1Compiler(logger).compileOrFail(
          "(let ([x 1]) (let ([y x1]) y))", null);
      fail("Expected fatal error");
    } catch (R1Fatal e) {
      assertEquals(ExitCode.ERROR_INTERNAL.code(), e.exitCode);
    }
  }
}
