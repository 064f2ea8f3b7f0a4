package exm.r1c.pass;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.r1c.ast.AST.Program;
import exm.r1c.common.Logging;
import exm.r1c.common.exceptions.InvalidSyntaxException;
import exm.r1c.common.exceptions.R1RuntimeError;
import exm.r1c.frontend.Parser;
import exm.r1c.ir.IRTree.Atom;
import exm.r1c.ir.IRTree.IRProgram;
import exm.r1c.ir.IRTree.SimpleExpr.Opcode;
import exm.r1c.ir.IRTree.Statement;

public class FlattenerTest {

  private static final Logger logger = Logging.getR1CLogger();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static IRProgram flatten(String src) throws InvalidSyntaxException {
    return Flattener.flatten(logger, Parser.parse(src));
  }

  private static List<String> statementStrings(IRProgram prog) {
    List<String> result = new ArrayList<String>();
    for (Statement s: prog) {
      result.add(s.toString());
    }
    return result;
  }

  @Test
  public void testAtomsNeedNoStatements() throws InvalidSyntaxException {
    IRProgram prog = flatten("5");
    assertEquals(0, prog.statements().size());
    assertEquals("5", prog.tail().toString());

    prog = flatten("(read)");
    assertEquals(0, prog.statements().size());
    assertEquals(Opcode.READ, prog.tail().op);
  }

  @Test
  public void testNestedOperandsGetTemporaries()
      throws InvalidSyntaxException {
    IRProgram prog = flatten("(+ (read) (- (+ 5 3)))");
    List<String> expected = new ArrayList<String>();
    expected.add("tmp:1 := (read)");
    expected.add("tmp:2 := (+ 5 3)");
    expected.add("tmp:3 := (- tmp:2)");
    assertEquals(expected, statementStrings(prog));
    assertEquals("(+ tmp:1 tmp:3)", prog.tail().toString());
  }

  @Test
  public void testUniquifiedShadowing() throws InvalidSyntaxException {
    Program p = Parser.parse("(let ([x 32]) (+ (let ([x 10]) x) x))");
    new Uniquifier().apply(logger, p);
    IRProgram prog = Flattener.flatten(logger, p);

    List<String> stmts = statementStrings(prog);
    assertEquals(2, stmts.size());
    assertEquals("Outer binding assigned first", "x1 := 32", stmts.get(0));
    assertEquals("x2 := 10", stmts.get(1));
    assertEquals("(+ x2 x1)", prog.tail().toString());
  }

  @Test
  public void testTailOnlyUsesDefinedNames() throws InvalidSyntaxException {
    Program p = Parser.parse(
        "(let ([a (read)]) (+ (let ([b (- a)]) (+ b (read))) (- a)))");
    new Uniquifier(true).apply(logger, p);
    IRProgram prog = Flattener.flatten(logger, p);

    Set<String> defined = new HashSet<String>();
    for (Statement s: prog) {
      for (Atom a: s.expr.args()) {
        if (a.isVar()) {
          assertTrue(a + " used before definition", defined.contains(a.getVar()));
        }
      }
      defined.add(s.target);
    }
    for (Atom a: prog.tail().args()) {
      if (a.isVar()) {
        assertTrue(a + " used before definition", defined.contains(a.getVar()));
      }
    }
  }

  @Test
  public void testLetBoundExprBeforeBody() throws InvalidSyntaxException {
    IRProgram prog = flatten("(let ([a (+ (read) 1)]) (- a))");
    List<String> expected = new ArrayList<String>();
    expected.add("tmp:1 := (read)");
    expected.add("a := (+ tmp:1 1)");
    assertEquals(expected, statementStrings(prog));
    assertEquals("(- a)", prog.tail().toString());
  }

  @Test
  public void testUnassignedVariable() throws InvalidSyntaxException {
    exception.expect(R1RuntimeError.class);
    exception.expectMessage("before any assignment");
    flatten("(+ 1 x)");
  }

  @Test
  public void testDuplicateBinding() throws InvalidSyntaxException {
    exception.expect(R1RuntimeError.class);
    flatten("(+ (let ([x 1]) x) (let ([x 2]) x))");
  }

  @Test
  public void testToString() throws InvalidSyntaxException {
    assertEquals("tmp:1 := (- 3)\nreturn (+ tmp:1 4)\n",
                 flatten("(+ (- 3) 4)").toString());
  }
}
