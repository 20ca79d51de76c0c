package org.folprover.base.test;

import static org.folprover.base.test.FormulaBuilder.and;
import static org.folprover.base.test.FormulaBuilder.con;
import static org.folprover.base.test.FormulaBuilder.exists;
import static org.folprover.base.test.FormulaBuilder.fn;
import static org.folprover.base.test.FormulaBuilder.forAll;
import static org.folprover.base.test.FormulaBuilder.formulas;
import static org.folprover.base.test.FormulaBuilder.not;
import static org.folprover.base.test.FormulaBuilder.pred;
import static org.folprover.base.test.FormulaBuilder.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;
import org.folprover.base.validator.StaticValidator;
import org.junit.Test;

public class StaticValidatorTests
{
  private final FolVariable x = var("x");
  private final FolVariable y = var("y");

  private static InvalidFormulaException expectInvalid(List<FolFormula> xiFormulas)
  {
    try
    {
      StaticValidator.validateFormulas(xiFormulas);
    }
    catch (InvalidFormulaException lEx)
    {
      return lEx;
    }
    fail("Expected " + xiFormulas + " to be rejected");
    return null;
  }

  @Test
  public void testValidFormulas() throws Exception
  {
    StaticValidator.validateFormulas(formulas(forAll(x, exists(y, pred("P", x, fn("f", y)))),
                                              not(pred("P", con("a"), con("b")))));
  }

  @Test
  public void testSiblingQuantifiersMayReuseVariable() throws Exception
  {
    StaticValidator.validateFormulas(formulas(and(forAll(x, pred("P", x)), exists(x, pred("Q", x)))));
  }

  @Test
  public void testNameMayBePredicateAndFunction() throws Exception
  {
    StaticValidator.validateFormulas(formulas(pred("f", fn("f", con("a")))));
  }

  @Test
  public void testRebinding()
  {
    FolFormula lFormula = forAll(x, and(pred("P", x), exists(x, pred("Q", x))));
    InvalidFormulaException lEx = expectInvalid(formulas(lFormula));
    assertEquals(lFormula, lEx.getFormula());
  }

  @Test
  public void testPredicateArityMismatch()
  {
    expectInvalid(formulas(pred("P", con("a")), pred("P", con("a"), con("b"))));
  }

  @Test
  public void testFunctionArityMismatch()
  {
    expectInvalid(formulas(pred("P", fn("f", con("a"))), pred("Q", fn("f", con("a"), con("b")))));
  }

  @Test
  public void testConstantUsedAsFunction()
  {
    expectInvalid(formulas(and(pred("P", con("f")), pred("P", fn("f", con("a"))))));
  }

  @Test
  public void testMissingParts()
  {
    InvalidFormulaException lEx = expectInvalid(formulas(pred("P", con("a")), null));
    assertNull(lEx.getFormula());

    lEx = expectInvalid(formulas(and(pred("P", con("a")), null)));
    assertTrue(lEx.getMessage().startsWith("Missing"));

    expectInvalid(formulas(pred("P", con("a"), null)));
  }
}
