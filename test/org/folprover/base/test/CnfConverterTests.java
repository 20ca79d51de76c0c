package org.folprover.base.test;

import static org.folprover.base.test.FormulaBuilder.and;
import static org.folprover.base.test.FormulaBuilder.con;
import static org.folprover.base.test.FormulaBuilder.exists;
import static org.folprover.base.test.FormulaBuilder.forAll;
import static org.folprover.base.test.FormulaBuilder.formulas;
import static org.folprover.base.test.FormulaBuilder.iff;
import static org.folprover.base.test.FormulaBuilder.implies;
import static org.folprover.base.test.FormulaBuilder.neg;
import static org.folprover.base.test.FormulaBuilder.not;
import static org.folprover.base.test.FormulaBuilder.or;
import static org.folprover.base.test.FormulaBuilder.pos;
import static org.folprover.base.test.FormulaBuilder.pred;
import static org.folprover.base.test.FormulaBuilder.var;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolFunction;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolPool;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.fol.transforms.CnfConverter;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class CnfConverterTests extends Assert
{
  private final FolVariable x = var("x");
  private final FolVariable y = var("y");
  private final FolConstant a = con("a");
  private final FolConstant b = con("b");

  private CnfConverter mConverter;

  @Before
  public void setUp()
  {
    mConverter = new CnfConverter(new ScopeCounter());
  }

  private List<List<FolLiteral>> convert(FolFormula... xiFormulas) throws InvalidFormulaException
  {
    return mConverter.toClauses(formulas(xiFormulas));
  }

  private static Set<Set<FolLiteral>> asSets(List<List<FolLiteral>> xiClauses)
  {
    Set<Set<FolLiteral>> lSets = new HashSet<>();
    for (List<FolLiteral> lClause : xiClauses)
    {
      lSets.add(new HashSet<>(lClause));
    }
    return lSets;
  }

  private static Set<FolLiteral> literals(FolLiteral... xiLiterals)
  {
    return new HashSet<>(Arrays.asList(xiLiterals));
  }

  @Test
  public void testAtomIsUnitClause() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(pred("P", a));
    assertEquals(1, lClauses.size());
    assertEquals(Arrays.asList(pos("P", a)), lClauses.get(0));
  }

  @Test
  public void testNegatedAtom() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(not(pred("P", a)));
    assertEquals(1, lClauses.size());
    assertEquals(Arrays.asList(neg("P", a)), lClauses.get(0));
    assertFalse(lClauses.get(0).get(0).isPositive());
  }

  @Test
  public void testDuplicateLiteralsCollapse() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(or(pred("P", a), pred("P", a)));
    assertEquals(1, lClauses.size());
    assertEquals(1, lClauses.get(0).size());
  }

  @Test
  public void testConjunctionSplitsIntoClauses() throws Exception
  {
    FolFormula lDisjunction = FolPool.getOr(Arrays.asList(pred("P", a), not(pred("Q", a)), pred("R", b)));
    FolFormula lConjunction = FolPool.getAnd(Arrays.asList(pred("S", a), lDisjunction, pred("T", b)));
    List<List<FolLiteral>> lClauses = convert(lConjunction);

    assertEquals(3, lClauses.size());
    assertEquals(Arrays.asList(pos("S", a)), lClauses.get(0));
    assertEquals(literals(pos("P", a), neg("Q", a), pos("R", b)), new HashSet<>(lClauses.get(1)));
    assertEquals(Arrays.asList(pos("T", b)), lClauses.get(2));
  }

  @Test
  public void testImplication() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(implies(pred("P", a), pred("Q", b)));
    assertEquals(1, lClauses.size());
    assertEquals(literals(neg("P", a), pos("Q", b)), new HashSet<>(lClauses.get(0)));
  }

  @Test
  public void testBiconditional() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(iff(pred("P", a), pred("Q", a)));

    Set<Set<FolLiteral>> lExpected = new HashSet<>();
    lExpected.add(literals(neg("P", a), pos("Q", a)));
    lExpected.add(literals(neg("Q", a), pos("P", a)));
    assertEquals(lExpected, asSets(lClauses));
  }

  @Test
  public void testDistribution() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(or(pred("P", a), and(pred("Q", a), pred("R", a))));

    Set<Set<FolLiteral>> lExpected = new HashSet<>();
    lExpected.add(literals(pos("P", a), pos("Q", a)));
    lExpected.add(literals(pos("P", a), pos("R", a)));
    assertEquals(lExpected, asSets(lClauses));
  }

  @Test
  public void testNegationPushedThroughQuantifiers() throws Exception
  {
    // ~forall x. (P(x) & Q(x))  is  exists x. (~P(x) | ~Q(x)).
    List<List<FolLiteral>> lClauses = convert(not(forAll(x, and(pred("P", x), pred("Q", x)))));
    assertEquals(1, lClauses.size());
    assertEquals(2, lClauses.get(0).size());
    for (FolLiteral lLiteral : lClauses.get(0))
    {
      assertFalse(lLiteral.isPositive());
      assertTrue(lLiteral.isGround());
    }
  }

  @Test
  public void testSkolemConstant() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(exists(x, pred("P", x)));
    assertEquals(1, lClauses.size());

    FolTerm lTerm = lClauses.get(0).get(0).getAtom().get(0);
    assertTrue(lTerm instanceof FolConstant);
    assertEquals("sk1", ((FolConstant)lTerm).getName());
  }

  @Test
  public void testSkolemFunctionOfEnclosingUniversals() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(forAll(x, exists(y, pred("P", x, y))));
    assertEquals(1, lClauses.size());

    FolLiteral lLiteral = lClauses.get(0).get(0);
    FolTerm lFirst = lLiteral.getAtom().get(0);
    FolTerm lSecond = lLiteral.getAtom().get(1);
    assertTrue(lFirst instanceof FolVariable);
    assertTrue(lSecond instanceof FolFunction);

    FolFunction lSkolem = (FolFunction)lSecond;
    assertEquals("sk1", lSkolem.getName());
    assertEquals(1, lSkolem.arity());
    assertEquals(lFirst, lSkolem.get(0));
  }

  @Test
  public void testSkolemNamesAvoidSignature() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(pred("Q", con("sk1")), exists(x, pred("P", x)));
    assertEquals(2, lClauses.size());

    FolTerm lTerm = lClauses.get(1).get(0).getAtom().get(0);
    assertEquals(con("sk2"), lTerm);
  }

  @Test
  public void testSkolemNamesDistinctAcrossFormulas() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(exists(x, pred("P", x)), exists(x, pred("Q", x)));
    assertNotEquals(lClauses.get(0).get(0).getAtom().get(0), lClauses.get(1).get(0).getAtom().get(0));
  }

  @Test
  public void testVariablesStandardizedApart() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(forAll(x, pred("P", x)), forAll(x, pred("Q", x)));
    assertEquals(2, lClauses.size());

    FolVariable lFirst = (FolVariable)lClauses.get(0).get(0).getAtom().get(0);
    FolVariable lSecond = (FolVariable)lClauses.get(1).get(0).getAtom().get(0);
    assertEquals("x", lFirst.getName());
    assertNotEquals(lFirst, lSecond);
    assertTrue(lFirst.getScopeId() > 0);
  }

  @Test
  public void testFreeVariablesUniversallyClosed() throws Exception
  {
    List<List<FolLiteral>> lClauses = convert(pred("P", x));
    assertEquals(1, lClauses.size());
    assertTrue(lClauses.get(0).get(0).getAtom().get(0) instanceof FolVariable);
  }

  @Test
  public void testQueryClosedThenNegated() throws Exception
  {
    // The query P(x) means forall x. P(x), so its negation gets a Skolem constant.
    List<List<FolLiteral>> lClauses = mConverter.toClauses(new ArrayList<FolFormula>(), pred("P", x));
    assertEquals(1, lClauses.size());

    FolLiteral lLiteral = lClauses.get(0).get(0);
    assertFalse(lLiteral.isPositive());
    assertTrue(lLiteral.isGround());
  }

  @Test
  public void testQueryMayReuseBoundVariableName() throws Exception
  {
    // x is free in the first conjunct and bound in the second.
    List<List<FolLiteral>> lClauses =
      mConverter.toClauses(formulas(forAll(x, pred("P", x)), forAll(x, pred("Q", x))),
                           and(pred("P", x), forAll(x, pred("Q", x))));

    assertEquals(3, lClauses.size());
    List<FolLiteral> lQueryClause = lClauses.get(2);
    assertEquals(2, lQueryClause.size());
    for (FolLiteral lLiteral : lQueryClause)
    {
      assertFalse(lLiteral.isPositive());
    }
  }

  @Test
  public void testKnowledgeBaseFirst() throws Exception
  {
    List<List<FolLiteral>> lClauses = mConverter.toClauses(formulas(pred("P", a), pred("Q", a)), pred("R", a));
    assertEquals(3, lClauses.size());
    assertEquals(pos("P", a), lClauses.get(0).get(0));
    assertEquals(pos("Q", a), lClauses.get(1).get(0));
    assertEquals(neg("R", a), lClauses.get(2).get(0));
  }

  @Test(expected = InvalidFormulaException.class)
  public void testRebindingRejected() throws Exception
  {
    convert(forAll(x, exists(x, pred("P", x))));
  }
}
