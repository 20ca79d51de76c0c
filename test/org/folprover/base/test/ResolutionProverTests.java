package org.folprover.base.test;

import static org.folprover.base.test.FormulaBuilder.and;
import static org.folprover.base.test.FormulaBuilder.con;
import static org.folprover.base.test.FormulaBuilder.exists;
import static org.folprover.base.test.FormulaBuilder.fn;
import static org.folprover.base.test.FormulaBuilder.forAll;
import static org.folprover.base.test.FormulaBuilder.formulas;
import static org.folprover.base.test.FormulaBuilder.implies;
import static org.folprover.base.test.FormulaBuilder.not;
import static org.folprover.base.test.FormulaBuilder.or;
import static org.folprover.base.test.FormulaBuilder.pred;
import static org.folprover.base.test.FormulaBuilder.var;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.folprover.base.util.configuration.ProverConfiguration;
import org.folprover.base.util.configuration.ProverConfiguration.CfgItem;
import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.prover.InferenceRule;
import org.folprover.base.util.prover.ProofOutcome;
import org.folprover.base.util.prover.ProofResult;
import org.folprover.base.util.prover.ProofStep;
import org.folprover.base.util.prover.ResourceLimit;
import org.folprover.base.util.prover.ResourceLimits;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;
import org.folprover.base.util.prover.resolution.ResolutionProver;
import org.folprover.base.util.prover.resolution.SaturationSearch;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class ResolutionProverTests extends Assert
{
  private static final ResourceLimits GENEROUS = new ResourceLimits(100000, 100000, Duration.ofSeconds(60));

  private final FolVariable x = var("x");
  private final FolVariable y = var("y");
  private final FolVariable z = var("z");
  private final FolConstant a = con("a");
  private final FolConstant b = con("b");

  private ResolutionProver mProver;

  @After
  public void tearDown()
  {
    if (mProver != null)
    {
      mProver.stop();
      mProver = null;
    }
    ProverConfiguration.utOverrideCfgVal(CfgItem.RESOLUTION_THREADS, null);
  }

  private List<FolFormula> socratesKnowledgeBase()
  {
    return formulas(forAll(x, implies(pred("Man", x), pred("Mortal", x))), pred("Man", con("socrates")));
  }

  /**
   * forall x. (P(x) -> P(f(x))) and P(a): an infinite supply of new clauses.
   */
  private List<FolFormula> endlessKnowledgeBase()
  {
    return formulas(forAll(x, implies(pred("P", x), pred("P", fn("f", x)))), pred("P", a));
  }

  /**
   * P0(a) and forall x. (Pi(x) -> Pi+1(x)) for i below the specified length.
   */
  private List<FolFormula> chainKnowledgeBase(int xiLength)
  {
    List<FolFormula> lFormulas = new ArrayList<>();
    lFormulas.add(pred("P0", a));
    for (int lii = 0; lii < xiLength; lii++)
    {
      lFormulas.add(forAll(x, implies(pred("P" + lii, x), pred("P" + (lii + 1), x))));
    }
    return lFormulas;
  }

  @Test
  public void testModusPonens() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(socratesKnowledgeBase(), pred("Mortal", con("socrates")));

    assertEquals(ProofOutcome.PROVED, lResult.getOutcome());
    assertTrue(lResult.isProved());
    assertNull(lResult.getExceededLimit());

    List<ProofStep> lTrace = lResult.getTrace();
    assertEquals(2, lTrace.size());
    assertTrue(lTrace.get(1).getClause().isEmpty());
    assertFalse(lTrace.get(0).getClause().isEmpty());
    for (ProofStep lStep : lTrace)
    {
      assertEquals(InferenceRule.RESOLUTION, lStep.getRule());
      for (int lParentId : lStep.getParentIds())
      {
        assertTrue(lParentId < lStep.getClauseId());
      }
    }
    assertTrue(lTrace.get(0).getClauseId() < lTrace.get(1).getClauseId());
  }

  @Test
  public void testMortalityNotProvedWithoutRule() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(formulas(pred("Man", con("socrates"))), pred("Mortal", con("socrates")));

    assertEquals(ProofOutcome.NOT_PROVED, lResult.getOutcome());
    assertFalse(lResult.isProved());
    assertNull(lResult.getExceededLimit());
    assertTrue(lResult.getTrace().isEmpty());
  }

  @Test
  public void testQueryWithFreeAndBoundVariable() throws Exception
  {
    // The free x is closed around a formula that also binds x itself.
    mProver = new ResolutionProver(GENEROUS, 1);
    List<FolFormula> lKnowledgeBase = formulas(forAll(x, pred("P", x)), forAll(x, pred("Q", x)));
    FolFormula lQuery = and(pred("P", x), forAll(x, pred("Q", x)));

    assertTrue(mProver.entails(lKnowledgeBase, lQuery));
    assertFalse(mProver.entails(formulas(forAll(x, pred("P", x))), lQuery));
  }

  @Test
  public void testHugeTimeBudget() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(socratesKnowledgeBase(),
                                        pred("Mortal", con("socrates")),
                                        GENEROUS.withTimeBudget(Duration.ofSeconds(Long.MAX_VALUE)));

    assertEquals(ProofOutcome.PROVED, lResult.getOutcome());
    assertEquals(2, lResult.getTrace().size());
  }

  @Test
  public void testUnrelatedQueryNotProved() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(formulas(pred("P", a)), pred("Q", a));

    assertEquals(ProofOutcome.NOT_PROVED, lResult.getOutcome());
    assertTrue(lResult.getTrace().isEmpty());
    assertNull(lResult.getExceededLimit());
    assertEquals(2, lResult.getFinalClauseCount());
  }

  @Test
  public void testIterationLimit() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(endlessKnowledgeBase(), pred("Q", b), GENEROUS.withMaxIterations(50));

    assertEquals(ProofOutcome.RESOURCE_EXCEEDED, lResult.getOutcome());
    assertEquals(ResourceLimit.ITERATIONS, lResult.getExceededLimit());
    assertEquals(50, lResult.getIterationsUsed());
    assertTrue(lResult.getTrace().isEmpty());
  }

  @Test
  public void testClauseLimit() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(endlessKnowledgeBase(), pred("Q", b), GENEROUS.withMaxClauses(10));

    assertEquals(ProofOutcome.RESOURCE_EXCEEDED, lResult.getOutcome());
    assertEquals(ResourceLimit.CLAUSES, lResult.getExceededLimit());
    assertTrue(lResult.getFinalClauseCount() > 10);
  }

  @Test
  public void testTimeLimit() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(endlessKnowledgeBase(), pred("Q", b), GENEROUS.withTimeBudget(Duration.ZERO));

    assertEquals(ProofOutcome.RESOURCE_EXCEEDED, lResult.getOutcome());
    assertEquals(ResourceLimit.TIME, lResult.getExceededLimit());
  }

  @Test
  public void testSkolemizedKnowledgeBase() throws Exception
  {
    // Everything with P has a Q-successor, and a has P, so a has a Q-successor.
    mProver = new ResolutionProver(GENEROUS, 1);
    List<FolFormula> lKnowledgeBase = formulas(forAll(x, implies(pred("P", x), exists(y, pred("Q", x, y)))),
                                               pred("P", a));

    assertTrue(mProver.entails(lKnowledgeBase, exists(z, pred("Q", a, z))));
    assertFalse(mProver.entails(lKnowledgeBase, exists(z, pred("Q", z, a))));
  }

  @Test
  public void testCaseSplit() throws Exception
  {
    // (P(a) | Q(a)), P -> R, Q -> R entail R(a).  Needs a non-unit resolvent.
    mProver = new ResolutionProver(GENEROUS, 1);
    List<FolFormula> lKnowledgeBase = formulas(or(pred("P", a), pred("Q", a)),
                                               forAll(x, implies(pred("P", x), pred("R", x))),
                                               forAll(x, implies(pred("Q", x), pred("R", x))));
    assertTrue(mProver.entails(lKnowledgeBase, pred("R", a)));
  }

  @Test
  public void testQueryWithFreeVariable() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    assertTrue(mProver.entails(formulas(forAll(x, pred("P", x))), pred("P", y)));
    assertFalse(mProver.entails(formulas(pred("P", a)), pred("P", y)));
  }

  @Test
  public void testInconsistentKnowledgeBaseProvesAnything() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    ProofResult lResult = mProver.prove(formulas(pred("P", a), not(pred("P", a))), pred("Q", b));
    assertTrue(lResult.isProved());
    assertEquals(1, lResult.getTrace().size());
  }

  @Test(expected = InvalidFormulaException.class)
  public void testInvalidFormulaRejected() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    mProver.prove(formulas(pred("P", a), pred("P", a, b)), pred("Q", a));
  }

  @Test
  public void testStepwiseSearch() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    SaturationSearch lSearch = mProver.createSearch(socratesKnowledgeBase(),
                                                    pred("Mortal", con("socrates")),
                                                    GENEROUS);

    assertEquals(ProofOutcome.RUNNING, lSearch.getState());
    assertEquals(3, lSearch.getClauseStore().size());
    assertEquals(3, lSearch.getQueueSize());

    try
    {
      lSearch.getResult();
      fail("Result available before the search ended");
    }
    catch (IllegalStateException lEx)
    {
      // Expected.
    }

    ProofOutcome lOutcome;
    do
    {
      lOutcome = lSearch.step();
    }
    while (lOutcome == ProofOutcome.RUNNING);

    assertEquals(ProofOutcome.PROVED, lOutcome);
    assertEquals(4, lSearch.getIterations());
    assertTrue(lSearch.getProcessedPairCount() > 0);

    // Once ended, stepping changes nothing.
    assertEquals(ProofOutcome.PROVED, lSearch.step());
    assertEquals(4, lSearch.getResult().getIterationsUsed());
  }

  @Test
  public void testCancel() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    SaturationSearch lSearch = mProver.createSearch(endlessKnowledgeBase(), pred("Q", b), GENEROUS);

    assertEquals(ProofOutcome.RUNNING, lSearch.step());
    lSearch.cancel();

    ProofResult lResult = lSearch.run();
    assertEquals(ProofOutcome.RESOURCE_EXCEEDED, lResult.getOutcome());
    assertEquals(ResourceLimit.CANCELLED, lResult.getExceededLimit());
    assertEquals(1, lResult.getIterationsUsed());
  }

  @Test
  public void testCancelFromAnotherThread() throws Exception
  {
    mProver = new ResolutionProver(GENEROUS, 1);
    final SaturationSearch lSearch = mProver.createSearch(endlessKnowledgeBase(), pred("Q", b), GENEROUS);

    Thread lCanceller = new Thread(new Runnable()
    {
      @Override
      public void run()
      {
        while (lSearch.getIterations() < 20)
        {
          Thread.yield();
        }
        lSearch.cancel();
      }
    });
    lCanceller.start();

    ProofResult lResult = lSearch.run();
    lCanceller.join();
    assertEquals(ResourceLimit.CANCELLED, lResult.getExceededLimit());
  }

  @Test
  public void testParallelResolutionAgrees() throws Exception
  {
    ProverConfiguration.utOverrideCfgVal(CfgItem.RESOLUTION_THREADS, "4");
    mProver = new ResolutionProver(GENEROUS);
    ResolutionProver lSerial = new ResolutionProver(GENEROUS, 1);

    List<FolFormula> lChain = chainKnowledgeBase(8);
    ProofResult lParallelResult = mProver.prove(lChain, pred("P8", a));
    ProofResult lSerialResult = lSerial.prove(lChain, pred("P8", a));
    assertEquals(ProofOutcome.PROVED, lParallelResult.getOutcome());
    assertEquals(lSerialResult.getOutcome(), lParallelResult.getOutcome());

    lParallelResult = mProver.prove(lChain, pred("P8", b));
    lSerialResult = lSerial.prove(lChain, pred("P8", b));
    assertEquals(ProofOutcome.NOT_PROVED, lParallelResult.getOutcome());
    assertEquals(lSerialResult.getOutcome(), lParallelResult.getOutcome());
    assertEquals(lSerialResult.getFinalClauseCount(), lParallelResult.getFinalClauseCount());

    assertTrue(mProver.entails(socratesKnowledgeBase(), pred("Mortal", con("socrates"))));
  }

  @Test
  public void testConfiguredLimits() throws Exception
  {
    ResourceLimits lLimits = ResourceLimits.fromConfiguration();
    assertEquals(ProverConfiguration.getCfgInt(CfgItem.MAX_ITERATIONS), lLimits.getMaxIterations());
    assertEquals(ProverConfiguration.getCfgInt(CfgItem.MAX_CLAUSES), lLimits.getMaxClauses());
    assertEquals(Duration.ofMillis(ProverConfiguration.getCfgInt(CfgItem.TIME_BUDGET_MS)), lLimits.getTimeBudget());

    mProver = new ResolutionProver();
    assertTrue(mProver.entails(socratesKnowledgeBase(), pred("Mortal", con("socrates"))));
  }
}
