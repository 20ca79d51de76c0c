package org.folprover.base.util.prover.resolution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.fol.model.Substituter;
import org.folprover.base.util.fol.model.Substitution;
import org.folprover.base.util.fol.unify.Unifier;
import org.folprover.base.util.prover.InferenceRule;

/**
 * Binary resolution and factoring.
 *
 * Before two clauses are resolved, the second is copied with entirely fresh variables, so a clause can be resolved
 * against itself and no variable is shared between the two operands.
 *
 * The engine has no state of its own apart from the scope counter, which is safe to share, so one engine can serve
 * several worker threads.
 */
public class ResolutionEngine
{
  private final ScopeCounter mCounter;

  /**
   * @param xiCounter - source of fresh variables for renaming clauses apart.
   */
  public ResolutionEngine(ScopeCounter xiCounter)
  {
    mCounter = xiCounter;
  }

  /**
   * @return all binary resolvents of two clauses (possibly none).  Stops early, returning what it has, once it
   * produces the empty clause.
   */
  public List<Clause> resolve(Clause xiFirst, Clause xiSecond)
  {
    return resolve(xiFirst, xiSecond, null);
  }

  /**
   * @return all binary resolvents of two clauses (possibly none).  Stops early, returning what it has, once it
   * produces the empty clause or once the done flag is set.
   *
   * @param xiFirst  - the first clause.
   * @param xiSecond - the second clause.  A copy with fresh variables is used.
   * @param xiDone   - flag to check between literal pairs, or null.
   */
  public List<Clause> resolve(Clause xiFirst, Clause xiSecond, AtomicBoolean xiDone)
  {
    List<Clause> lResolvents = new ArrayList<>();
    Clause lSecond = relicense(xiSecond);

    for (int lii = 0; lii < xiFirst.size(); lii++)
    {
      FolLiteral lLiteral1 = xiFirst.get(lii);
      for (int ljj = 0; ljj < lSecond.size(); ljj++)
      {
        if ((xiDone != null) && xiDone.get())
        {
          return lResolvents;
        }

        FolLiteral lLiteral2 = lSecond.get(ljj);
        if (lLiteral1.isPositive() == lLiteral2.isPositive())
        {
          continue;
        }

        Substitution lTheta = Unifier.unifyLiterals(lLiteral1, lLiteral2);
        if (lTheta == null)
        {
          continue;
        }

        List<FolLiteral> lLiterals = new ArrayList<>(xiFirst.size() + lSecond.size() - 2);
        for (int lkk = 0; lkk < xiFirst.size(); lkk++)
        {
          if (lkk != lii)
          {
            lLiterals.add(Substituter.substitute(xiFirst.get(lkk), lTheta));
          }
        }
        for (int lkk = 0; lkk < lSecond.size(); lkk++)
        {
          if (lkk != ljj)
          {
            lLiterals.add(Substituter.substitute(lSecond.get(lkk), lTheta));
          }
        }

        Clause lResolvent = Clause.create(lLiterals, InferenceRule.RESOLUTION, xiFirst.getId(), xiSecond.getId());
        lResolvents.add(lResolvent);
        if (lResolvent.isEmpty())
        {
          return lResolvents;
        }
      }
    }

    return lResolvents;
  }

  /**
   * @return the binary factors of a clause: for each pair of literals with the same polarity whose atoms unify, the
   * clause with the unifier applied (the two literals collapse into one).
   */
  public List<Clause> factor(Clause xiClause)
  {
    List<Clause> lFactors = new ArrayList<>();

    for (int lii = 0; lii < xiClause.size(); lii++)
    {
      for (int ljj = lii + 1; ljj < xiClause.size(); ljj++)
      {
        FolLiteral lLiteral1 = xiClause.get(lii);
        FolLiteral lLiteral2 = xiClause.get(ljj);
        if (lLiteral1.isPositive() != lLiteral2.isPositive())
        {
          continue;
        }

        Substitution lTheta = Unifier.unifyLiterals(lLiteral1, lLiteral2);
        if (lTheta != null)
        {
          lFactors.add(Clause.create(Substituter.substitute(xiClause.getLiterals(), lTheta),
                                     InferenceRule.FACTOR,
                                     xiClause.getId()));
        }
      }
    }

    return lFactors;
  }

  /**
   * @return a copy of a clause in which every distinct variable is replaced by its own fresh variable.
   */
  public Clause relicense(Clause xiClause)
  {
    if (xiClause.getVariables().isEmpty())
    {
      return xiClause;
    }
    return xiClause.rename(mCounter.freshRenaming(xiClause.getVariables()));
  }
}
