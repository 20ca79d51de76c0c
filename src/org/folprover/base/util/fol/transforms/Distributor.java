package org.folprover.base.util.fol.transforms;

import org.folprover.base.util.fol.grammar.FolAnd;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolOr;
import org.folprover.base.util.fol.grammar.FolPool;

/**
 * Distributes "or" over "and" to reach conjunctive normal form.
 *
 * <pre>
 *   A | (B & C)  becomes  (A | B) & (A | C)
 *   (B & C) | A  becomes  (B | A) & (C | A)
 * </pre>
 *
 * Both sides of an "or" are distributed before the "or" itself, so a single bottom-up pass reaches the fixpoint.
 */
public final class Distributor
{
  private Distributor()
  {
  }

  public static FolFormula run(FolFormula formula)
  {
    if ((formula instanceof FolAtomic) || (formula instanceof FolNot))
    {
      return formula;
    }
    else if (formula instanceof FolAnd)
    {
      FolAnd and = (FolAnd)formula;
      return FolPool.getAnd(run(and.getLeft()), run(and.getRight()));
    }
    else if (formula instanceof FolOr)
    {
      FolOr or = (FolOr)formula;
      return distributeOr(run(or.getLeft()), run(or.getRight()));
    }
    else
    {
      throw new IllegalStateException("Unexpected formula type in distribution: " + formula.getClass().getName());
    }
  }

  /**
   * @return the CNF of (left | right), where both sides are already in CNF.
   */
  private static FolFormula distributeOr(FolFormula left, FolFormula right)
  {
    if (left instanceof FolAnd)
    {
      FolAnd and = (FolAnd)left;
      return FolPool.getAnd(distributeOr(and.getLeft(), right), distributeOr(and.getRight(), right));
    }
    else if (right instanceof FolAnd)
    {
      FolAnd and = (FolAnd)right;
      return FolPool.getAnd(distributeOr(left, and.getLeft()), distributeOr(left, and.getRight()));
    }
    return FolPool.getOr(left, right);
  }
}
