package org.folprover.base.util.fol.transforms;

import org.folprover.base.util.fol.grammar.FolAnd;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolForAll;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolOr;
import org.folprover.base.util.fol.grammar.FolPool;

/**
 * Drops universal quantifiers from a Skolemized formula.  The remaining free variables are implicitly universally
 * quantified at clause level.
 */
public final class QuantifierDropper
{
  private QuantifierDropper()
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
      return FolPool.getOr(run(or.getLeft()), run(or.getRight()));
    }
    else if (formula instanceof FolForAll)
    {
      return run(((FolForAll)formula).getBody());
    }
    else
    {
      throw new IllegalStateException("Unexpected formula type when dropping quantifiers: " +
                                      formula.getClass().getName());
    }
  }
}
