package org.folprover.base.util.fol.transforms;

import org.folprover.base.util.fol.grammar.FolAnd;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolExists;
import org.folprover.base.util.fol.grammar.FolForAll;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolIff;
import org.folprover.base.util.fol.grammar.FolImplies;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolOr;
import org.folprover.base.util.fol.grammar.FolPool;

/**
 * Rewrites implications and biconditionals in terms of not, and and or.
 *
 * <pre>
 *   P -> Q   becomes  ~P | Q
 *   P <-> Q  becomes  (~P | Q) & (~Q | P)
 * </pre>
 */
public final class ImplicationEliminator
{
  private ImplicationEliminator()
  {
  }

  public static FolFormula run(FolFormula formula)
  {
    if (formula instanceof FolAtomic)
    {
      return formula;
    }
    else if (formula instanceof FolNot)
    {
      return FolPool.getNot(run(((FolNot)formula).getBody()));
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
    else if (formula instanceof FolImplies)
    {
      FolImplies implies = (FolImplies)formula;
      return FolPool.getOr(FolPool.getNot(run(implies.getLeft())), run(implies.getRight()));
    }
    else if (formula instanceof FolIff)
    {
      FolIff iff = (FolIff)formula;
      FolFormula left = run(iff.getLeft());
      FolFormula right = run(iff.getRight());
      return FolPool.getAnd(FolPool.getOr(FolPool.getNot(left), right),
                            FolPool.getOr(FolPool.getNot(right), left));
    }
    else if (formula instanceof FolForAll)
    {
      FolForAll forAll = (FolForAll)formula;
      return FolPool.getForAll(forAll.getVariable(), run(forAll.getBody()));
    }
    else if (formula instanceof FolExists)
    {
      FolExists exists = (FolExists)formula;
      return FolPool.getExists(exists.getVariable(), run(exists.getBody()));
    }
    else
    {
      throw new IllegalStateException("Unknown formula type: " + formula.getClass().getName());
    }
  }
}
