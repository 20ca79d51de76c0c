package org.folprover.base.util.fol.transforms;

import org.folprover.base.util.fol.grammar.FolAnd;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolExists;
import org.folprover.base.util.fol.grammar.FolForAll;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolOr;
import org.folprover.base.util.fol.grammar.FolPool;

/**
 * Converts a formula to negation normal form: every "not" is pushed inwards until it applies directly to an atomic
 * formula.  Uses De Morgan's laws, the duality of the quantifiers and double-negation elimination.
 *
 * Implications and biconditionals must already have been removed by {@link ImplicationEliminator}.
 */
public final class NegationNormalizer
{
  private NegationNormalizer()
  {
  }

  public static FolFormula run(FolFormula formula)
  {
    return normalize(formula, false);
  }

  /**
   * @param negate - whether the formula is under an odd number of negations.
   */
  private static FolFormula normalize(FolFormula formula, boolean negate)
  {
    if (formula instanceof FolAtomic)
    {
      return negate ? FolPool.getNot(formula) : formula;
    }
    else if (formula instanceof FolNot)
    {
      return normalize(((FolNot)formula).getBody(), !negate);
    }
    else if (formula instanceof FolAnd)
    {
      FolAnd and = (FolAnd)formula;
      FolFormula left = normalize(and.getLeft(), negate);
      FolFormula right = normalize(and.getRight(), negate);
      return negate ? FolPool.getOr(left, right) : FolPool.getAnd(left, right);
    }
    else if (formula instanceof FolOr)
    {
      FolOr or = (FolOr)formula;
      FolFormula left = normalize(or.getLeft(), negate);
      FolFormula right = normalize(or.getRight(), negate);
      return negate ? FolPool.getAnd(left, right) : FolPool.getOr(left, right);
    }
    else if (formula instanceof FolForAll)
    {
      FolForAll forAll = (FolForAll)formula;
      FolFormula body = normalize(forAll.getBody(), negate);
      return negate ? FolPool.getExists(forAll.getVariable(), body) : FolPool.getForAll(forAll.getVariable(), body);
    }
    else if (formula instanceof FolExists)
    {
      FolExists exists = (FolExists)formula;
      FolFormula body = normalize(exists.getBody(), negate);
      return negate ? FolPool.getForAll(exists.getVariable(), body) : FolPool.getExists(exists.getVariable(), body);
    }
    else
    {
      throw new IllegalStateException("Unexpected formula type in negation normalization: " +
                                      formula.getClass().getName());
    }
  }
}
