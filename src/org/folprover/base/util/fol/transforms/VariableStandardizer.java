package org.folprover.base.util.fol.transforms;

import java.util.HashMap;
import java.util.Map;

import org.folprover.base.util.fol.grammar.FolAnd;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolExists;
import org.folprover.base.util.fol.grammar.FolForAll;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolOr;
import org.folprover.base.util.fol.grammar.FolPool;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.fol.model.Substituter;
import org.folprover.base.util.fol.model.Substitution;

/**
 * Renames the variable of every quantifier to a variable with a fresh scope id, so that no two quantifiers (in this
 * formula or in any other formula converted with the same counter) bind the same variable.
 *
 * Expects a formula in negation normal form.
 */
public final class VariableStandardizer
{
  private VariableStandardizer()
  {
  }

  public static FolFormula run(FolFormula formula, ScopeCounter counter)
  {
    return standardize(formula, counter, new HashMap<FolVariable, FolTerm>());
  }

  private static FolFormula standardize(FolFormula formula, ScopeCounter counter, Map<FolVariable, FolTerm> renaming)
  {
    if (formula instanceof FolAtomic)
    {
      return FolPool.getAtomic(Substituter.substitute(((FolAtomic)formula).getAtom(), Substitution.of(renaming)));
    }
    else if (formula instanceof FolNot)
    {
      return FolPool.getNot(standardize(((FolNot)formula).getBody(), counter, renaming));
    }
    else if (formula instanceof FolAnd)
    {
      FolAnd and = (FolAnd)formula;
      return FolPool.getAnd(standardize(and.getLeft(), counter, renaming),
                            standardize(and.getRight(), counter, renaming));
    }
    else if (formula instanceof FolOr)
    {
      FolOr or = (FolOr)formula;
      return FolPool.getOr(standardize(or.getLeft(), counter, renaming),
                           standardize(or.getRight(), counter, renaming));
    }
    else if ((formula instanceof FolForAll) || (formula instanceof FolExists))
    {
      boolean universal = (formula instanceof FolForAll);
      FolVariable variable = universal ? ((FolForAll)formula).getVariable() : ((FolExists)formula).getVariable();
      FolFormula body = universal ? ((FolForAll)formula).getBody() : ((FolExists)formula).getBody();

      FolVariable fresh = counter.freshVariable(variable.getName());
      FolTerm previous = renaming.put(variable, fresh);
      FolFormula newBody = standardize(body, counter, renaming);
      if (previous == null)
      {
        renaming.remove(variable);
      }
      else
      {
        renaming.put(variable, previous);
      }

      return universal ? FolPool.getForAll(fresh, newBody) : FolPool.getExists(fresh, newBody);
    }
    else
    {
      throw new IllegalStateException("Unexpected formula type in standardization: " + formula.getClass().getName());
    }
  }
}
