package org.folprover.base.util.fol.transforms;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
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
import org.folprover.base.util.fol.model.Substituter;
import org.folprover.base.util.fol.model.Substitution;

/**
 * Removes existential quantifiers.  Each existentially quantified variable is replaced by a Skolem term: a fresh
 * function applied to the universally quantified variables whose scope encloses the existential, or a fresh constant
 * if there are none.  Universal quantifiers are left in place.
 *
 * Expects a standardized formula in negation normal form.  The result is equisatisfiable with the input, not
 * equivalent to it.
 */
public final class Skolemizer
{
  private Skolemizer()
  {
  }

  public static FolFormula run(FolFormula formula, SkolemSymbolGenerator generator)
  {
    return skolemize(formula, generator, new ArrayList<FolVariable>(), new HashMap<FolVariable, FolTerm>());
  }

  private static FolFormula skolemize(FolFormula formula,
                                      SkolemSymbolGenerator generator,
                                      List<FolVariable> universals,
                                      Map<FolVariable, FolTerm> skolemTerms)
  {
    if (formula instanceof FolAtomic)
    {
      if (skolemTerms.isEmpty())
      {
        return formula;
      }
      return FolPool.getAtomic(Substituter.substitute(((FolAtomic)formula).getAtom(), Substitution.of(skolemTerms)));
    }
    else if (formula instanceof FolNot)
    {
      return FolPool.getNot(skolemize(((FolNot)formula).getBody(), generator, universals, skolemTerms));
    }
    else if (formula instanceof FolAnd)
    {
      FolAnd and = (FolAnd)formula;
      return FolPool.getAnd(skolemize(and.getLeft(), generator, universals, skolemTerms),
                            skolemize(and.getRight(), generator, universals, skolemTerms));
    }
    else if (formula instanceof FolOr)
    {
      FolOr or = (FolOr)formula;
      return FolPool.getOr(skolemize(or.getLeft(), generator, universals, skolemTerms),
                           skolemize(or.getRight(), generator, universals, skolemTerms));
    }
    else if (formula instanceof FolForAll)
    {
      FolForAll forAll = (FolForAll)formula;
      universals.add(forAll.getVariable());
      FolFormula body = skolemize(forAll.getBody(), generator, universals, skolemTerms);
      universals.remove(universals.size() - 1);
      return FolPool.getForAll(forAll.getVariable(), body);
    }
    else if (formula instanceof FolExists)
    {
      FolExists exists = (FolExists)formula;
      String symbol = generator.nextSymbol();
      generator.checkFresh(symbol);

      FolTerm skolemTerm;
      if (universals.isEmpty())
      {
        skolemTerm = FolPool.getConstant(symbol);
      }
      else
      {
        skolemTerm = FolPool.getFunction(symbol, new ArrayList<FolTerm>(universals));
      }

      skolemTerms.put(exists.getVariable(), skolemTerm);
      FolFormula body = skolemize(exists.getBody(), generator, universals, skolemTerms);
      skolemTerms.remove(exists.getVariable());
      return body;
    }
    else
    {
      throw new IllegalStateException("Unexpected formula type in Skolemization: " + formula.getClass().getName());
    }
  }
}
