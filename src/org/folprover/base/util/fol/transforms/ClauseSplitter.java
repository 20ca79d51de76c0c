package org.folprover.base.util.fol.transforms;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.folprover.base.util.fol.grammar.FolAnd;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolOr;
import org.folprover.base.util.fol.grammar.FolPool;

/**
 * Splits a CNF formula into clauses.  Every conjunct becomes one clause; the literals of its disjunction become the
 * clause's literals, with duplicates collapsed.
 */
public final class ClauseSplitter
{
  private ClauseSplitter()
  {
  }

  /**
   * @return one literal list per clause, in the order the conjuncts appear.
   */
  public static List<List<FolLiteral>> run(FolFormula formula)
  {
    List<List<FolLiteral>> clauses = new ArrayList<>();
    addClauses(formula, clauses);
    return clauses;
  }

  private static void addClauses(FolFormula formula, List<List<FolLiteral>> clauses)
  {
    if (formula instanceof FolAnd)
    {
      addClauses(((FolAnd)formula).getLeft(), clauses);
      addClauses(((FolAnd)formula).getRight(), clauses);
    }
    else
    {
      Set<FolLiteral> literals = new LinkedHashSet<>();
      addLiterals(formula, literals);
      clauses.add(new ArrayList<>(literals));
    }
  }

  private static void addLiterals(FolFormula formula, Set<FolLiteral> literals)
  {
    if (formula instanceof FolOr)
    {
      addLiterals(((FolOr)formula).getLeft(), literals);
      addLiterals(((FolOr)formula).getRight(), literals);
    }
    else if (formula instanceof FolAtomic)
    {
      literals.add(FolPool.getLiteral(((FolAtomic)formula).getAtom(), true));
    }
    else if ((formula instanceof FolNot) && (((FolNot)formula).getBody() instanceof FolAtomic))
    {
      literals.add(FolPool.getLiteral(((FolAtomic)((FolNot)formula).getBody()).getAtom(), false));
    }
    else
    {
      throw new IllegalStateException("Formula is not in conjunctive normal form: " + formula);
    }
  }
}
