package org.folprover.base.util.fol;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import org.folprover.base.util.fol.grammar.FolAtom;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolBinary;
import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolFunction;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolQuantified;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;

/**
 * Helpers for collecting variables and symbols from first-order objects.
 */
public final class FolUtils
{
  private FolUtils()
  {
    // Static utility only.
  }

  /**
   * @return the variables of a term, in order of first appearance.
   */
  public static Set<FolVariable> getVariables(FolTerm term)
  {
    Set<FolVariable> variables = new LinkedHashSet<>();
    addVariables(term, variables);
    return variables;
  }

  /**
   * @return the variables of a collection of literals, in order of first appearance.
   */
  public static Set<FolVariable> getVariables(Collection<FolLiteral> literals)
  {
    Set<FolVariable> variables = new LinkedHashSet<>();
    for (FolLiteral literal : literals)
    {
      for (FolTerm term : literal.getAtom().getBody())
      {
        addVariables(term, variables);
      }
    }
    return variables;
  }

  /**
   * @return the variables that occur free in a formula (not bound by an enclosing quantifier), in order of first
   * appearance.
   */
  public static Set<FolVariable> getFreeVariables(FolFormula formula)
  {
    Set<FolVariable> free = new LinkedHashSet<>();
    addFreeVariables(formula, new ArrayDeque<FolVariable>(), free);
    return free;
  }

  /**
   * Add every predicate, function and constant name used in a formula to the specified set.
   */
  public static void addSymbols(FolFormula formula, Set<String> symbols)
  {
    if (formula instanceof FolAtomic)
    {
      FolAtom atom = ((FolAtomic)formula).getAtom();
      symbols.add(atom.getPredicate());
      for (FolTerm term : atom.getBody())
      {
        addSymbols(term, symbols);
      }
    }
    else if (formula instanceof FolNot)
    {
      addSymbols(((FolNot)formula).getBody(), symbols);
    }
    else if (formula instanceof FolBinary)
    {
      addSymbols(((FolBinary)formula).getLeft(), symbols);
      addSymbols(((FolBinary)formula).getRight(), symbols);
    }
    else if (formula instanceof FolQuantified)
    {
      addSymbols(((FolQuantified)formula).getBody(), symbols);
    }
    else
    {
      throw new IllegalStateException("Unknown formula type: " + formula.getClass().getName());
    }
  }

  private static void addSymbols(FolTerm term, Set<String> symbols)
  {
    if (term instanceof FolConstant)
    {
      symbols.add(((FolConstant)term).getName());
    }
    else if (term instanceof FolFunction)
    {
      FolFunction function = (FolFunction)term;
      symbols.add(function.getName());
      for (FolTerm argument : function.getBody())
      {
        addSymbols(argument, symbols);
      }
    }
  }

  private static void addVariables(FolTerm term, Set<FolVariable> variables)
  {
    if (term instanceof FolVariable)
    {
      variables.add((FolVariable)term);
    }
    else if (term instanceof FolFunction)
    {
      for (FolTerm argument : ((FolFunction)term).getBody())
      {
        addVariables(argument, variables);
      }
    }
  }

  private static void addFreeVariables(FolFormula formula, Deque<FolVariable> bound, Set<FolVariable> free)
  {
    if (formula instanceof FolAtomic)
    {
      for (FolTerm term : ((FolAtomic)formula).getAtom().getBody())
      {
        for (FolVariable variable : getVariables(term))
        {
          if (!bound.contains(variable))
          {
            free.add(variable);
          }
        }
      }
    }
    else if (formula instanceof FolNot)
    {
      addFreeVariables(((FolNot)formula).getBody(), bound, free);
    }
    else if (formula instanceof FolBinary)
    {
      addFreeVariables(((FolBinary)formula).getLeft(), bound, free);
      addFreeVariables(((FolBinary)formula).getRight(), bound, free);
    }
    else if (formula instanceof FolQuantified)
    {
      FolQuantified quantified = (FolQuantified)formula;
      bound.push(quantified.getVariable());
      addFreeVariables(quantified.getBody(), bound, free);
      bound.pop();
    }
    else
    {
      throw new IllegalStateException("Unknown formula type: " + formula.getClass().getName());
    }
  }
}
