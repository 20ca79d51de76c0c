package org.folprover.base.validator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.folprover.base.util.fol.grammar.FolAtom;
import org.folprover.base.util.fol.grammar.FolAtomic;
import org.folprover.base.util.fol.grammar.FolBinary;
import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolFunction;
import org.folprover.base.util.fol.grammar.FolNot;
import org.folprover.base.util.fol.grammar.FolQuantified;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;

/**
 * Checks that formulas meet the contract for clausal-form conversion, without converting them.
 *
 * The checks are:
 * <ul>
 * <li>no part of a formula is missing;
 * <li>no quantifier binds a variable that an enclosing quantifier already binds;
 * <li>every predicate name is used with a single arity, across all the formulas;
 * <li>every function name is used with a single arity, across all the formulas (a constant counts as a function of
 *     arity 0).
 * </ul>
 *
 * Predicates and functions have separate namespaces, so a name may be used as both.
 */
public final class StaticValidator
{
  private StaticValidator()
  {
    // Static utility only.
  }

  /**
   * Validate a set of formulas that will be converted together.
   *
   * @param formulas - the formulas.
   *
   * @throws InvalidFormulaException if any formula breaks the contract.
   */
  public static void validateFormulas(List<FolFormula> formulas) throws InvalidFormulaException
  {
    Map<String, Integer> predicateArities = new HashMap<>();
    Map<String, Integer> functionArities = new HashMap<>();

    for (FolFormula formula : formulas)
    {
      if (formula == null)
      {
        throw new InvalidFormulaException("Missing formula", null);
      }
      validateFormula(formula, formula, new ArrayDeque<FolVariable>(), predicateArities, functionArities);
    }
  }

  private static void validateFormula(FolFormula formula,
                                      FolFormula root,
                                      Deque<FolVariable> bound,
                                      Map<String, Integer> predicateArities,
                                      Map<String, Integer> functionArities) throws InvalidFormulaException
  {
    if (formula == null)
    {
      throw new InvalidFormulaException("Missing sub-formula", root);
    }

    if (formula instanceof FolAtomic)
    {
      FolAtom atom = ((FolAtomic)formula).getAtom();
      if (atom == null)
      {
        throw new InvalidFormulaException("Missing atom", root);
      }
      checkArity("Predicate", atom.getPredicate(), atom.arity(), predicateArities, root);
      for (FolTerm term : atom.getBody())
      {
        validateTerm(term, root, functionArities);
      }
    }
    else if (formula instanceof FolNot)
    {
      validateFormula(((FolNot)formula).getBody(), root, bound, predicateArities, functionArities);
    }
    else if (formula instanceof FolBinary)
    {
      FolBinary binary = (FolBinary)formula;
      validateFormula(binary.getLeft(), root, bound, predicateArities, functionArities);
      validateFormula(binary.getRight(), root, bound, predicateArities, functionArities);
    }
    else if (formula instanceof FolQuantified)
    {
      FolQuantified quantified = (FolQuantified)formula;
      FolVariable variable = quantified.getVariable();
      if (variable == null)
      {
        throw new InvalidFormulaException("Quantifier without a variable", root);
      }
      if (bound.contains(variable))
      {
        throw new InvalidFormulaException("Variable " + variable + " is already bound by an enclosing quantifier",
                                          root);
      }

      bound.push(variable);
      validateFormula(quantified.getBody(), root, bound, predicateArities, functionArities);
      bound.pop();
    }
    else
    {
      throw new IllegalStateException("Unknown formula type: " + formula.getClass().getName());
    }
  }

  private static void validateTerm(FolTerm term,
                                   FolFormula root,
                                   Map<String, Integer> functionArities) throws InvalidFormulaException
  {
    if (term == null)
    {
      throw new InvalidFormulaException("Missing term", root);
    }

    if (term instanceof FolConstant)
    {
      checkArity("Function", ((FolConstant)term).getName(), 0, functionArities, root);
    }
    else if (term instanceof FolFunction)
    {
      FolFunction function = (FolFunction)term;
      checkArity("Function", function.getName(), function.arity(), functionArities, root);
      for (FolTerm argument : function.getBody())
      {
        validateTerm(argument, root, functionArities);
      }
    }
  }

  private static void checkArity(String kind,
                                 String name,
                                 int arity,
                                 Map<String, Integer> arities,
                                 FolFormula root) throws InvalidFormulaException
  {
    Integer existing = arities.putIfAbsent(name, arity);
    if ((existing != null) && (existing != arity))
    {
      throw new InvalidFormulaException(kind + " " + name + " is used with arity " + existing + " and arity " + arity,
                                        root);
    }
  }
}
