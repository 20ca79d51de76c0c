package org.folprover.base.util.fol.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Factory for every object in the {@link Fol} hierarchy.
 *
 * Constants are interned so that identity is global by name.  Everything else is a value object and compares
 * structurally.
 */
public final class FolPool
{
  private static final ConcurrentMap<String, FolConstant> constantPool = new ConcurrentHashMap<>();

  private FolPool()
  {
    // Static factory only.
  }

  /**
   * @return the single constant with the specified name.
   *
   * @param name - the name.
   */
  public static FolConstant getConstant(String name)
  {
    FolConstant ret = constantPool.get(name);
    if (ret == null)
    {
      ret = new FolConstant(name);
      FolConstant existing = constantPool.putIfAbsent(name, ret);
      if (existing != null)
      {
        ret = existing;
      }
    }
    return ret;
  }

  /**
   * @return a variable as supplied by a parser (scope id 0).
   *
   * @param name - the name.
   */
  public static FolVariable getVariable(String name)
  {
    return new FolVariable(name, 0);
  }

  /**
   * @return a variable with an explicit scope id.
   *
   * @param name    - the name.
   * @param scopeId - the scope id.
   */
  public static FolVariable getVariable(String name, long scopeId)
  {
    if (scopeId < 0)
    {
      throw new IllegalArgumentException("Negative scope id " + scopeId + " for variable " + name);
    }
    return new FolVariable(name, scopeId);
  }

  public static FolFunction getFunction(String name, List<? extends FolTerm> body)
  {
    if (body.isEmpty())
    {
      throw new IllegalArgumentException("Function " + name + " must have arguments - use a constant instead");
    }
    return new FolFunction(name, immutableCopy(body));
  }

  public static FolFunction getFunction(String name, FolTerm... body)
  {
    return getFunction(name, Arrays.asList(body));
  }

  public static FolAtom getAtom(String predicate, List<? extends FolTerm> body)
  {
    return new FolAtom(predicate, immutableCopy(body));
  }

  public static FolAtom getAtom(String predicate, FolTerm... body)
  {
    return getAtom(predicate, Arrays.asList(body));
  }

  public static FolLiteral getLiteral(FolAtom atom, boolean positive)
  {
    return new FolLiteral(atom, positive);
  }

  public static FolAtomic getAtomic(FolAtom atom)
  {
    return new FolAtomic(atom);
  }

  public static FolAtomic getAtomic(String predicate, FolTerm... body)
  {
    return new FolAtomic(getAtom(predicate, body));
  }

  public static FolNot getNot(FolFormula body)
  {
    return new FolNot(body);
  }

  public static FolAnd getAnd(FolFormula left, FolFormula right)
  {
    return new FolAnd(left, right);
  }

  /**
   * @return the conjunction of the specified formulas, folded left to right.
   *
   * @param conjuncts - the formulas.  There must be at least one.
   */
  public static FolFormula getAnd(List<? extends FolFormula> conjuncts)
  {
    FolFormula result = conjuncts.get(0);
    for (int ii = 1; ii < conjuncts.size(); ii++)
    {
      result = new FolAnd(result, conjuncts.get(ii));
    }
    return result;
  }

  public static FolOr getOr(FolFormula left, FolFormula right)
  {
    return new FolOr(left, right);
  }

  /**
   * @return the disjunction of the specified formulas, folded left to right.
   *
   * @param disjuncts - the formulas.  There must be at least one.
   */
  public static FolFormula getOr(List<? extends FolFormula> disjuncts)
  {
    FolFormula result = disjuncts.get(0);
    for (int ii = 1; ii < disjuncts.size(); ii++)
    {
      result = new FolOr(result, disjuncts.get(ii));
    }
    return result;
  }

  public static FolImplies getImplies(FolFormula antecedent, FolFormula consequent)
  {
    return new FolImplies(antecedent, consequent);
  }

  public static FolIff getIff(FolFormula left, FolFormula right)
  {
    return new FolIff(left, right);
  }

  public static FolForAll getForAll(FolVariable variable, FolFormula body)
  {
    return new FolForAll(variable, body);
  }

  public static FolExists getExists(FolVariable variable, FolFormula body)
  {
    return new FolExists(variable, body);
  }

  private static <T> List<T> immutableCopy(List<? extends T> list)
  {
    return Collections.unmodifiableList(new ArrayList<T>(list));
  }
}
