package org.folprover.base.util.fol.unify;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.folprover.base.util.fol.grammar.FolAtom;
import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFunction;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.Substituter;
import org.folprover.base.util.fol.model.Substitution;

/**
 * Robinson unification with occurs-check.
 *
 * Failure to unify is an ordinary result, reported by returning null.  A successful result is the most general
 * unifier, and it is idempotent: no variable in its domain occurs in its range.
 *
 * When two distinct variables meet, the one introduced later (see {@link FolVariable#compareTo}) is bound to the one
 * introduced earlier, so results are the same from run to run.
 */
public final class Unifier
{
  private Unifier()
  {
    // Static utility only.
  }

  /**
   * @return the most general unifier of two terms, or null if they don't unify.
   */
  public static Substitution unify(FolTerm x, FolTerm y)
  {
    return unify(x, y, Substitution.EMPTY);
  }

  /**
   * @return the most general unifier of two terms that extends an existing substitution, or null if there isn't one.
   *
   * @param theta - an idempotent substitution to extend.
   */
  public static Substitution unify(FolTerm x, FolTerm y, Substitution theta)
  {
    Deque<FolTerm[]> pending = new ArrayDeque<>();
    pending.push(new FolTerm[] {x, y});
    return solve(pending, theta);
  }

  /**
   * @return the most general unifier of two atoms, or null if they don't unify.  Atoms with a different predicate or
   * arity fail immediately.
   */
  public static Substitution unifyAtoms(FolAtom a1, FolAtom a2)
  {
    return unifyAtoms(a1, a2, Substitution.EMPTY);
  }

  public static Substitution unifyAtoms(FolAtom a1, FolAtom a2, Substitution theta)
  {
    if ((a1.getPredicate() != a2.getPredicate()) || (a1.arity() != a2.arity()))
    {
      return null;
    }

    Deque<FolTerm[]> pending = new ArrayDeque<>();
    pushArguments(pending, a1.getBody(), a2.getBody());
    return solve(pending, theta);
  }

  /**
   * @return the most general unifier of the atoms of two literals, or null if they don't unify.  Polarity is ignored;
   * callers decide whether they need equal or opposite polarity.
   */
  public static Substitution unifyLiterals(FolLiteral l1, FolLiteral l2)
  {
    return unifyAtoms(l1.getAtom(), l2.getAtom());
  }

  /**
   * One-way matching.  Finds a substitution that binds only variables of the pattern and makes the pattern equal to
   * the target.  The target's variables are treated as constants.
   *
   * @return the extended substitution, or null if there's no match.
   *
   * @param pattern - the general atom.
   * @param target  - the specific atom.
   * @param theta   - bindings for pattern variables made so far.
   */
  public static Substitution match(FolAtom pattern, FolAtom target, Substitution theta)
  {
    if ((pattern.getPredicate() != target.getPredicate()) || (pattern.arity() != target.arity()))
    {
      return null;
    }

    Substitution result = theta;
    for (int ii = 0; (ii < pattern.arity()) && (result != null); ii++)
    {
      result = matchTerms(pattern.get(ii), target.get(ii), result);
    }
    return result;
  }

  private static Substitution matchTerms(FolTerm pattern, FolTerm target, Substitution theta)
  {
    if (pattern instanceof FolVariable)
    {
      FolVariable variable = (FolVariable)pattern;
      FolTerm bound = theta.get(variable);
      if (bound == null)
      {
        return theta.extend(variable, target);
      }
      return bound.equals(target) ? theta : null;
    }
    else if (pattern instanceof FolConstant)
    {
      return pattern.equals(target) ? theta : null;
    }
    else if (pattern instanceof FolFunction)
    {
      if (!(target instanceof FolFunction))
      {
        return null;
      }
      FolFunction f1 = (FolFunction)pattern;
      FolFunction f2 = (FolFunction)target;
      if ((f1.getName() != f2.getName()) || (f1.arity() != f2.arity()))
      {
        return null;
      }

      Substitution result = theta;
      for (int ii = 0; (ii < f1.arity()) && (result != null); ii++)
      {
        result = matchTerms(f1.get(ii), f2.get(ii), result);
      }
      return result;
    }
    else
    {
      throw new IllegalStateException("Unknown term type: " + pattern.getClass().getName());
    }
  }

  private static Substitution solve(Deque<FolTerm[]> pending, Substitution theta)
  {
    while (!pending.isEmpty())
    {
      FolTerm[] pair = pending.pop();

      // Apply the bindings made so far to the next pair of work.
      FolTerm s = Substituter.substitute(pair[0], theta);
      FolTerm t = Substituter.substitute(pair[1], theta);

      if (s.equals(t))
      {
        continue;
      }

      if ((s instanceof FolVariable) && (t instanceof FolVariable))
      {
        FolVariable v1 = (FolVariable)s;
        FolVariable v2 = (FolVariable)t;
        theta = (v1.compareTo(v2) > 0) ? bind(theta, v1, v2) : bind(theta, v2, v1);
      }
      else if (s instanceof FolVariable)
      {
        if (t.contains((FolVariable)s))
        {
          return null;
        }
        theta = bind(theta, (FolVariable)s, t);
      }
      else if (t instanceof FolVariable)
      {
        if (s.contains((FolVariable)t))
        {
          return null;
        }
        theta = bind(theta, (FolVariable)t, s);
      }
      else if ((s instanceof FolFunction) && (t instanceof FolFunction))
      {
        FolFunction f1 = (FolFunction)s;
        FolFunction f2 = (FolFunction)t;
        if ((f1.getName() != f2.getName()) || (f1.arity() != f2.arity()))
        {
          return null;
        }
        pushArguments(pending, f1.getBody(), f2.getBody());
      }
      else
      {
        // Distinct constants, or a constant and a function.
        return null;
      }
    }

    return theta;
  }

  private static Substitution bind(Substitution theta, FolVariable variable, FolTerm term)
  {
    return theta.compose(Substitution.of(variable, term));
  }

  /**
   * Push argument pairs so that the leftmost pair is processed first.
   */
  private static void pushArguments(Deque<FolTerm[]> pending, List<FolTerm> left, List<FolTerm> right)
  {
    for (int ii = left.size() - 1; ii >= 0; ii--)
    {
      pending.push(new FolTerm[] {left.get(ii), right.get(ii)});
    }
  }
}
