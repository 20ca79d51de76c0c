package org.folprover.base.util.fol.model;

import java.util.ArrayList;
import java.util.List;

import org.folprover.base.util.fol.grammar.FolAtom;
import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFunction;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolPool;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;

/**
 * Applies substitutions.  Every binding is applied simultaneously: the replacement terms are not themselves rewritten.
 */
public final class Substituter
{
  private Substituter()
  {
    // Static utility only.
  }

  public static FolTerm substitute(FolTerm term, Substitution theta)
  {
    if (theta.isEmpty() || term.isGround())
    {
      return term;
    }
    return substituteTerm(term, theta);
  }

  public static FolAtom substitute(FolAtom atom, Substitution theta)
  {
    if (theta.isEmpty() || atom.isGround())
    {
      return atom;
    }

    List<FolTerm> body = new ArrayList<>(atom.arity());
    for (FolTerm term : atom.getBody())
    {
      body.add(substituteTerm(term, theta));
    }
    return FolPool.getAtom(atom.getPredicate(), body);
  }

  public static FolLiteral substitute(FolLiteral literal, Substitution theta)
  {
    FolAtom atom = substitute(literal.getAtom(), theta);
    if (atom == literal.getAtom())
    {
      return literal;
    }
    return FolPool.getLiteral(atom, literal.isPositive());
  }

  public static List<FolLiteral> substitute(List<FolLiteral> literals, Substitution theta)
  {
    List<FolLiteral> result = new ArrayList<>(literals.size());
    for (FolLiteral literal : literals)
    {
      result.add(substitute(literal, theta));
    }
    return result;
  }

  private static FolTerm substituteTerm(FolTerm term, Substitution theta)
  {
    if (term instanceof FolVariable)
    {
      FolTerm value = theta.get((FolVariable)term);
      return (value == null) ? term : value;
    }
    else if (term instanceof FolConstant)
    {
      return term;
    }
    else if (term instanceof FolFunction)
    {
      FolFunction function = (FolFunction)term;
      if (function.isGround())
      {
        return function;
      }

      List<FolTerm> body = new ArrayList<>(function.arity());
      for (FolTerm argument : function.getBody())
      {
        body.add(substituteTerm(argument, theta));
      }
      return FolPool.getFunction(function.getName(), body);
    }
    else
    {
      throw new IllegalStateException("Unknown term type: " + term.getClass().getName());
    }
  }
}
