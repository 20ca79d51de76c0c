package org.folprover.base.util.prover.resolution;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.Substitution;
import org.folprover.base.util.fol.unify.Unifier;

/**
 * Clause subsumption.  A clause C subsumes a clause D if there's a substitution θ with Cθ ⊆ D and C has no more
 * literals than D.  A subsumed clause adds nothing to a refutation search.
 */
public final class Subsumption
{
  private Subsumption()
  {
  }

  /**
   * @return whether the general clause subsumes the specific one.
   */
  public static boolean subsumes(Clause general, Clause specific)
  {
    if (general.size() > specific.size())
    {
      return false;
    }
    return matchFrom(general.getLiterals(), 0, specific.getLiterals(), Substitution.EMPTY);
  }

  /**
   * @return whether the clauses differ only by a renaming of variables.
   */
  public static boolean isVariant(Clause first, Clause second)
  {
    if (first.size() != second.size())
    {
      return false;
    }
    return renameFrom(first.getLiterals(),
                      0,
                      second.getLiterals(),
                      new boolean[second.size()],
                      Substitution.EMPTY);
  }

  /**
   * Map each literal of the first clause to a distinct literal of the second, accepting only a complete mapping whose
   * substitution is an injective renaming of variables.
   */
  private static boolean renameFrom(List<FolLiteral> first,
                                    int index,
                                    List<FolLiteral> second,
                                    boolean[] used,
                                    Substitution theta)
  {
    if (index == first.size())
    {
      return isRenaming(theta);
    }

    FolLiteral literal = first.get(index);
    for (int ii = 0; ii < second.size(); ii++)
    {
      FolLiteral target = second.get(ii);
      if (used[ii] || (target.isPositive() != literal.isPositive()))
      {
        continue;
      }

      Substitution extended = Unifier.match(literal.getAtom(), target.getAtom(), theta);
      if (extended != null)
      {
        used[ii] = true;
        boolean found = renameFrom(first, index + 1, second, used, extended);
        used[ii] = false;
        if (found)
        {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean isRenaming(Substitution theta)
  {
    Set<FolTerm> images = new HashSet<>();
    for (FolTerm image : theta.getBindings().values())
    {
      if (!(image instanceof FolVariable) || !images.add(image))
      {
        return false;
      }
    }
    return true;
  }

  /**
   * Try to map general literals from the specified index onwards into the specific literals, backtracking over the
   * choice of target for each one.
   */
  private static boolean matchFrom(List<FolLiteral> general,
                                   int index,
                                   List<FolLiteral> specific,
                                   Substitution theta)
  {
    if (index == general.size())
    {
      return true;
    }

    FolLiteral literal = general.get(index);
    for (FolLiteral target : specific)
    {
      if (target.isPositive() != literal.isPositive())
      {
        continue;
      }

      Substitution extended = Unifier.match(literal.getAtom(), target.getAtom(), theta);
      if ((extended != null) && matchFrom(general, index + 1, specific, extended))
      {
        return true;
      }
    }
    return false;
  }
}
