package org.folprover.base.util.prover.resolution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.folprover.base.util.fol.FolUtils;
import org.folprover.base.util.fol.grammar.FolConstant;
import org.folprover.base.util.fol.grammar.FolFunction;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolPool;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.Substituter;
import org.folprover.base.util.fol.model.Substitution;
import org.folprover.base.util.prover.InferenceRule;

/**
 * A clause: a set of literals, read as their disjunction.  The empty clause is a contradiction.
 *
 * Literals are held without duplicates, in an order that doesn't depend on variable names.  A clause also records
 * how it was made - the inference rule and the ids of its parents - so that proofs can be traced back.
 *
 * Clauses are created unnumbered; the {@link ClauseStore} assigns the id when it accepts one.
 */
public final class Clause
{
  /**
   * Id of a clause not (yet) in a clause store.
   */
  public static final int UNNUMBERED = 0;

  private static final Comparator<FolLiteral> LITERAL_ORDER = new Comparator<FolLiteral>()
  {
    @Override
    public int compare(FolLiteral xiFirst, FolLiteral xiSecond)
    {
      int lResult = shape(xiFirst).compareTo(shape(xiSecond));
      if (lResult == 0)
      {
        lResult = xiFirst.toString().compareTo(xiSecond.toString());
      }
      return lResult;
    }
  };

  private final int              mId;
  private final List<FolLiteral> mLiterals;
  private final InferenceRule    mRule;
  private final List<Integer>    mParentIds;
  private final int              mWeight;
  private String                 mCanonicalKey;
  private String                 mShapeKey;

  private Clause(int xiId, List<FolLiteral> xiLiterals, InferenceRule xiRule, List<Integer> xiParentIds)
  {
    mId = xiId;
    mLiterals = xiLiterals;
    mRule = xiRule;
    mParentIds = xiParentIds;

    int lWeight = 0;
    for (FolLiteral lLiteral : xiLiterals)
    {
      lWeight += lLiteral.getAtom().getSymbolCount();
    }
    mWeight = lWeight;
  }

  /**
   * Create an unnumbered clause.  Duplicate literals are collapsed.
   *
   * @param xiLiterals  - the literals.
   * @param xiRule      - the inference rule that produced the clause.
   * @param xiParentIds - the ids of the parent clauses (none for input clauses).
   */
  public static Clause create(Collection<FolLiteral> xiLiterals, InferenceRule xiRule, Integer... xiParentIds)
  {
    List<FolLiteral> lLiterals = new ArrayList<>(new LinkedHashSet<>(xiLiterals));
    Collections.sort(lLiterals, LITERAL_ORDER);
    return new Clause(UNNUMBERED,
                      Collections.unmodifiableList(lLiterals),
                      xiRule,
                      Collections.unmodifiableList(Arrays.asList(xiParentIds)));
  }

  /**
   * @return a copy of this clause with the specified id.
   */
  Clause withId(int xiId)
  {
    assert(mId == UNNUMBERED) : "Clause " + mId + " is already numbered";
    Clause lClause = new Clause(xiId, mLiterals, mRule, mParentIds);
    lClause.mCanonicalKey = mCanonicalKey;
    lClause.mShapeKey = mShapeKey;
    return lClause;
  }

  /**
   * @return a copy of this clause with a variable renaming applied.  Keeps the id and derivation.
   *
   * @param xiRenaming - a renaming that maps distinct variables to distinct variables.
   */
  Clause rename(Substitution xiRenaming)
  {
    return new Clause(mId,
                      Collections.unmodifiableList(Substituter.substitute(mLiterals, xiRenaming)),
                      mRule,
                      mParentIds);
  }

  public int getId()
  {
    return mId;
  }

  public List<FolLiteral> getLiterals()
  {
    return mLiterals;
  }

  public FolLiteral get(int xiIndex)
  {
    return mLiterals.get(xiIndex);
  }

  public int size()
  {
    return mLiterals.size();
  }

  public boolean isEmpty()
  {
    return mLiterals.isEmpty();
  }

  public InferenceRule getRule()
  {
    return mRule;
  }

  public List<Integer> getParentIds()
  {
    return mParentIds;
  }

  /**
   * @return the total number of symbols in the clause.  Used to pick lighter clauses first.
   */
  public int getWeight()
  {
    return mWeight;
  }

  /**
   * @return whether the clause contains a literal and its exact complement.
   */
  public boolean isTautology()
  {
    for (int lii = 0; lii < mLiterals.size(); lii++)
    {
      for (int ljj = lii + 1; ljj < mLiterals.size(); ljj++)
      {
        if (mLiterals.get(lii).isComplementOf(mLiterals.get(ljj)))
        {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * @return the variables of the clause, in order of first appearance.
   */
  public Set<FolVariable> getVariables()
  {
    return FolUtils.getVariables(mLiterals);
  }

  /**
   * @return a string that is the same for this clause and any clause that differs from it only by a renaming of
   * variables, provided that no two literals have the same shape (see {@link #hasTiedShapes()}).
   */
  public String getCanonicalKey()
  {
    if (mCanonicalKey == null)
    {
      // Rename by first appearance, re-order on the renamed form, then rename again so the numbering follows the
      // final order.
      List<FolLiteral> lLiterals = canonicallyRenamed(mLiterals);
      Collections.sort(lLiterals, LITERAL_ORDER);
      lLiterals = canonicallyRenamed(lLiterals);

      StringBuilder lKey = new StringBuilder();
      for (FolLiteral lLiteral : lLiterals)
      {
        lKey.append(lLiteral).append(" | ");
      }
      mCanonicalKey = lKey.toString();
    }
    return mCanonicalKey;
  }

  /**
   * @return the shapes of the literals (each literal with its variables blanked out), in order.  Variants have the same
   * shape key.
   */
  public String getShapeKey()
  {
    if (mShapeKey == null)
    {
      StringBuilder lKey = new StringBuilder();
      for (FolLiteral lLiteral : mLiterals)
      {
        lKey.append(shape(lLiteral)).append(" | ");
      }
      mShapeKey = lKey.toString();
    }
    return mShapeKey;
  }

  /**
   * @return whether two literals of the clause have the same shape.  For such clauses the order of the tied literals
   * depends on variable names, so the canonical key can differ between variants.
   */
  public boolean hasTiedShapes()
  {
    // Literals are sorted by shape, so ties are adjacent.
    for (int lii = 1; lii < mLiterals.size(); lii++)
    {
      if (shape(mLiterals.get(lii - 1)).equals(shape(mLiterals.get(lii))))
      {
        return true;
      }
    }
    return false;
  }

  private static List<FolLiteral> canonicallyRenamed(List<FolLiteral> xiLiterals)
  {
    Map<FolVariable, FolTerm> lRenaming = new HashMap<>();
    for (FolVariable lVariable : FolUtils.getVariables(xiLiterals))
    {
      lRenaming.put(lVariable, FolPool.getVariable("V" + lRenaming.size()));
    }
    return Substituter.substitute(xiLiterals, Substitution.of(lRenaming));
  }

  /**
   * @return a description of a literal with every variable replaced by "?".
   */
  private static String shape(FolLiteral xiLiteral)
  {
    StringBuilder lShape = new StringBuilder();
    lShape.append(xiLiteral.isPositive() ? '+' : '-').append(xiLiteral.getAtom().getPredicate()).append('(');
    for (FolTerm lTerm : xiLiteral.getAtom().getBody())
    {
      appendShape(lTerm, lShape);
      lShape.append(',');
    }
    return lShape.append(')').toString();
  }

  private static void appendShape(FolTerm xiTerm, StringBuilder xiShape)
  {
    if (xiTerm instanceof FolVariable)
    {
      xiShape.append('?');
    }
    else if (xiTerm instanceof FolConstant)
    {
      xiShape.append(((FolConstant)xiTerm).getName());
    }
    else if (xiTerm instanceof FolFunction)
    {
      FolFunction lFunction = (FolFunction)xiTerm;
      xiShape.append(lFunction.getName()).append('(');
      for (FolTerm lArgument : lFunction.getBody())
      {
        appendShape(lArgument, xiShape);
        xiShape.append(',');
      }
      xiShape.append(')');
    }
    else
    {
      throw new IllegalStateException("Unknown term type: " + xiTerm.getClass().getName());
    }
  }

  /**
   * @return the literals, joined with " | ", or "[]" for the empty clause.
   */
  public String literalsToString()
  {
    if (mLiterals.isEmpty())
    {
      return "[]";
    }

    StringBuilder lBuilder = new StringBuilder();
    for (int lii = 0; lii < mLiterals.size(); lii++)
    {
      if (lii > 0)
      {
        lBuilder.append(" | ");
      }
      lBuilder.append(mLiterals.get(lii));
    }
    return lBuilder.toString();
  }

  @Override
  public String toString()
  {
    return mId + ": " + literalsToString();
  }
}
