package org.folprover.base.util.prover.resolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Append-only arena of the clauses of one proof attempt.  Clauses are numbered from 1 in the order they're accepted,
 * so every clause has a larger id than its parents.
 *
 * New clauses are rejected if they are tautologies, variants of a stored clause (same canonical key, or a renaming
 * check for clauses whose literals tie on shape), or (optionally) subsumed by a stored clause.  Stored clauses are never changed or removed.
 *
 * A store has a single writer - the thread running the search.
 */
public class ClauseStore
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final List<Clause>         mClauses = new ArrayList<>();
  private final Map<String, Integer> mCanonicalIndex = new HashMap<>();
  private final boolean              mUseSubsumption;

  // Stored clauses with two literals of the same shape, by shape key.  Their canonical keys aren't enough to spot
  // variants.
  private final Map<String, List<Clause>> mTiedShapeIndex = new HashMap<>();

  private int mTautologiesRejected;
  private int mDuplicatesRejected;
  private int mSubsumedRejected;

  /**
   * @param xiUseSubsumption - whether to reject clauses subsumed by a stored clause.
   */
  public ClauseStore(boolean xiUseSubsumption)
  {
    mUseSubsumption = xiUseSubsumption;
  }

  /**
   * Offer a clause to the store.
   *
   * @return the clause as stored (with its id), or null if it was rejected.
   *
   * @param xiCandidate - an unnumbered clause.
   */
  public Clause admit(Clause xiCandidate)
  {
    if (xiCandidate.isTautology())
    {
      mTautologiesRejected++;
      return null;
    }

    String lKey = xiCandidate.getCanonicalKey();
    if (mCanonicalIndex.containsKey(lKey) || hasTiedShapeVariant(xiCandidate))
    {
      mDuplicatesRejected++;
      return null;
    }

    if (mUseSubsumption && isSubsumed(xiCandidate))
    {
      mSubsumedRejected++;
      return null;
    }

    Clause lClause = xiCandidate.withId(mClauses.size() + 1);
    mClauses.add(lClause);
    mCanonicalIndex.put(lKey, lClause.getId());
    if (lClause.hasTiedShapes())
    {
      List<Clause> lSameShape = mTiedShapeIndex.get(lClause.getShapeKey());
      if (lSameShape == null)
      {
        lSameShape = new ArrayList<>();
        mTiedShapeIndex.put(lClause.getShapeKey(), lSameShape);
      }
      lSameShape.add(lClause);
    }
    LOGGER.trace("Stored " + lClause);
    return lClause;
  }

  /**
   * @return whether a stored clause subsumes the specified clause.
   */
  public boolean isSubsumed(Clause xiClause)
  {
    for (Clause lStored : mClauses)
    {
      if (Subsumption.subsumes(lStored, xiClause))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return whether a variant of the specified clause is already stored.
   */
  public boolean containsVariant(Clause xiClause)
  {
    return mCanonicalIndex.containsKey(xiClause.getCanonicalKey()) || hasTiedShapeVariant(xiClause);
  }

  private boolean hasTiedShapeVariant(Clause xiClause)
  {
    if (!xiClause.hasTiedShapes())
    {
      return false;
    }

    List<Clause> lCandidates = mTiedShapeIndex.get(xiClause.getShapeKey());
    if (lCandidates != null)
    {
      for (Clause lStored : lCandidates)
      {
        if (Subsumption.isVariant(lStored, xiClause))
        {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * @return the clause with the specified id.
   */
  public Clause get(int xiId)
  {
    return mClauses.get(xiId - 1);
  }

  public int size()
  {
    return mClauses.size();
  }

  public List<Clause> getClauses()
  {
    return Collections.unmodifiableList(mClauses);
  }

  public int getTautologiesRejected()
  {
    return mTautologiesRejected;
  }

  public int getDuplicatesRejected()
  {
    return mDuplicatesRejected;
  }

  public int getSubsumedRejected()
  {
    return mSubsumedRejected;
  }
}
