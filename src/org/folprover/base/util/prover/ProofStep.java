package org.folprover.base.util.prover;

import java.util.List;

import org.folprover.base.util.prover.resolution.Clause;

/**
 * One derivation in a proof trace: a clause, the rule that produced it and the ids of its parents.
 */
public final class ProofStep
{
  private final Clause mClause;

  public ProofStep(Clause xiClause)
  {
    mClause = xiClause;
  }

  public int getClauseId()
  {
    return mClause.getId();
  }

  public InferenceRule getRule()
  {
    return mClause.getRule();
  }

  public List<Integer> getParentIds()
  {
    return mClause.getParentIds();
  }

  public Clause getClause()
  {
    return mClause;
  }

  @Override
  public String toString()
  {
    return mClause.getId() + ": " + mClause.literalsToString() + " <- " + mClause.getRule() + " " +
           mClause.getParentIds();
  }
}
