package org.folprover.base.util.prover;

/**
 * The result of a proof attempt.  {@link #RUNNING} is only seen while a search is in progress.
 */
public enum ProofOutcome
{
  /**
   * The search is still in progress.
   */
  RUNNING,

  /**
   * The empty clause was derived: the query follows from the knowledge base.
   */
  PROVED,

  /**
   * The clause set is saturated without a contradiction: the query does not follow from the knowledge base.
   */
  NOT_PROVED,

  /**
   * A resource limit was reached first.  Nothing can be concluded about the query.
   */
  RESOURCE_EXCEEDED;

  /**
   * @return whether this is a final outcome.
   */
  public boolean isTerminal()
  {
    return this != RUNNING;
  }
}
