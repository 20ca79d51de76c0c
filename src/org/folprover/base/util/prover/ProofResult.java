package org.folprover.base.util.prover;

import java.util.Collections;
import java.util.List;

/**
 * The result of a proof attempt.
 *
 * The trace is only present for {@link ProofOutcome#PROVED}.  It lists the derived clauses of the refutation in the
 * order they were derived, ending with the empty clause.  Input clauses appear only as parent ids.
 */
public final class ProofResult
{
  private final ProofOutcome    mOutcome;
  private final List<ProofStep> mTrace;
  private final int             mFinalClauseCount;
  private final int             mIterationsUsed;
  private final ResourceLimit   mExceededLimit;

  public ProofResult(ProofOutcome xiOutcome,
                     List<ProofStep> xiTrace,
                     int xiFinalClauseCount,
                     int xiIterationsUsed,
                     ResourceLimit xiExceededLimit)
  {
    assert(xiOutcome.isTerminal());
    assert((xiOutcome == ProofOutcome.RESOURCE_EXCEEDED) == (xiExceededLimit != null));

    mOutcome = xiOutcome;
    mTrace = Collections.unmodifiableList(xiTrace);
    mFinalClauseCount = xiFinalClauseCount;
    mIterationsUsed = xiIterationsUsed;
    mExceededLimit = xiExceededLimit;
  }

  public ProofOutcome getOutcome()
  {
    return mOutcome;
  }

  public boolean isProved()
  {
    return mOutcome == ProofOutcome.PROVED;
  }

  public List<ProofStep> getTrace()
  {
    return mTrace;
  }

  /**
   * @return the number of clauses in the clause store when the search stopped.
   */
  public int getFinalClauseCount()
  {
    return mFinalClauseCount;
  }

  public int getIterationsUsed()
  {
    return mIterationsUsed;
  }

  /**
   * @return the limit that stopped the search, or null if it didn't stop on a limit.
   */
  public ResourceLimit getExceededLimit()
  {
    return mExceededLimit;
  }

  @Override
  public String toString()
  {
    return mOutcome + ((mExceededLimit == null) ? "" : " (" + mExceededLimit + ")") + " after " + mIterationsUsed +
           " iterations with " + mFinalClauseCount + " clauses";
  }
}
