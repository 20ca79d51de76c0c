package org.folprover.base.util.prover;

import java.time.Duration;

import org.folprover.base.util.configuration.ProverConfiguration;
import org.folprover.base.util.configuration.ProverConfiguration.CfgItem;

/**
 * The bounds on a proof attempt.  Each is checked independently; whichever is reached first ends the search with
 * {@link ProofOutcome#RESOURCE_EXCEEDED}.
 */
public final class ResourceLimits
{
  private final int      mMaxIterations;
  private final int      mMaxClauses;
  private final Duration mTimeBudget;

  /**
   * @param xiMaxIterations - the maximum number of search iterations.
   * @param xiMaxClauses    - the maximum number of clauses in the clause store.
   * @param xiTimeBudget    - the maximum wall-clock time.
   */
  public ResourceLimits(int xiMaxIterations, int xiMaxClauses, Duration xiTimeBudget)
  {
    if (xiMaxIterations < 0)
    {
      throw new IllegalArgumentException("maxIterations must not be negative: " + xiMaxIterations);
    }
    if (xiMaxClauses < 0)
    {
      throw new IllegalArgumentException("maxClauses must not be negative: " + xiMaxClauses);
    }
    if ((xiTimeBudget == null) || xiTimeBudget.isNegative())
    {
      throw new IllegalArgumentException("timeBudget must be a non-negative duration: " + xiTimeBudget);
    }

    mMaxIterations = xiMaxIterations;
    mMaxClauses = xiMaxClauses;
    mTimeBudget = xiTimeBudget;
  }

  /**
   * @return the limits configured in {@link ProverConfiguration}.
   */
  public static ResourceLimits fromConfiguration()
  {
    return new ResourceLimits(ProverConfiguration.getCfgInt(CfgItem.MAX_ITERATIONS),
                              ProverConfiguration.getCfgInt(CfgItem.MAX_CLAUSES),
                              Duration.ofMillis(ProverConfiguration.getCfgInt(CfgItem.TIME_BUDGET_MS)));
  }

  public int getMaxIterations()
  {
    return mMaxIterations;
  }

  public int getMaxClauses()
  {
    return mMaxClauses;
  }

  public Duration getTimeBudget()
  {
    return mTimeBudget;
  }

  public ResourceLimits withMaxIterations(int xiMaxIterations)
  {
    return new ResourceLimits(xiMaxIterations, mMaxClauses, mTimeBudget);
  }

  public ResourceLimits withMaxClauses(int xiMaxClauses)
  {
    return new ResourceLimits(mMaxIterations, xiMaxClauses, mTimeBudget);
  }

  public ResourceLimits withTimeBudget(Duration xiTimeBudget)
  {
    return new ResourceLimits(mMaxIterations, mMaxClauses, xiTimeBudget);
  }

  @Override
  public String toString()
  {
    return "maxIterations=" + mMaxIterations + ", maxClauses=" + mMaxClauses + ", timeBudget=" + mTimeBudget;
  }
}
