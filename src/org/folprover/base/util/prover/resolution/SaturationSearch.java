package org.folprover.base.util.prover.resolution;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.prover.InferenceRule;
import org.folprover.base.util.prover.ProofOutcome;
import org.folprover.base.util.prover.ProofResult;
import org.folprover.base.util.prover.ProofStep;
import org.folprover.base.util.prover.ResourceLimit;
import org.folprover.base.util.prover.ResourceLimits;

import gnu.trove.set.hash.TLongHashSet;

/**
 * Refutation search by saturation, using the given-clause algorithm.
 *
 * Clauses wait in a work queue, lightest first (ties broken by id).  Each iteration takes the next clause from the
 * queue (the "given" clause), makes it active, and offers the clause store its factors and its resolvents with every
 * active clause, itself included.  A processed-pairs index guarantees that each pair of clauses is resolved at most
 * once.  Every pair of clauses that survives in the store is eventually resolved.
 *
 * The search ends when:
 * <ul>
 * <li>the empty clause is derived - {@link ProofOutcome#PROVED};
 * <li>the queue is empty at the start of an iteration, so the clause set is saturated -
 *     {@link ProofOutcome#NOT_PROVED};
 * <li>a resource limit is reached, or the search is cancelled - {@link ProofOutcome#RESOURCE_EXCEEDED}.
 * </ul>
 *
 * The search can be driven one iteration at a time with {@link #step()} and inspected in between, or run to the end
 * with {@link #run()}.
 */
public class SaturationSearch
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Comparator<Clause> QUEUE_ORDER = new Comparator<Clause>()
  {
    @Override
    public int compare(Clause xiFirst, Clause xiSecond)
    {
      int lResult = Integer.compare(xiFirst.getWeight(), xiSecond.getWeight());
      if (lResult == 0)
      {
        lResult = Integer.compare(xiFirst.getId(), xiSecond.getId());
      }
      return lResult;
    }
  };

  private final ResourceLimits        mLimits;
  private final ResolutionEngine      mEngine;
  private final ResolutionWorkerPool  mWorkerPool;
  private final ClauseStore           mStore;
  private final PriorityQueue<Clause> mQueue = new PriorityQueue<>(64, QUEUE_ORDER);
  private final List<Clause>          mActive = new ArrayList<>();
  private final TLongHashSet          mProcessedPairs = new TLongHashSet();
  private final AtomicBoolean         mDone = new AtomicBoolean(false);
  private final long                  mStartTime;
  private final long                  mTimeBudgetNanos;

  private volatile boolean            mCancelled;
  private ProofOutcome                mState = ProofOutcome.RUNNING;
  private ResourceLimit               mExceededLimit;
  private Clause                      mEmptyClause;
  private int                         mIterations;

  /**
   * Create a search over an input clause set.
   *
   * @param xiInputClauses   - the literals of each input clause.
   * @param xiLimits         - the resource limits.
   * @param xiCounter        - the scope counter used to produce the input clauses.
   * @param xiWorkerPool     - worker threads for resolving pairs, or null to resolve on the calling thread.
   * @param xiUseSubsumption - whether to discard clauses subsumed by stored clauses.
   */
  public SaturationSearch(List<List<FolLiteral>> xiInputClauses,
                          ResourceLimits xiLimits,
                          ScopeCounter xiCounter,
                          ResolutionWorkerPool xiWorkerPool,
                          boolean xiUseSubsumption)
  {
    mLimits = xiLimits;
    mEngine = new ResolutionEngine(xiCounter);
    mWorkerPool = xiWorkerPool;
    mStore = new ClauseStore(xiUseSubsumption);
    mStartTime = System.nanoTime();
    mTimeBudgetNanos = toNanosSaturated(xiLimits.getTimeBudget());

    for (List<FolLiteral> lLiterals : xiInputClauses)
    {
      Clause lClause = mStore.admit(Clause.create(lLiterals, InferenceRule.INPUT));
      if (lClause == null)
      {
        continue;
      }

      if (lClause.isEmpty())
      {
        mEmptyClause = lClause;
        finish(ProofOutcome.PROVED, null);
        break;
      }
      mQueue.add(lClause);
    }

    LOGGER.debug("Search starts with " + mStore.size() + " input clauses (" + xiLimits + ")");
  }

  /**
   * Run the search until it ends.
   *
   * @return the result.
   */
  public ProofResult run()
  {
    while (step() == ProofOutcome.RUNNING)
    {
      // Keep going.
    }
    return getResult();
  }

  /**
   * Run one iteration of the search (or just detect that it has ended).
   *
   * @return the state of the search after the iteration.
   */
  public synchronized ProofOutcome step()
  {
    if (mState.isTerminal())
    {
      return mState;
    }

    if (mCancelled)
    {
      return finish(ProofOutcome.RESOURCE_EXCEEDED, ResourceLimit.CANCELLED);
    }

    if (mQueue.isEmpty())
    {
      return finish(ProofOutcome.NOT_PROVED, null);
    }

    ResourceLimit lLimit = checkLimits();
    if (lLimit != null)
    {
      return finish(ProofOutcome.RESOURCE_EXCEEDED, lLimit);
    }

    Clause lGiven = mQueue.poll();
    mIterations++;
    mActive.add(lGiven);

    List<Clause> lPartners = new ArrayList<>();
    for (Clause lActive : mActive)
    {
      if (mProcessedPairs.add(pairKey(lGiven.getId(), lActive.getId())))
      {
        lPartners.add(lActive);
      }
    }

    List<Clause> lCandidates = new ArrayList<>(mEngine.factor(lGiven));
    lCandidates.addAll(resolveAgainst(lGiven, lPartners));

    int lAdded = 0;
    for (Clause lCandidate : lCandidates)
    {
      Clause lClause = mStore.admit(lCandidate);
      if (lClause == null)
      {
        continue;
      }

      if (lClause.isEmpty())
      {
        mEmptyClause = lClause;
        LOGGER.debug("Iteration " + mIterations + ": given " + lGiven + " derived the empty clause");
        return finish(ProofOutcome.PROVED, null);
      }

      mQueue.add(lClause);
      lAdded++;
    }

    LOGGER.debug("Iteration " + mIterations + ": given " + lGiven + ", " + lPartners.size() + " partners, " +
                 lCandidates.size() + " candidates, " + lAdded + " new clauses");
    return mState;
  }

  private List<Clause> resolveAgainst(Clause xiGiven, List<Clause> xiPartners)
  {
    List<Clause> lResolvents = new ArrayList<>();

    if ((mWorkerPool != null) && (xiPartners.size() > 1))
    {
      for (List<Clause> lPartnerResolvents : mWorkerPool.resolveAll(mEngine, xiGiven, xiPartners, mDone))
      {
        lResolvents.addAll(lPartnerResolvents);
      }
      return lResolvents;
    }

    for (Clause lPartner : xiPartners)
    {
      if (mDone.get())
      {
        break;
      }

      List<Clause> lPartnerResolvents = mEngine.resolve(xiGiven, lPartner, mDone);
      lResolvents.addAll(lPartnerResolvents);
      if (!lPartnerResolvents.isEmpty() && lPartnerResolvents.get(lPartnerResolvents.size() - 1).isEmpty())
      {
        break;
      }
    }
    return lResolvents;
  }

  /**
   * @return the first resource limit that has been reached, or null if none has.
   */
  private ResourceLimit checkLimits()
  {
    if (mIterations >= mLimits.getMaxIterations())
    {
      return ResourceLimit.ITERATIONS;
    }
    if (mStore.size() > mLimits.getMaxClauses())
    {
      return ResourceLimit.CLAUSES;
    }
    if (System.nanoTime() - mStartTime > mTimeBudgetNanos)
    {
      return ResourceLimit.TIME;
    }
    return null;
  }

  /**
   * @return the duration in nanoseconds, or Long.MAX_VALUE if it's too long to fit.
   */
  private static long toNanosSaturated(Duration xiDuration)
  {
    try
    {
      return xiDuration.toNanos();
    }
    catch (ArithmeticException lEx)
    {
      return Long.MAX_VALUE;
    }
  }

    private ProofOutcome finish(ProofOutcome xiOutcome, ResourceLimit xiLimit)
  {
    mState = xiOutcome;
    mExceededLimit = xiLimit;
    mDone.set(true);
    LOGGER.debug("Search finished: " + xiOutcome + ((xiLimit == null) ? "" : " (" + xiLimit + ")") + " after " +
                 mIterations + " iterations with " + mStore.size() + " clauses");
    return mState;
  }

  /**
   * Ask the search to stop.  May be called from any thread.  Workers stop at their next clause pair, and the search
   * ends with {@link ProofOutcome#RESOURCE_EXCEEDED} at its next step.
   */
  public void cancel()
  {
    mCancelled = true;
    mDone.set(true);
  }

  /**
   * @return the result of the search.
   *
   * @throws IllegalStateException if the search hasn't ended.
   */
  public synchronized ProofResult getResult()
  {
    if (!mState.isTerminal())
    {
      throw new IllegalStateException("The search is still running");
    }

    List<ProofStep> lTrace = (mState == ProofOutcome.PROVED) ? buildTrace() : Collections.<ProofStep>emptyList();
    return new ProofResult(mState, lTrace, mStore.size(), mIterations, mExceededLimit);
  }

  /**
   * Walk back from the empty clause through the parent links, collecting every derived clause of the refutation.
   */
  private List<ProofStep> buildTrace()
  {
    TreeMap<Integer, Clause> lDerived = new TreeMap<>();
    Set<Integer> lVisited = new HashSet<>();
    Deque<Integer> lToVisit = new ArrayDeque<>();
    lToVisit.push(mEmptyClause.getId());

    while (!lToVisit.isEmpty())
    {
      int lId = lToVisit.pop();
      if (!lVisited.add(lId))
      {
        continue;
      }

      Clause lClause = mStore.get(lId);
      if (lClause.getRule() != InferenceRule.INPUT)
      {
        lDerived.put(lId, lClause);
      }
      for (Integer lParentId : lClause.getParentIds())
      {
        lToVisit.push(lParentId);
      }
    }

    // Parents always have smaller ids than their children, so id order is derivation order.
    List<ProofStep> lTrace = new ArrayList<>(lDerived.size());
    for (Clause lClause : lDerived.values())
    {
      lTrace.add(new ProofStep(lClause));
    }
    return lTrace;
  }

  private static long pairKey(int xiFirstId, int xiSecondId)
  {
    int lLow = Math.min(xiFirstId, xiSecondId);
    int lHigh = Math.max(xiFirstId, xiSecondId);
    return ((long)lLow << 32) | (lHigh & 0xFFFFFFFFL);
  }

  public synchronized ProofOutcome getState()
  {
    return mState;
  }

  public synchronized int getIterations()
  {
    return mIterations;
  }

  /**
   * @return the clause store.  Only safe to read between steps.
   */
  public ClauseStore getClauseStore()
  {
    return mStore;
  }

  /**
   * @return the number of clauses waiting to be given.
   */
  public synchronized int getQueueSize()
  {
    return mQueue.size();
  }

  /**
   * @return the number of clause pairs resolved so far.
   */
  public synchronized int getProcessedPairCount()
  {
    return mProcessedPairs.size();
  }
}
