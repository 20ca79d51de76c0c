package org.folprover.base.util.prover.resolution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

/**
 * A fixed size pool of threads for resolving clause pairs.
 *
 * The pairs of one search iteration are split into contiguous chunks, one per thread.  Workers only compute
 * resolvents; the search thread merges the results in partner order and is the only writer of the clause store.  A
 * worker that derives the empty clause sets the shared done flag, and the other workers stop at their next pair.
 */
public class ResolutionWorkerPool
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * ThreadContext key under which the proof attempt is logged.
   */
  public static final String LOG_CONTEXT_KEY = "proofID";

  private static final AtomicInteger sNextPoolIndex = new AtomicInteger(0);

  private final int             mNumThreads;
  private final ExecutorService mExecutor;

  /**
   * Create (and start) a pool of resolution workers.
   *
   * @param xiNumThreads - the number of worker threads.
   */
  public ResolutionWorkerPool(int xiNumThreads)
  {
    if (xiNumThreads < 1)
    {
      throw new IllegalArgumentException("A worker pool needs at least 1 thread, not " + xiNumThreads);
    }

    mNumThreads = xiNumThreads;
    final int lPoolIndex = sNextPoolIndex.incrementAndGet();
    mExecutor = Executors.newFixedThreadPool(xiNumThreads, new ThreadFactory()
    {
      private final AtomicInteger mNextThreadIndex = new AtomicInteger(0);

      @Override
      public Thread newThread(Runnable xiRunnable)
      {
        Thread lThread = new Thread(xiRunnable,
                                    "Resolution Worker " + lPoolIndex + "." + mNextThreadIndex.incrementAndGet());
        lThread.setDaemon(true);
        return lThread;
      }
    });
    LOGGER.info("Started " + xiNumThreads + " resolution workers");
  }

  public int getNumThreads()
  {
    return mNumThreads;
  }

  /**
   * Resolve a clause against each of a list of partners.
   *
   * @return the resolvents for each partner, in partner order.  If the done flag was set part way through, later
   * partners may have no resolvents.
   *
   * @param xiEngine   - the resolution engine.
   * @param xiGiven    - the clause to resolve.
   * @param xiPartners - the partners.
   * @param xiDone     - flag set when the empty clause is found (or the search is cancelled).
   */
  public List<List<Clause>> resolveAll(final ResolutionEngine xiEngine,
                                       final Clause xiGiven,
                                       List<Clause> xiPartners,
                                       final AtomicBoolean xiDone)
  {
    final String lLogName = ThreadContext.get(LOG_CONTEXT_KEY);
    int lChunkSize = (xiPartners.size() + mNumThreads - 1) / mNumThreads;

    List<Future<List<List<Clause>>>> lFutures = new ArrayList<>();
    for (int lStart = 0; lStart < xiPartners.size(); lStart += lChunkSize)
    {
      final List<Clause> lChunk = xiPartners.subList(lStart, Math.min(lStart + lChunkSize, xiPartners.size()));
      lFutures.add(mExecutor.submit(new Callable<List<List<Clause>>>()
      {
        @Override
        public List<List<Clause>> call()
        {
          if (lLogName != null)
          {
            ThreadContext.put(LOG_CONTEXT_KEY, lLogName);
          }
          try
          {
            return resolveChunk(xiEngine, xiGiven, lChunk, xiDone);
          }
          finally
          {
            ThreadContext.remove(LOG_CONTEXT_KEY);
          }
        }
      }));
    }

    List<List<Clause>> lResults = new ArrayList<>(xiPartners.size());
    for (Future<List<List<Clause>>> lFuture : lFutures)
    {
      try
      {
        lResults.addAll(lFuture.get());
      }
      catch (InterruptedException lEx)
      {
        Thread.currentThread().interrupt();
        xiDone.set(true);
        throw new IllegalStateException("Interrupted whilst waiting for resolution workers", lEx);
      }
      catch (ExecutionException lEx)
      {
        xiDone.set(true);
        throw new IllegalStateException("Resolution worker failed", lEx.getCause());
      }
    }

    return lResults;
  }

  private static List<List<Clause>> resolveChunk(ResolutionEngine xiEngine,
                                                 Clause xiGiven,
                                                 List<Clause> xiChunk,
                                                 AtomicBoolean xiDone)
  {
    List<List<Clause>> lResults = new ArrayList<>(xiChunk.size());
    for (Clause lPartner : xiChunk)
    {
      if (xiDone.get())
      {
        lResults.add(new ArrayList<Clause>());
        continue;
      }

      List<Clause> lResolvents = xiEngine.resolve(xiGiven, lPartner, xiDone);
      for (Clause lResolvent : lResolvents)
      {
        if (lResolvent.isEmpty())
        {
          LOGGER.debug("Found the empty clause resolving " + xiGiven.getId() + " with " + lPartner.getId());
          xiDone.set(true);
        }
      }
      lResults.add(lResolvents);
    }
    return lResults;
  }

  /**
   * Stop all resolution workers.
   */
  public void stop()
  {
    LOGGER.info("Stop resolution workers");

    mExecutor.shutdownNow();
    try
    {
      if (!mExecutor.awaitTermination(5, TimeUnit.SECONDS))
      {
        LOGGER.error("Failed to stop resolution workers");
      }
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Unexpectedly interrupted whilst stopping resolution workers");
      Thread.currentThread().interrupt();
    }

    LOGGER.info("Finished stopping resolution workers");
  }
}
