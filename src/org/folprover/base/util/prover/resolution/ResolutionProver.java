package org.folprover.base.util.prover.resolution;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.folprover.base.util.configuration.ProverConfiguration;
import org.folprover.base.util.configuration.ProverConfiguration.CfgItem;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.fol.transforms.CnfConverter;
import org.folprover.base.util.prover.ProofResult;
import org.folprover.base.util.prover.Prover;
import org.folprover.base.util.prover.ResourceLimits;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;

/**
 * Prover that answers queries by resolution refutation: the knowledge base and the negated query are converted to
 * clauses and searched for a contradiction.
 *
 * If more than one resolution thread is configured, the prover owns a pool of worker threads, which must be released
 * with {@link #stop()}.
 */
public class ResolutionProver implements Prover
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final AtomicLong sNextProofId = new AtomicLong(0);

  private final ResourceLimits       mDefaultLimits;
  private final boolean              mUseSubsumption;
  private final ResolutionWorkerPool mWorkerPool;

  /**
   * Create a prover using the configured limits and thread count.
   */
  public ResolutionProver()
  {
    this(ResourceLimits.fromConfiguration());
    ProverConfiguration.logConfig();
  }

  /**
   * Create a prover with the specified default limits, using the configured thread count.
   *
   * @param xiDefaultLimits - limits for proofs that don't specify their own.
   */
  public ResolutionProver(ResourceLimits xiDefaultLimits)
  {
    this(xiDefaultLimits, ProverConfiguration.getCfgInt(CfgItem.RESOLUTION_THREADS));
  }

  /**
   * @param xiDefaultLimits - limits for proofs that don't specify their own.
   * @param xiNumThreads    - the number of threads to resolve clause pairs on.
   */
  public ResolutionProver(ResourceLimits xiDefaultLimits, int xiNumThreads)
  {
    mDefaultLimits = xiDefaultLimits;
    mUseSubsumption = ProverConfiguration.getCfgBool(CfgItem.USE_SUBSUMPTION);
    mWorkerPool = (xiNumThreads > 1) ? new ResolutionWorkerPool(xiNumThreads) : null;
    LOGGER.debug("Created prover with " + xiDefaultLimits + " on " +
                 ((mWorkerPool == null) ? 1 : mWorkerPool.getNumThreads()) + " thread(s)");
  }

  @Override
  public ProofResult prove(List<FolFormula> xiKnowledgeBase, FolFormula xiQuery) throws InvalidFormulaException
  {
    return prove(xiKnowledgeBase, xiQuery, mDefaultLimits);
  }

  @Override
  public ProofResult prove(List<FolFormula> xiKnowledgeBase,
                           FolFormula xiQuery,
                           ResourceLimits xiLimits) throws InvalidFormulaException
  {
    String lProofId = "Proof." + sNextProofId.incrementAndGet();
    String lOldLogName = ThreadContext.get(ResolutionWorkerPool.LOG_CONTEXT_KEY);
    ThreadContext.put(ResolutionWorkerPool.LOG_CONTEXT_KEY, lProofId);
    try
    {
      LOGGER.info("Proving " + xiQuery + " from " + xiKnowledgeBase.size() + " formulas");
      long lStart = System.currentTimeMillis();

      ProofResult lResult = createSearch(xiKnowledgeBase, xiQuery, xiLimits).run();

      LOGGER.info("Result: " + lResult + " in " + (System.currentTimeMillis() - lStart) + "ms");
      if (lResult.isProved())
      {
        LOGGER.debug("Proof: " + lResult.getTrace());
      }
      return lResult;
    }
    finally
    {
      if (lOldLogName == null)
      {
        ThreadContext.remove(ResolutionWorkerPool.LOG_CONTEXT_KEY);
      }
      else
      {
        ThreadContext.put(ResolutionWorkerPool.LOG_CONTEXT_KEY, lOldLogName);
      }
    }
  }

  @Override
  public boolean entails(List<FolFormula> xiKnowledgeBase, FolFormula xiQuery) throws InvalidFormulaException
  {
    return prove(xiKnowledgeBase, xiQuery).isProved();
  }

  /**
   * Set up a search without running it, for callers that want to drive it step by step, inspect it, or cancel it
   * from another thread.
   *
   * @return the search.
   *
   * @param xiKnowledgeBase - the knowledge base.
   * @param xiQuery         - the query.
   * @param xiLimits        - the resource limits.
   *
   * @throws InvalidFormulaException if any formula is malformed.
   */
  public SaturationSearch createSearch(List<FolFormula> xiKnowledgeBase,
                                       FolFormula xiQuery,
                                       ResourceLimits xiLimits) throws InvalidFormulaException
  {
    ScopeCounter lCounter = new ScopeCounter();
    List<List<FolLiteral>> lClauses = new CnfConverter(lCounter).toClauses(xiKnowledgeBase, xiQuery);
    return new SaturationSearch(lClauses, xiLimits, lCounter, mWorkerPool, mUseSubsumption);
  }

  /**
   * Stop the worker threads, if any.
   */
  public void stop()
  {
    if (mWorkerPool != null)
    {
      mWorkerPool.stop();
    }
  }
}
