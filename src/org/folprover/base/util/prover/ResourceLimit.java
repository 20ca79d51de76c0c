package org.folprover.base.util.prover;

/**
 * The resource limits that can stop a proof attempt.
 */
public enum ResourceLimit
{
  ITERATIONS,
  CLAUSES,
  TIME,

  /**
   * The search was cancelled by its owner.
   */
  CANCELLED
}
