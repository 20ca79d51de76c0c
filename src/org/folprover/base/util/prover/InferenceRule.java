package org.folprover.base.util.prover;

/**
 * How a clause came to be in the clause store.
 */
public enum InferenceRule
{
  /**
   * Produced by clausal-form conversion of the knowledge base or the negated query.
   */
  INPUT,

  /**
   * Binary resolution of two parent clauses.
   */
  RESOLUTION,

  /**
   * Factoring of a single parent clause.
   */
  FACTOR
}
