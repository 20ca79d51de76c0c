package org.folprover.base.util.prover.exceptions;

import org.folprover.base.util.fol.grammar.FolFormula;

/**
 * Thrown when a formula breaks the contract for input to the clausal-form conversion - for example, a quantifier that
 * re-binds a variable already bound by an enclosing quantifier.
 */
public class InvalidFormulaException extends FormulaException
{
  private static final long serialVersionUID = 1L;

  private final transient FolFormula mFormula;

  /**
   * @param xiProblem - what's wrong.
   * @param xiFormula - the input formula containing the problem (may be null if the formula itself is missing).
   */
  public InvalidFormulaException(String xiProblem, FolFormula xiFormula)
  {
    super(xiProblem + ((xiFormula == null) ? "" : " in " + xiFormula));
    mFormula = xiFormula;
  }

  /**
   * @return the offending input formula, or null.
   */
  public FolFormula getFormula()
  {
    return mFormula;
  }
}
