package org.folprover.base.util.prover.exceptions;

/**
 * Abstract class for exceptions that are a result of bad formulas supplied by the caller.
 */
public abstract class FormulaException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected FormulaException(String xiMessage)
  {
    super(xiMessage);
  }
}
