package org.folprover.base.util.prover.exceptions;

/**
 * Thrown when a generated Skolem symbol clashes with a symbol already in use.  This is a defect in the symbol
 * generator, not a problem with the input.  The conversion is abandoned.
 */
public class SkolemCollisionException extends IllegalStateException
{
  private static final long serialVersionUID = 1L;

  public SkolemCollisionException(String xiSymbol)
  {
    super("Generated Skolem symbol '" + xiSymbol + "' is already in use");
  }
}
