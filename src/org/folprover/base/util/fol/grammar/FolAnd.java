package org.folprover.base.util.fol.grammar;

/**
 * An <i>and</i> is the <i>conjunction</i> of two formulas.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolAnd extends FolBinary
{
  FolAnd(FolFormula left, FolFormula right)
  {
    super(left, right);
  }

  @Override
  protected String getOperator()
  {
    return "&";
  }
}
