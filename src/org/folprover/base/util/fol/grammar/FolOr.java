package org.folprover.base.util.fol.grammar;

/**
 * An <i>or</i> is the <i>disjunction</i> of two formulas.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolOr extends FolBinary
{
  FolOr(FolFormula left, FolFormula right)
  {
    super(left, right);
  }

  @Override
  protected String getOperator()
  {
    return "|";
  }
}
