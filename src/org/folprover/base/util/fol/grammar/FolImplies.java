package org.folprover.base.util.fol.grammar;

/**
 * An <i>implies</i> states that the left formula implies the right one.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolImplies extends FolBinary
{
  FolImplies(FolFormula left, FolFormula right)
  {
    super(left, right);
  }

  @Override
  protected String getOperator()
  {
    return "->";
  }
}
