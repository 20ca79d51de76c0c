package org.folprover.base.util.fol.grammar;

/**
 * An <i>iff</i> states that two formulas are equivalent.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolIff extends FolBinary
{
  FolIff(FolFormula left, FolFormula right)
  {
    super(left, right);
  }

  @Override
  protected String getOperator()
  {
    return "<->";
  }
}
