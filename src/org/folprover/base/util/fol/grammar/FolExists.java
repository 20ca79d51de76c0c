package org.folprover.base.util.fol.grammar;

/**
 * An <i>exists</i> is an existentially quantified formula.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolExists extends FolQuantified
{
  FolExists(FolVariable variable, FolFormula body)
  {
    super(variable, body);
  }

  @Override
  protected String getQuantifier()
  {
    return "exists";
  }
}
