package org.folprover.base.util.fol.grammar;

/**
 * A <i>for all</i> is a universally quantified formula.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolForAll extends FolQuantified
{
  FolForAll(FolVariable variable, FolFormula body)
  {
    super(variable, body);
  }

  @Override
  protected String getQuantifier()
  {
    return "forall";
  }
}
