package org.folprover.base.util.fol.grammar;

/**
 * A <i>not</i> is a negated <i>formula</i>.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolNot extends FolFormula
{
  private final FolFormula body;

  FolNot(FolFormula body)
  {
    this.body = body;
  }

  public FolFormula getBody()
  {
    return body;
  }

  @Override
  public boolean isGround()
  {
    return body.isGround();
  }

  @Override
  public boolean equals(Object obj)
  {
    return (obj instanceof FolNot) && body.equals(((FolNot)obj).body);
  }

  @Override
  public int hashCode()
  {
    return ~body.hashCode();
  }

  @Override
  public String toString()
  {
    return "~" + body;
  }
}
