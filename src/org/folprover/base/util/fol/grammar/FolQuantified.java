package org.folprover.base.util.fol.grammar;

/**
 * Ancestor of the quantified formulas: <i>for all</i> and <i>exists</i>.  A quantifier binds exactly one variable.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public abstract class FolQuantified extends FolFormula
{
  private final FolVariable variable;
  private final FolFormula  body;

  FolQuantified(FolVariable variable, FolFormula body)
  {
    this.variable = variable;
    this.body = body;
  }

  public FolVariable getVariable()
  {
    return variable;
  }

  public FolFormula getBody()
  {
    return body;
  }

  /**
   * @return the name of this quantifier when printed.
   */
  protected abstract String getQuantifier();

  @Override
  public boolean isGround()
  {
    return false;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
    {
      return true;
    }
    if ((obj == null) || (obj.getClass() != getClass()))
    {
      return false;
    }
    FolQuantified other = (FolQuantified)obj;
    return variable.equals(other.variable) && body.equals(other.body);
  }

  @Override
  public int hashCode()
  {
    return (getClass().hashCode() * 31 + variable.hashCode()) * 31 + body.hashCode();
  }

  @Override
  public String toString()
  {
    return getQuantifier() + " " + variable + ". " + body;
  }
}
