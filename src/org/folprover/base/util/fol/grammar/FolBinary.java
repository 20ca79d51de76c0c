package org.folprover.base.util.fol.grammar;

/**
 * Ancestor of the binary connectives: <i>and</i>, <i>or</i>, <i>implies</i> and <i>iff</i>.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public abstract class FolBinary extends FolFormula
{
  private final FolFormula left;
  private final FolFormula right;

  FolBinary(FolFormula left, FolFormula right)
  {
    this.left = left;
    this.right = right;
  }

  public FolFormula getLeft()
  {
    return left;
  }

  public FolFormula getRight()
  {
    return right;
  }

  /**
   * @return the symbol used when printing this connective.
   */
  protected abstract String getOperator();

  @Override
  public boolean isGround()
  {
    return left.isGround() && right.isGround();
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
    FolBinary other = (FolBinary)obj;
    return left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode()
  {
    return (getClass().hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
  }

  @Override
  public String toString()
  {
    return "(" + left + " " + getOperator() + " " + right + ")";
  }
}
