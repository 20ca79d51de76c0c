package org.folprover.base.util.fol.grammar;

/**
 * A <i>literal</i> is an <i>atom</i> with a polarity.  A negative literal asserts that its atom is false.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolLiteral extends Fol
{
  private final FolAtom atom;
  private final boolean positive;

  FolLiteral(FolAtom atom, boolean positive)
  {
    this.atom = atom;
    this.positive = positive;
  }

  public FolAtom getAtom()
  {
    return atom;
  }

  public boolean isPositive()
  {
    return positive;
  }

  /**
   * @return whether this literal is the exact syntactic complement of another.
   *
   * @param other - the other literal.
   */
  public boolean isComplementOf(FolLiteral other)
  {
    return (positive != other.positive) && atom.equals(other.atom);
  }

  @Override
  public boolean isGround()
  {
    return atom.isGround();
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
    {
      return true;
    }
    if (!(obj instanceof FolLiteral))
    {
      return false;
    }
    FolLiteral other = (FolLiteral)obj;
    return (positive == other.positive) && atom.equals(other.atom);
  }

  @Override
  public int hashCode()
  {
    return positive ? atom.hashCode() : ~atom.hashCode();
  }

  @Override
  public String toString()
  {
    return positive ? atom.toString() : "~" + atom;
  }
}
