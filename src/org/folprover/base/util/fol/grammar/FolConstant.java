package org.folprover.base.util.fol.grammar;

/**
 * A <i>constant</i> is an atomic name denoting an individual.  Constants are interned by {@link FolPool}: there is
 * exactly one constant object for each name.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolConstant extends FolTerm
{
  private final String name;

  FolConstant(String name)
  {
    this.name = name.intern();
  }

  public String getName()
  {
    return name;
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public int getSymbolCount()
  {
    return 1;
  }

  @Override
  public boolean contains(FolVariable xiVariable)
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
    return (obj instanceof FolConstant) && name.equals(((FolConstant)obj).name);
  }

  @Override
  public int hashCode()
  {
    return name.hashCode();
  }

  @Override
  public String toString()
  {
    return name;
  }

  /**
   * Ensures that constants loaded from an ObjectInputStream are the versions that exist in the FolPool.
   */
  protected Object readResolve()
  {
    return FolPool.getConstant(name);
  }
}
