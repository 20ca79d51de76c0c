package org.folprover.base.util.fol.grammar;

/**
 * An <i>atomic formula</i> wraps a single <i>atom</i>.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolAtomic extends FolFormula
{
  private final FolAtom atom;

  FolAtomic(FolAtom atom)
  {
    this.atom = atom;
  }

  public FolAtom getAtom()
  {
    return atom;
  }

  @Override
  public boolean isGround()
  {
    return atom.isGround();
  }

  @Override
  public boolean equals(Object obj)
  {
    return (obj instanceof FolAtomic) && atom.equals(((FolAtomic)obj).atom);
  }

  @Override
  public int hashCode()
  {
    return atom.hashCode();
  }

  @Override
  public String toString()
  {
    return atom.toString();
  }
}
