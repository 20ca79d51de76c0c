package org.folprover.base.util.fol.grammar;

/**
 * A <i>variable</i> is a name plus a scope id.  The scope id keeps apart variables that share a name but were bound by
 * different quantifiers, or that live in different clauses.
 *
 * Variables are ordered by scope id and then by name.  A variable with a larger scope id was introduced later.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolVariable extends FolTerm implements Comparable<FolVariable>
{
  private final String name;
  private final long   scopeId;

  FolVariable(String name, long scopeId)
  {
    this.name = name.intern();
    this.scopeId = scopeId;
  }

  public String getName()
  {
    return name;
  }

  public long getScopeId()
  {
    return scopeId;
  }

  @Override
  public boolean isGround()
  {
    return false;
  }

  @Override
  public int getSymbolCount()
  {
    return 1;
  }

  @Override
  public boolean contains(FolVariable xiVariable)
  {
    return equals(xiVariable);
  }

  @Override
  public int compareTo(FolVariable other)
  {
    int result = Long.compare(scopeId, other.scopeId);
    if (result == 0)
    {
      result = name.compareTo(other.name);
    }
    return result;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
    {
      return true;
    }
    if (!(obj instanceof FolVariable))
    {
      return false;
    }
    FolVariable other = (FolVariable)obj;
    return (scopeId == other.scopeId) && name.equals(other.name);
  }

  @Override
  public int hashCode()
  {
    return 31 * name.hashCode() + Long.hashCode(scopeId);
  }

  @Override
  public String toString()
  {
    if (scopeId == 0)
    {
      return name;
    }
    return name + "_" + scopeId;
  }
}
