package org.folprover.base.util.fol.grammar;

import java.util.List;

/**
 * An <i>atom</i> is a predicate name applied to zero or more <i>terms</i>.  An atom with no arguments is a
 * proposition.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolAtom extends Fol
{
  private final String        predicate;
  private final List<FolTerm> body;
  private transient Boolean   ground;
  private transient int       hash;

  FolAtom(String predicate, List<FolTerm> body)
  {
    this.predicate = predicate.intern();
    this.body = body;
    ground = null;
  }

  public int arity()
  {
    return body.size();
  }

  public FolTerm get(int index)
  {
    return body.get(index);
  }

  public String getPredicate()
  {
    return predicate;
  }

  public List<FolTerm> getBody()
  {
    return body;
  }

  /**
   * @return the number of symbols in this atom, counting the predicate name.
   */
  public int getSymbolCount()
  {
    int count = 1;
    for (FolTerm term : body)
    {
      count += term.getSymbolCount();
    }
    return count;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = true;
      for (FolTerm term : body)
      {
        if (!term.isGround())
        {
          result = false;
          break;
        }
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
    {
      return true;
    }
    if (!(obj instanceof FolAtom))
    {
      return false;
    }
    FolAtom other = (FolAtom)obj;
    return (predicate == other.predicate) && body.equals(other.body);
  }

  @Override
  public int hashCode()
  {
    if (hash == 0)
    {
      hash = 31 * predicate.hashCode() + body.hashCode();
    }
    return hash;
  }

  @Override
  public String toString()
  {
    if (body.isEmpty())
    {
      return predicate;
    }

    StringBuilder sb = new StringBuilder();
    sb.append(predicate).append("(");
    for (int ii = 0; ii < body.size(); ii++)
    {
      if (ii > 0)
      {
        sb.append(", ");
      }
      sb.append(body.get(ii));
    }
    sb.append(")");

    return sb.toString();
  }
}
