package org.folprover.base.util.fol.grammar;

import java.util.List;

/**
 * A <i>function</i> is a complex <i>term</i>: a function symbol applied to one or more other <i>terms</i>.  Unlike an
 * <i>atom</i>, it does not have a truth value.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public final class FolFunction extends FolTerm
{
  private final String        name;
  private final List<FolTerm> body;
  private transient Boolean   ground;
  private transient int       hash;

  FolFunction(String name, List<FolTerm> body)
  {
    this.name = name.intern();
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

  public String getName()
  {
    return name;
  }

  public List<FolTerm> getBody()
  {
    return body;
  }

  private boolean computeGround()
  {
    for (FolTerm term : body)
    {
      if (!term.isGround())
      {
        return false;
      }
    }

    return true;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = computeGround();
    }

    return ground;
  }

  @Override
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
  public boolean contains(FolVariable xiVariable)
  {
    for (FolTerm term : body)
    {
      if (term.contains(xiVariable))
      {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
    {
      return true;
    }
    if (!(obj instanceof FolFunction))
    {
      return false;
    }
    FolFunction other = (FolFunction)obj;
    return (name == other.name) && body.equals(other.body);
  }

  @Override
  public int hashCode()
  {
    if (hash == 0)
    {
      hash = 31 * name.hashCode() + body.hashCode();
    }
    return hash;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();

    sb.append(name).append("(");
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
