package org.folprover.base.util.fol.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;

/**
 * An immutable finite mapping from variables to terms.  All bindings are applied simultaneously - see
 * {@link Substituter}.
 *
 * Bindings of a variable to itself are never stored.
 */
public final class Substitution
{
  /**
   * The empty substitution.
   */
  public static final Substitution EMPTY = new Substitution(Collections.<FolVariable, FolTerm>emptyMap());

  private final Map<FolVariable, FolTerm> mBindings;

  private Substitution(Map<FolVariable, FolTerm> xiBindings)
  {
    mBindings = xiBindings;
  }

  /**
   * @return a substitution with a single binding.
   *
   * @param xiVariable - the variable.
   * @param xiTerm     - the term to bind it to.
   */
  public static Substitution of(FolVariable xiVariable, FolTerm xiTerm)
  {
    if (xiVariable.equals(xiTerm))
    {
      return EMPTY;
    }
    Map<FolVariable, FolTerm> lBindings = new LinkedHashMap<>();
    lBindings.put(xiVariable, xiTerm);
    return new Substitution(Collections.unmodifiableMap(lBindings));
  }

  /**
   * @return a substitution with the specified bindings.  No composition is performed.
   *
   * @param xiBindings - the bindings.
   */
  public static Substitution of(Map<FolVariable, ? extends FolTerm> xiBindings)
  {
    Map<FolVariable, FolTerm> lBindings = new LinkedHashMap<>();
    for (Entry<FolVariable, ? extends FolTerm> lEntry : xiBindings.entrySet())
    {
      if (!lEntry.getKey().equals(lEntry.getValue()))
      {
        lBindings.put(lEntry.getKey(), lEntry.getValue());
      }
    }
    return lBindings.isEmpty() ? EMPTY : new Substitution(Collections.unmodifiableMap(lBindings));
  }

  /**
   * @return the term bound to a variable, or null if the variable is unbound.
   *
   * @param xiVariable - the variable.
   */
  public FolTerm get(FolVariable xiVariable)
  {
    return mBindings.get(xiVariable);
  }

  public boolean isBound(FolVariable xiVariable)
  {
    return mBindings.containsKey(xiVariable);
  }

  public boolean isEmpty()
  {
    return mBindings.isEmpty();
  }

  public int size()
  {
    return mBindings.size();
  }

  public Set<FolVariable> getDomain()
  {
    return mBindings.keySet();
  }

  public Map<FolVariable, FolTerm> getBindings()
  {
    return mBindings;
  }

  /**
   * Compose this substitution with another.  The result has the same effect as applying this substitution and then
   * the other one: the other substitution is applied to every term in this one's range, and then the other's bindings
   * for variables this one doesn't bind are added.
   *
   * @return the composition.
   *
   * @param xiOther - the substitution to apply second.
   */
  public Substitution compose(Substitution xiOther)
  {
    if (xiOther.isEmpty())
    {
      return this;
    }
    if (isEmpty())
    {
      return xiOther;
    }

    Map<FolVariable, FolTerm> lBindings = new LinkedHashMap<>();
    for (Entry<FolVariable, FolTerm> lEntry : mBindings.entrySet())
    {
      FolTerm lTerm = Substituter.substitute(lEntry.getValue(), xiOther);
      if (!lEntry.getKey().equals(lTerm))
      {
        lBindings.put(lEntry.getKey(), lTerm);
      }
    }
    for (Entry<FolVariable, FolTerm> lEntry : xiOther.mBindings.entrySet())
    {
      if (!mBindings.containsKey(lEntry.getKey()))
      {
        lBindings.put(lEntry.getKey(), lEntry.getValue());
      }
    }
    return lBindings.isEmpty() ? EMPTY : new Substitution(Collections.unmodifiableMap(lBindings));
  }

  /**
   * @return this substitution with one extra binding, added as-is.  Used for one-way matching, where the range
   * belongs to a different clause and must not be rewritten.
   *
   * @param xiVariable - an unbound variable.
   * @param xiTerm     - the term to bind it to.
   */
  public Substitution extend(FolVariable xiVariable, FolTerm xiTerm)
  {
    assert(!isBound(xiVariable)) : xiVariable + " is already bound in " + this;
    Map<FolVariable, FolTerm> lBindings = new LinkedHashMap<>(mBindings);
    lBindings.put(xiVariable, xiTerm);
    return new Substitution(Collections.unmodifiableMap(lBindings));
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof Substitution) && mBindings.equals(((Substitution)xiOther).mBindings);
  }

  @Override
  public int hashCode()
  {
    return mBindings.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder("{");
    boolean lFirst = true;
    for (Entry<FolVariable, FolTerm> lEntry : mBindings.entrySet())
    {
      if (!lFirst)
      {
        lBuilder.append(", ");
      }
      lFirst = false;
      lBuilder.append(lEntry.getKey()).append(" -> ").append(lEntry.getValue());
    }
    return lBuilder.append("}").toString();
  }
}
