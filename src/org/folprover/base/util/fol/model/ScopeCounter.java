package org.folprover.base.util.fol.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.folprover.base.util.fol.grammar.FolPool;
import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;

/**
 * Source of fresh variable scope ids.  Ids are handed out in increasing order and never reused, even when several
 * threads ask for them at once.
 *
 * One counter is created per proof attempt and passed to everything that needs fresh variables.  Scope id 0 is
 * reserved for variables supplied by the caller.
 */
public class ScopeCounter
{
  private final AtomicLong mLastScopeId = new AtomicLong(0);

  /**
   * @return a scope id that hasn't been returned before.
   */
  public long nextScopeId()
  {
    return mLastScopeId.incrementAndGet();
  }

  /**
   * @return the most recently allocated scope id, or 0 if none has been allocated.
   */
  public long getLastScopeId()
  {
    return mLastScopeId.get();
  }

  /**
   * @return a new variable with the specified name and a fresh scope id.
   *
   * @param xiName - the variable name.
   */
  public FolVariable freshVariable(String xiName)
  {
    return FolPool.getVariable(xiName, nextScopeId());
  }

  /**
   * @return a renaming that maps each of the specified variables to its own fresh variable (same name, new scope id).
   *
   * @param xiVariables - the variables to rename.
   */
  public Substitution freshRenaming(Collection<FolVariable> xiVariables)
  {
    Map<FolVariable, FolTerm> lRenaming = new LinkedHashMap<>();
    for (FolVariable lVariable : xiVariables)
    {
      if (!lRenaming.containsKey(lVariable))
      {
        lRenaming.put(lVariable, freshVariable(lVariable.getName()));
      }
    }
    return Substitution.of(lRenaming);
  }
}
