package org.folprover.base.util.fol.transforms;

import java.util.HashSet;
import java.util.Set;

import org.folprover.base.util.prover.exceptions.SkolemCollisionException;

/**
 * Generates Skolem function and constant names that are distinct from every symbol of the input signature and from
 * each other.  Names are "sk1", "sk2" and so on, skipping any that the signature already uses.
 */
public class SkolemSymbolGenerator
{
  /**
   * Prefix of every generated name.
   */
  public static final String PREFIX = "sk";

  private final Set<String> mSignature;
  private final Set<String> mGenerated = new HashSet<>();
  private int               mNextIndex = 1;

  /**
   * @param xiSignature - every predicate, function and constant name used by the formulas being converted.
   */
  public SkolemSymbolGenerator(Set<String> xiSignature)
  {
    mSignature = new HashSet<>(xiSignature);
  }

  /**
   * @return a fresh symbol name.
   *
   * @throws SkolemCollisionException if the name chosen is already in use.
   */
  public synchronized String nextSymbol()
  {
    String lSymbol = PREFIX + mNextIndex++;
    while (mSignature.contains(lSymbol))
    {
      lSymbol = PREFIX + mNextIndex++;
    }

    if (!mGenerated.add(lSymbol))
    {
      throw new SkolemCollisionException(lSymbol);
    }
    return lSymbol;
  }

  /**
   * Confirm that a symbol about to be used as a Skolem symbol doesn't clash with the input signature.
   *
   * @param xiSymbol - the symbol.
   *
   * @throws SkolemCollisionException if it does.
   */
  public void checkFresh(String xiSymbol)
  {
    if (mSignature.contains(xiSymbol) || !mGenerated.contains(xiSymbol))
    {
      throw new SkolemCollisionException(xiSymbol);
    }
  }

  /**
   * @return the number of symbols generated so far.
   */
  public int getGeneratedCount()
  {
    return mGenerated.size();
  }
}
