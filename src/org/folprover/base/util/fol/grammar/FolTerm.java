package org.folprover.base.util.fol.grammar;

/**
 * A term is a <i>variable</i>, <i>constant</i> or <i>function</i>.  It's what fills one "slot" in the arguments of an
 * <i>atom</i>.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public abstract class FolTerm extends Fol
{
  FolTerm()
  {
    // Only the classes in this package may extend FolTerm.
  }

  /**
   * @return the number of symbols (variables, constants and function names) in this term.
   */
  public abstract int getSymbolCount();

  /**
   * @return whether the specified variable occurs anywhere in this term.
   *
   * @param xiVariable - the variable to look for.
   */
  public abstract boolean contains(FolVariable xiVariable);
}
