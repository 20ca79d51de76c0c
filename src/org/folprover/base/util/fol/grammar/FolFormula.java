package org.folprover.base.util.fol.grammar;

/**
 * A formula is an <i>atomic formula</i>, a <i>not</i>, one of the binary connectives (<i>and</i>, <i>or</i>,
 * <i>implies</i>, <i>iff</i>) or a quantified formula (<i>for all</i>, <i>exists</i>).
 *
 * The set of subclasses is closed.  Code that walks a formula dispatches on the concrete class and treats any other
 * class as a programming error.
 *
 * See {@link Fol} for a complete description of the hierarchy.
 */
@SuppressWarnings("serial")
public abstract class FolFormula extends Fol
{
  FolFormula()
  {
    // Only the classes in this package may extend FolFormula.
  }
}
