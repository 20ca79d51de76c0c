package org.folprover.base.util.fol.grammar;

import java.io.Serializable;

/**
 * Class at the root of the first-order logic hierarchy.  Everything the prover reasons about (terms, atoms, literals
 * and formulas) is represented by objects that are part of this hierarchy.
 *
 * <h1>The hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Term</b>: A term denotes an individual.  It's what fills one "slot" in an <i>atom</i> or a
 *     <i>function</i>.<ul>
 *
 *   <li><b>Variable</b>: A name plus a scope id.  Two variables are the same variable only if both the name and the
 *       scope id match.  Variables supplied by a parser have scope id 0; every quantifier and every clause copy made
 *       by the prover gets fresh scope ids.
 *
 *   <li><b>Constant</b>: An atomic name denoting an individual.  Constants are interned by {@link FolPool}, so two
 *       constants with the same name are the same object.
 *
 *   <li><b>Function</b>: A function symbol applied to one or more <i>terms</i>.</ul>
 *
 * <li><b>Atom</b>: A predicate name applied to zero or more <i>terms</i>.  It has a truth value.
 *
 * <li><b>Literal</b>: An <i>atom</i> with a polarity.  Clauses are sets of literals.
 *
 * <li><b>Formula</b>: An arbitrary first-order formula - an atomic formula, a negation, a binary connective (and, or,
 *     implies, iff) or a quantified formula (for all, exists).  Formulas are the input to the clausal-form
 *     conversion.
 *
 * </ul>
 *
 * <h1>Other terms</h1>
 *
 * <ul>
 *   <li><b>Arity</b>: The number of arguments of an atom or function.  This must be the same across every use of a
 *       predicate or function name.
 *   <li><b>Ground</b>: An object is <i>ground</i> if it contains no variables.
 * </ul>
 *
 * All objects in the hierarchy are immutable.  They are created through the factory methods on {@link FolPool}.
 */
@SuppressWarnings("serial")
public abstract class Fol implements Serializable
{
  /**
   * @return whether this object is in ground form - i.e. variable-free.
   */
  public abstract boolean isGround();

  @Override
  public abstract String toString();
}
