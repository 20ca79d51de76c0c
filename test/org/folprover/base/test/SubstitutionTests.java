package org.folprover.base.test;

import static org.folprover.base.test.FormulaBuilder.atom;
import static org.folprover.base.test.FormulaBuilder.con;
import static org.folprover.base.test.FormulaBuilder.fn;
import static org.folprover.base.test.FormulaBuilder.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.Substituter;
import org.folprover.base.util.fol.model.Substitution;
import org.junit.Test;

public class SubstitutionTests
{
  private final FolVariable x = var("x");
  private final FolVariable y = var("y");

  @Test
  public void testCompose()
  {
    Substitution lFirst = Substitution.of(x, fn("f", y));
    Substitution lSecond = Substitution.of(y, con("a"));
    Substitution lComposed = lFirst.compose(lSecond);

    assertEquals(fn("f", con("a")), lComposed.get(x));
    assertEquals(con("a"), lComposed.get(y));

    FolTerm lTerm = fn("g", x, y);
    assertEquals(Substituter.substitute(Substituter.substitute(lTerm, lFirst), lSecond),
                 Substituter.substitute(lTerm, lComposed));
  }

  @Test
  public void testComposeWithEmpty()
  {
    Substitution lTheta = Substitution.of(x, con("a"));
    assertSame(lTheta, lTheta.compose(Substitution.EMPTY));
    assertSame(lTheta, Substitution.EMPTY.compose(lTheta));
  }

  @Test
  public void testBindingsApplySimultaneously()
  {
    Map<FolVariable, FolTerm> lSwap = new HashMap<>();
    lSwap.put(x, y);
    lSwap.put(y, x);

    assertEquals(atom("P", y, x), Substituter.substitute(atom("P", x, y), Substitution.of(lSwap)));
  }

  @Test
  public void testIdentityBindingsDropped()
  {
    Map<FolVariable, FolTerm> lBindings = new HashMap<>();
    lBindings.put(x, x);
    lBindings.put(y, con("b"));

    Substitution lTheta = Substitution.of(lBindings);
    assertEquals(1, lTheta.size());
    assertFalse(lTheta.isBound(x));
    assertTrue(lTheta.isBound(y));
  }

  @Test
  public void testGroundTermsUnchanged()
  {
    FolTerm lGround = fn("f", con("a"));
    assertSame(lGround, Substituter.substitute(lGround, Substitution.of(x, con("b"))));
  }
}
