package org.folprover.base.test;

import static org.folprover.base.test.FormulaBuilder.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.folprover.base.util.fol.grammar.FolTerm;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.fol.model.Substitution;
import org.junit.Test;

public class ScopeCounterTests
{
  private static final int THREADS = 4;
  private static final int IDS_PER_THREAD = 5000;

  @Test
  public void testIdsUniqueAcrossThreads() throws Exception
  {
    final ScopeCounter lCounter = new ScopeCounter();
    final Set<Long> lSeen = ConcurrentHashMap.newKeySet();

    ExecutorService lExecutor = Executors.newFixedThreadPool(THREADS);
    try
    {
      List<Future<Boolean>> lFutures = new ArrayList<>();
      for (int lii = 0; lii < THREADS; lii++)
      {
        lFutures.add(lExecutor.submit(new Callable<Boolean>()
        {
          @Override
          public Boolean call()
          {
            boolean lAllNew = true;
            for (int ljj = 0; ljj < IDS_PER_THREAD; ljj++)
            {
              lAllNew &= lSeen.add(lCounter.nextScopeId());
            }
            return lAllNew;
          }
        }));
      }

      for (Future<Boolean> lFuture : lFutures)
      {
        assertTrue(lFuture.get());
      }
    }
    finally
    {
      lExecutor.shutdown();
    }

    assertEquals(THREADS * IDS_PER_THREAD, lSeen.size());
    assertEquals(THREADS * IDS_PER_THREAD, lCounter.getLastScopeId());
  }

  @Test
  public void testFreshRenaming()
  {
    ScopeCounter lCounter = new ScopeCounter();
    FolVariable x = var("x");
    FolVariable y = var("y");

    Substitution lRenaming = lCounter.freshRenaming(Arrays.asList(x, y, x));
    assertEquals(2, lRenaming.size());

    FolTerm lNewX = lRenaming.get(x);
    FolTerm lNewY = lRenaming.get(y);
    assertTrue(lNewX instanceof FolVariable);
    assertEquals("x", ((FolVariable)lNewX).getName());
    assertTrue(((FolVariable)lNewX).getScopeId() > 0);
    assertNotEquals(lNewX, lNewY);
    assertNotEquals(lNewX, lCounter.freshVariable("x"));
  }
}
