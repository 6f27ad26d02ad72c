package exm.iet.visit;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.iet.IETFixtures;
import exm.iet.common.Logging;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.Iterations.Iteration;
import exm.iet.visit.TreeWalk.TreeWalker;

public class TreeWalkTest {

  private static final Logger logger = Logging.getIETLogger();

  private static class Recorder extends TreeWalker {
    final List<String> seen = new ArrayList<String>();

    @Override
    protected void visit(Iteration iter) {
      seen.add(iter.dim().name());
    }

    @Override
    protected void visit(Expression expr) {
      seen.add("e");
    }
  }

  @Test
  public void testPreOrder() {
    IETFixtures f = new IETFixtures();
    Recorder r = new Recorder();
    TreeWalk.walk(logger, f.block3, r);
    assertEquals(Arrays.asList("i", "s", "e", "j", "k", "e", "e", "q", "e"),
                 r.seen);
  }

  @Test
  public void testNonRecursive() {
    IETFixtures f = new IETFixtures();
    Recorder r = new Recorder();
    TreeWalk.walk(logger, f.block2, r, false);
    assertEquals(Arrays.asList("i", "e", "j"), r.seen);
  }

  @Test
  public void testDeepTree() {
    IETFixtures f = new IETFixtures();
    Node n = f.e0;
    for (int d = 0; d < 10000; d++) {
      n = f.iterK(n);
    }
    Recorder r = new Recorder();
    TreeWalk.walk(logger, n, r);
    assertEquals(10001, r.seen.size());
  }
}
