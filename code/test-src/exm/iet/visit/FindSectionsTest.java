package exm.iet.visit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ListMultimap;

import exm.iet.IETFixtures;
import exm.iet.tree.Conditionals.Conditional;
import exm.iet.tree.IETree.Block;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.Iterations.Iteration;
import exm.iet.visit.FindSections.SectionKey;

public class FindSectionsTest {

  private IETFixtures f;
  private FindSections finder;

  @Before
  public void setUp() {
    f = new IETFixtures();
    finder = new FindSections();
  }

  private static List<Integer> sectionSizes(
                    ListMultimap<SectionKey, Expression> sections) {
    List<Integer> sizes = new ArrayList<Integer>();
    for (SectionKey key: sections.keySet()) {
      sizes.add(sections.get(key).size());
    }
    return sizes;
  }

  @Test
  public void testPerfectNest() {
    ListMultimap<SectionKey, Expression> sections = finder.visit(f.block1);
    assertEquals(1, sections.keySet().size());
    SectionKey key = sections.keySet().iterator().next();
    assertEquals(Arrays.asList(f.i, f.j, f.k), key.getDimensions());
    assertEquals("(i, j, k)", key.toString());
    assertSame(f.e0, sections.get(key).get(0));
  }

  @Test
  public void testExpressionBeforeLoop() {
    ListMultimap<SectionKey, Expression> sections = finder.visit(f.block2);
    assertEquals(Arrays.asList(1, 1), sectionSizes(sections));
    List<SectionKey> keys = new ArrayList<SectionKey>(sections.keySet());
    assertEquals(Arrays.asList(f.i), keys.get(0).getDimensions());
    assertEquals(Arrays.asList(f.i, f.j, f.k), keys.get(1).getDimensions());
  }

  @Test
  public void testSiblingLoops() {
    ListMultimap<SectionKey, Expression> sections = finder.visit(f.block3);
    assertEquals(Arrays.asList(1, 2, 1), sectionSizes(sections));
    List<SectionKey> keys = new ArrayList<SectionKey>(sections.keySet());
    assertEquals(Arrays.asList(f.e1, f.e2), sections.get(keys.get(1)));
  }

  @Test
  public void testEveryExpressionOnce() {
    for (Node root: Arrays.<Node>asList(f.block1, f.block2, f.block3,
                                        f.block4)) {
      ListMultimap<SectionKey, Expression> sections = finder.visit(root);
      assertEquals(FindNodes.expressions(root).size(), sections.size());
    }
  }

  @Test
  public void testKeysCompareByIdentity() {
    // Two structurally identical loops give two sections
    Iteration first = f.iterJ(f.e1);
    Iteration second = f.iterJ(f.e2);
    ListMultimap<SectionKey, Expression> sections =
                          finder.visit(f.iterI(first, second));
    List<SectionKey> keys = new ArrayList<SectionKey>(sections.keySet());
    assertEquals(2, keys.size());
    assertNotEquals(keys.get(0), keys.get(1));
    assertEquals("(i, j)", keys.get(0).toString());
    assertEquals("(i, j)", keys.get(1).toString());
  }

  @Test
  public void testSameLoopMerges() {
    // Expressions split by a nested loop still share their outer section
    ListMultimap<SectionKey, Expression> sections =
                    finder.visit(f.iterI(f.e0, f.iterJ(f.e1), f.e2));
    assertEquals(Arrays.asList(2, 1), sectionSizes(sections));
    SectionKey outer = sections.keySet().iterator().next();
    assertEquals(Arrays.asList(f.e0, f.e2), sections.get(outer));
  }

  @Test
  public void testConditionalIsBoundary() {
    Conditional cond = new Conditional(f.evenI(),
        Collections.<Node>singletonList(f.e1),
        Collections.<Node>singletonList(f.e2));
    ListMultimap<SectionKey, Expression> sections =
                              finder.visit(f.iterI(f.e0, cond, f.e3));
    assertEquals(Arrays.asList(2, 1, 1), sectionSizes(sections));
    List<SectionKey> keys = new ArrayList<SectionKey>(sections.keySet());
    assertEquals(Arrays.asList(f.e0, f.e3), sections.get(keys.get(0)));
    assertEquals("(i, ?)", keys.get(1).toString());
    assertEquals(Arrays.asList(f.i), keys.get(1).getDimensions());
    assertEquals(Arrays.asList(f.e2), sections.get(keys.get(2)));
  }

  @Test
  public void testTopLevelExpressions() {
    ListMultimap<SectionKey, Expression> sections =
                  finder.visit(new Block(f.e0, f.iterK(f.e1), f.e2));
    List<SectionKey> keys = new ArrayList<SectionKey>(sections.keySet());
    assertEquals(2, keys.size());
    assertTrue(keys.get(0).getScopes().isEmpty());
    assertEquals("()", keys.get(0).toString());
    assertEquals(Arrays.asList(f.e0, f.e2), sections.get(keys.get(0)));
  }

  @Test
  public void testNoExpressions() {
    assertTrue(finder.visit(f.iterI()).isEmpty());
  }
}
