package edu.jhu.hlt.rstdep.datatypes;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class DependencyTreeTest {

  @Test
  public void roots() {
    DependencyTree t = DependencyTrees.make(2, 0, 2, 2);
    assertEquals(5, t.size());
    assertEquals(4, t.numEdus());
    assertEquals(Arrays.asList(2), t.realRoots());
    assertTrue(t.isRealRoot(2));
    assertFalse(t.isRealRoot(1));
    assertFalse(t.isRealRoot(DependencyTree.FAKE_ROOT));
    assertEquals(DependencyTree.NO_HEAD, t.getHead(DependencyTree.FAKE_ROOT));
    assertEquals(DependencyTree.ROOT_LABEL, t.getLabel(DependencyTree.FAKE_ROOT));

    DependencyTree twoRoots = DependencyTrees.make(0, 0);
    assertEquals(Arrays.asList(1, 2), twoRoots.realRoots());
  }

  @Test
  public void depsFollowRanks() {
    DependencyTree t = DependencyTrees.make(2, 0, 2, 2);
    assertEquals(Arrays.asList(1, 3, 4), t.children(2));
    DependencyTree ranked = t.withRanks(new int[] {0, 2, 0, 0, 1});
    assertEquals(Arrays.asList(3, 4, 1), ranked.deps(2));
    assertEquals(Arrays.asList(2), ranked.deps(DependencyTree.FAKE_ROOT));
    assertTrue(ranked.deps(1).isEmpty());
  }

  @Test
  public void annotationsAreCopies() {
    DependencyTree t = DependencyTrees.make(0, 1);
    assertFalse(t.hasNuclearity());
    assertFalse(t.hasRanks());
    assertFalse(t.hasSentences());

    Nuclearity[] nucs = DependencyTrees.nucs(t, false, true);
    DependencyTree n = t.withNuclearity(nucs);
    assertTrue(n.hasNuclearity());
    assertFalse(t.hasNuclearity());
    assertEquals(Nuclearity.NUCLEUS, n.getNuclearity(2));
    assertEquals(Nuclearity.ROOT, n.getNuclearity(DependencyTree.FAKE_ROOT));

    // changing the array afterwards does not change the tree
    nucs[2] = Nuclearity.SATELLITE;
    assertEquals(Nuclearity.NUCLEUS, n.getNuclearity(2));

    DependencyTree r = n.withRanks(new int[] {0, 0, 0});
    assertTrue(r.hasNuclearity());
    assertTrue(r.hasRanks());
    assertEquals(t, r);
  }

  @Test
  public void partialNuclearity() {
    DependencyTree t = DependencyTrees.make(0, 1);
    assertFalse(t.hasCompleteNuclearity());
    DependencyTree partial = t.withNuclearity(new Nuclearity[] {null, Nuclearity.SATELLITE, null});
    assertTrue(partial.hasNuclearity());
    assertFalse(partial.hasCompleteNuclearity());
    assertNull(partial.getNuclearity(2));
    assertTrue(t.withNuclearity(DependencyTrees.nucs(t)).hasCompleteNuclearity());
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingLabel() {
    DependencyTrees.make(new int[] {0, 1}, new String[] {"elaboration", null});
  }

  @Test(expected = IllegalStateException.class)
  public void noNuclearity() {
    DependencyTrees.make(0, 1).getNuclearity(1);
  }

  @Test(expected = IllegalStateException.class)
  public void noSentences() {
    DependencyTrees.make(0, 1).getSentence(1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void headOutOfRange() {
    DependencyTrees.make(0, 7);
  }

  @Test(expected = IllegalArgumentException.class)
  public void selfLoop() {
    DependencyTrees.make(0, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrongRankLength() {
    DependencyTrees.make(0, 1).withRanks(new int[] {0, 0});
  }

  @Test
  public void defaultIdx() {
    DependencyTree t = DependencyTrees.make(0, 1, 1);
    for (int i = 0; i < t.size(); i++)
      assertEquals(i, t.getIdx(i));
    assertEquals(Integer.MIN_VALUE, t.getStart(DependencyTree.FAKE_ROOT));
    assertEquals(10, t.getStart(2));
  }
}
