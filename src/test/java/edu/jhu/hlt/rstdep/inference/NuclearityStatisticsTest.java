package edu.jhu.hlt.rstdep.inference;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;
import edu.jhu.hlt.rstdep.datatypes.DependencyTrees;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;

public class NuclearityStatisticsTest {

  @Test
  public void patterns() {
    // e0 <-attribution- e1 -elaboration-> e2 -elaboration-> e3, e1 -joint-> e4
    DependencyTree t = DependencyTrees.make(
        new int[] {2, 0, 2, 3, 2},
        new String[] {"attribution", "ROOT", "elaboration", "elaboration", "joint"});
    Nuclearity[] gold = DependencyTrees.nucs(t, false, false, false, false, true);
    NuclearityStatistics s = NuclearityStatistics.fromTraining(
        Arrays.asList(t), Collections.singletonList(gold));
    assertEquals("SN", s.mostFrequentPattern("attribution"));
    assertEquals("NS", s.mostFrequentPattern("elaboration"));
    assertEquals("NN", s.mostFrequentPattern("joint"));
    // edges from the fake root are not counted
    assertNull(s.mostFrequentPattern("ROOT"));
    assertEquals(Collections.singleton("joint"), s.multinuclearRelations());
  }

  @Test
  public void majorityAndTies() {
    // contrast: NN twice, NS once; list: NN once, NS once -> tie goes to NN
    DependencyTree t = DependencyTrees.make(
        new int[] {0, 1, 1, 1, 1, 1},
        new String[] {"ROOT", "contrast", "contrast", "contrast", "list", "list"});
    Nuclearity[] gold = DependencyTrees.nucs(t, false, true, true, false, true, false);
    NuclearityStatistics s = NuclearityStatistics.fromTraining(
        Arrays.asList(t), Collections.singletonList(gold));
    assertEquals("NN", s.mostFrequentPattern("contrast"));
    assertEquals("NN", s.mostFrequentPattern("list"));
    assertEquals(2, s.relations().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void badPattern() {
    NuclearityStatistics.fromMajorityPatterns(Collections.singletonMap("joint", "N-N"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void misalignedTraining() {
    DependencyTree t = DependencyTrees.make(0, 1);
    NuclearityStatistics.fromTraining(Arrays.asList(t, t),
        Collections.singletonList(DependencyTrees.nucs(t)));
  }
}
