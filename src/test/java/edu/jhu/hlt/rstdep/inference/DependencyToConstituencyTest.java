package edu.jhu.hlt.rstdep.inference;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;
import edu.jhu.hlt.rstdep.datatypes.DependencyTrees;
import edu.jhu.hlt.rstdep.datatypes.DiscourseTree;
import edu.jhu.hlt.rstdep.datatypes.EduSpan;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;
import edu.jhu.hlt.rstdep.datatypes.StructureException;
import edu.jhu.hlt.rstdep.util.ExperimentProperties;

public class DependencyToConstituencyTest {

  private static DependencyTree tree() {
    return DependencyTrees.make(
        new int[] {2, 0, 2, 2},
        new String[] {"attribution", "ROOT", "joint", "elaboration"});
  }

  @Test
  public void defaults() {
    ExperimentProperties config = new ExperimentProperties();
    DependencyToConstituency p = new DependencyToConstituency(config);
    assertEquals(RankingStrategy.ID, p.getRanker().getStrategy());
    assertEquals(NuclearityStrategy.UNAMB_ELSE_MOST_FREQUENT, p.getClassifier().getStrategy());
    // defaults are recorded in the config
    assertEquals("id", config.getProperty("ranking.strategy"));
    assertEquals("unamb_else_most_frequent", config.getProperty("nuclearity.strategy"));

    DiscourseTree d = p.convert(tree());
    assertEquals(
        "(R:elaboration (N:joint (N:attribution (S:leaf e0) (N:leaf e1)) (N:leaf e2)) (S:leaf e3))",
        d.toString());
  }

  @Test
  public void keepsGivenNuclearity() {
    DependencyTree t = tree();
    t = t.withNuclearity(DependencyTrees.nucs(t));
    DependencyToConstituency p = new DependencyToConstituency(new ExperimentProperties());
    assertEquals(Nuclearity.SATELLITE, p.annotate(t).getNuclearity(3));

    DependencyToConstituency overwrite = new DependencyToConstituency(
        ExperimentProperties.fromArgs("nuclearity.overwrite", "true"));
    assertEquals(Nuclearity.NUCLEUS, overwrite.annotate(t).getNuclearity(3));
  }

  @Test
  public void fillsUnsetNuclearity() {
    // e0 given as a nucleus, e2 and e3 left for the classifier
    DependencyTree t = tree().withNuclearity(new Nuclearity[] {
        Nuclearity.ROOT, Nuclearity.NUCLEUS, Nuclearity.SATELLITE, null, null});
    assertFalse(t.hasCompleteNuclearity());
    DependencyToConstituency p = new DependencyToConstituency(new ExperimentProperties());
    DependencyTree a = p.annotate(t);
    assertTrue(a.hasCompleteNuclearity());
    assertEquals(Nuclearity.NUCLEUS, a.getNuclearity(1));
    assertEquals(Nuclearity.NUCLEUS, a.getNuclearity(3));
    assertEquals(Nuclearity.SATELLITE, a.getNuclearity(4));

    String expected =
        "(R:elaboration (N:joint (N:attribution (N:leaf e0) (N:leaf e1)) (N:leaf e2)) (S:leaf e3))";
    assertEquals(expected, p.convert(t).toString());

    List<DiscourseTree> out = p.convertAll(Arrays.asList(t, DependencyTrees.make(0, 0)), true);
    assertEquals(1, out.size());
    assertEquals(expected, out.get(0).toString());
  }

  @Test
  public void keepsGivenRanks() {
    // e3 is attached before e2, which is not inside out
    DependencyTree t = tree().withRanks(new int[] {0, 2, 0, 1, 0});
    DependencyToConstituency keep = new DependencyToConstituency(
        ExperimentProperties.fromArgs("ranking.overwrite", "false"));
    try {
      keep.convert(t);
      fail("outside-in ranks should not convert");
    } catch (StructureException e) {
      // expected
    }
    // the id ranker repairs them
    DependencyToConstituency repair = new DependencyToConstituency(new ExperimentProperties());
    assertArrayEquals(new int[] {0, 2, 0, 0, 1}, repair.annotate(t).getRanks());
  }

  @Test
  public void mostFrequentFromTraining() {
    DependencyToConstituency p = new DependencyToConstituency(
        ExperimentProperties.fromArgs("nuclearity.strategy", "most_frequent_by_rel"));
    assertFalse(p.getClassifier().isFit());
    DependencyTree train = tree();
    p.fit(Arrays.asList(train), Collections.singletonList(DependencyTrees.nucs(train, false, false, false, true)));
    assertEquals(Collections.singleton("elaboration"), p.getClassifier().getMultinuclearRelations());
    assertEquals(Nuclearity.NUCLEUS, p.annotate(tree()).getNuclearity(4));
  }

  @Test
  public void skipMalformed() {
    DependencyToConstituency p = new DependencyToConstituency(
        ExperimentProperties.fromArgs("ranking.strategy", "closest-rl", "convert.logEvery", "1"));
    List<DependencyTree> docs = Arrays.asList(
        tree(),
        DependencyTrees.make(0, 0),
        DependencyTrees.make(0, 1));
    List<DiscourseTree> out = p.convertAll(docs, true);
    assertEquals(2, out.size());
    assertEquals(new EduSpan(0, 1), out.get(1).getEduSpan());
  }

  @Test(expected = StructureException.class)
  public void propagateMalformed() {
    DependencyToConstituency p = new DependencyToConstituency(new ExperimentProperties());
    p.convertAll(Arrays.asList(tree(), DependencyTrees.make(0, 0)), false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void badStrategy() {
    new DependencyToConstituency(ExperimentProperties.fromArgs("ranking.strategy", "llrr"));
  }

  @Test
  public void classpathDefaults() {
    ExperimentProperties config = ExperimentProperties.withDefaults();
    assertEquals("id", config.getString("ranking.strategy"));
    DependencyToConstituency p = new DependencyToConstituency(config);
    assertEquals(RankingStrategy.ID, p.getRanker().getStrategy());
  }
}
