package edu.jhu.hlt.rstdep.inference;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;

/**
 * Most frequent nuclearity pattern of each relation label, e.g.
 * joint -> NN, elaboration -> NS, attribution -> SN. Patterns are written
 * left argument first.
 *
 * @author travis
 */
public class NuclearityStatistics {
  public static final Logger LOG = Logger.getLogger(NuclearityStatistics.class);

  public static final String MULTINUCLEAR = "NN";
  public static final String NUCLEUS_FIRST = "NS";
  public static final String SATELLITE_FIRST = "SN";

  private final ImmutableMap<String, String> mostFrequent;

  private NuclearityStatistics(Map<String, String> mostFrequent) {
    this.mostFrequent = ImmutableMap.copyOf(mostFrequent);
  }

  /**
   * Wraps a table computed elsewhere (relation -> majority pattern).
   */
  public static NuclearityStatistics fromMajorityPatterns(Map<String, String> mostFrequent) {
    for (Map.Entry<String, String> e : mostFrequent.entrySet()) {
      String p = e.getValue();
      if (!MULTINUCLEAR.equals(p) && !NUCLEUS_FIRST.equals(p) && !SATELLITE_FIRST.equals(p)) {
        throw new IllegalArgumentException("bad nuclearity pattern for "
            + e.getKey() + ": " + p);
      }
    }
    return new NuclearityStatistics(mostFrequent);
  }

  /**
   * Counts nuclearity patterns per relation over training trees.
   * A nucleus dependent makes the edge NN; a satellite dependent makes it NS
   * if it sits to the right of its head and SN otherwise. Ties go to the
   * alphabetically first pattern.
   *
   * @param labels gold nuclearity of every node of every tree, parallel to trees
   */
  public static NuclearityStatistics fromTraining(
      List<DependencyTree> trees, List<Nuclearity[]> labels) {
    if (trees.size() != labels.size()) {
      throw new IllegalArgumentException(trees.size() + " trees but "
          + labels.size() + " label arrays");
    }
    Map<String, Multiset<String>> counts = new TreeMap<>();
    for (int t = 0; t < trees.size(); t++) {
      DependencyTree tree = trees.get(t);
      Nuclearity[] nucs = labels.get(t);
      if (nucs.length != tree.size()) {
        throw new IllegalArgumentException("tree " + t + " has " + tree.size()
            + " nodes but " + nucs.length + " labels");
      }
      for (int i = 1; i < tree.size(); i++) {
        int head = tree.getHead(i);
        if (head == DependencyTree.FAKE_ROOT || nucs[i] == null)
          continue;
        String pattern;
        if (nucs[i] == Nuclearity.NUCLEUS)
          pattern = MULTINUCLEAR;
        else if (tree.getStart(i) > tree.getStart(head))
          pattern = NUCLEUS_FIRST;
        else
          pattern = SATELLITE_FIRST;
        counts.computeIfAbsent(tree.getLabel(i), k -> TreeMultiset.<String>create())
          .add(pattern);
      }
    }
    Map<String, String> mostFrequent = new TreeMap<>();
    for (Map.Entry<String, Multiset<String>> e : counts.entrySet()) {
      String best = null;
      int bestCount = 0;
      // TreeMultiset iterates patterns alphabetically, so strict > keeps the first
      for (Multiset.Entry<String> pc : e.getValue().entrySet()) {
        if (pc.getCount() > bestCount) {
          best = pc.getElement();
          bestCount = pc.getCount();
        }
      }
      mostFrequent.put(e.getKey(), best);
    }
    LOG.info("[fromTraining] counted " + mostFrequent.size()
        + " relations over " + trees.size() + " trees");
    return new NuclearityStatistics(mostFrequent);
  }

  /** null if the relation was never seen. */
  public String mostFrequentPattern(String relation) {
    return mostFrequent.get(relation);
  }

  public Set<String> relations() {
    return mostFrequent.keySet();
  }

  /** Relations whose most frequent pattern is NN. */
  public ImmutableSet<String> multinuclearRelations() {
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (Map.Entry<String, String> e : mostFrequent.entrySet())
      if (MULTINUCLEAR.equals(e.getValue()))
        b.add(e.getKey());
    return b.build();
  }

  @Override
  public String toString() {
    return "<NuclearityStatistics " + mostFrequent + ">";
  }
}
