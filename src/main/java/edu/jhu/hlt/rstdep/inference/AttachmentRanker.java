package edu.jhu.hlt.rstdep.inference;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;

/**
 * Decides in which order the dependents of each head are attached when a
 * dependency tree is folded into a binary tree. The order is given as a rank
 * per node: within the dependents of one head, ranks are 0..k-1.
 *
 * @see RankingStrategy
 * @author travis
 */
public class AttachmentRanker {
  public static final Logger LOG = Logger.getLogger(AttachmentRanker.class);

  /**
   * Thrown when a strategy that reasons about sentences is asked to rank a
   * tree that has no sentence ids.
   */
  public static class MissingSentencesException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    public final RankingStrategy strategy;
    public MissingSentencesException(RankingStrategy strategy) {
      super("Strategy " + strategy + " depends on sentential information"
          + " which is missing here");
      this.strategy = strategy;
    }
  }

  private final RankingStrategy strategy;

  public AttachmentRanker(String strategy) {
    this(RankingStrategy.forName(strategy));
  }

  public AttachmentRanker(RankingStrategy strategy) {
    if (strategy == null)
      throw new IllegalArgumentException("no ranking strategy given");
    this.strategy = strategy;
    LOG.debug("[init] strategy=" + strategy);
  }

  public RankingStrategy getStrategy() {
    return strategy;
  }

  /** One rank array per tree, parallel to its nodes. */
  public List<int[]> predict(List<DependencyTree> trees) {
    List<int[]> ranks = new ArrayList<>(trees.size());
    for (DependencyTree t : trees)
      ranks.add(predict(t));
    return ranks;
  }

  public int[] predict(DependencyTree tree) {
    if (strategy.needsSentences() && !tree.hasSentences())
      throw new MissingSentencesException(strategy);

    // Children of each head, in index order
    ListMultimap<Integer, Integer> deps = ArrayListMultimap.create();
    for (int i = 1; i < tree.size(); i++)
      deps.put(tree.getHead(i), i);

    int[] ranks = new int[tree.size()];
    for (int head : deps.keySet()) {
      List<Integer> given = new ArrayList<>(deps.get(head));
      if (tree.hasRanks())
        given.sort((a, b) -> Integer.compare(tree.getRank(a), tree.getRank(b)));
      RankingStrategy.Siblings s = new RankingStrategy.Siblings(tree, head, given);
      List<Integer> order = strategy.order(s);
      for (int r = 0; r < order.size(); r++)
        ranks[order.get(r)] = r;
      if (LOG.isDebugEnabled())
        LOG.debug("[predict] head=" + head + " targets=" + s.targets + " order=" + order);
    }
    checkRanks(tree, ranks);
    return ranks;
  }

  /**
   * Checks that, for every head, the ranks of its dependents are a
   * permutation of 0..k-1.
   *
   * @throws IllegalStateException naming the first offending head
   */
  public static void checkRanks(DependencyTree tree, int[] ranks) {
    if (ranks.length != tree.size()) {
      throw new IllegalStateException("ranks has length " + ranks.length
          + " for a tree with " + tree.size() + " nodes");
    }
    ListMultimap<Integer, Integer> deps = ArrayListMultimap.create();
    for (int i = 1; i < tree.size(); i++)
      deps.put(tree.getHead(i), i);
    for (int head : deps.keySet()) {
      List<Integer> targets = deps.get(head);
      boolean[] seen = new boolean[targets.size()];
      for (int t : targets) {
        int r = ranks[t];
        if (r < 0 || r >= seen.length || seen[r]) {
          throw new IllegalStateException("ranks of the dependents of head "
              + head + " are not a permutation of 0.." + (seen.length - 1)
              + ": node " + t + " has rank " + r);
        }
        seen[r] = true;
      }
    }
  }
}
