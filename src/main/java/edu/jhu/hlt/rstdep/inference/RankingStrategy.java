package edu.jhu.hlt.rstdep.inference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ComparisonChain;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;

/**
 * Policies for ordering the dependents of one head. Apart from the closest-*
 * family, every policy produces an inside-out order: it never takes a
 * dependent before a nearer one on the same side of the head.
 *
 * Dependents are seen as two stacks, one on each side of the head, from which
 * the dependent nearest to the head pops first:
 * <pre>
 *   lX .. l2 l1 [h] r1 r2 .. rY
 * </pre>
 *
 * @author travis
 */
public enum RankingStrategy {

  /**
   * Keeps the left/right interleaving of the given order (existing ranks if
   * the tree has them, else node index order) but re-fills each side inside
   * out. E.g. the given order <code>l3 r1 r3 l2 l1 r2</code> is read as the
   * slots <code>L R R L L R</code> and becomes
   * <code>l1 r1 r2 l2 l3 r3</code>.
   */
  ID("id") {
    @Override
    List<Integer> order(Siblings s) {
      Deque<Integer> left = s.leftStack();
      Deque<Integer> right = s.rightStack();
      List<Integer> result = new ArrayList<>(s.targets.size());
      for (int t : s.targets)
        result.add(s.isLeft(t) ? left.pop() : right.pop());
      return result;
    }
  },

  LLLRRR("lllrrr") {
    @Override
    List<Integer> order(Siblings s) {
      return drain(s.leftStack(), s.rightStack());
    }
  },

  RRRLLL("rrrlll") {
    @Override
    List<Integer> order(Siblings s) {
      return drain(s.rightStack(), s.leftStack());
    }
  },

  LRLRLR("lrlrlr") {
    @Override
    List<Integer> order(Siblings s) {
      return alternate(s.leftStack(), s.rightStack());
    }
  },

  RLRLRL("rlrlrl") {
    @Override
    List<Integer> order(Siblings s) {
      return alternate(s.rightStack(), s.leftStack());
    }
  },

  /** Nearest first, left wins ties. */
  CLOSEST_LR("closest-lr") {
    @Override
    List<Integer> order(Siblings s) {
      List<Integer> result = new ArrayList<>(s.targets);
      result.sort((a, b) -> ComparisonChain.start()
          .compare(s.distance(a), s.distance(b))
          .compareFalseFirst(s.isRightOf(a), s.isRightOf(b))
          .result());
      return result;
    }
  },

  /** Nearest first, right wins ties. */
  CLOSEST_RL("closest-rl") {
    @Override
    List<Integer> order(Siblings s) {
      List<Integer> result = new ArrayList<>(s.targets);
      result.sort((a, b) -> ComparisonChain.start()
          .compare(s.distance(a), s.distance(b))
          .compareTrueFirst(s.isRightOf(a), s.isRightOf(b))
          .result());
      return result;
    }
  },

  /**
   * Same-sentence dependents first, then nearest first; right wins ties
   * within the sentence, left wins ties across sentences.
   */
  CLOSEST_INTRA_RL_INTER_LR("closest-intra-rl-inter-lr") {
    @Override
    List<Integer> order(Siblings s) {
      List<Integer> result = new ArrayList<>(s.targets);
      result.sort((a, b) -> ComparisonChain.start()
          .compareTrueFirst(s.isIntra(a), s.isIntra(b))
          .compare(s.distance(a), s.distance(b))
          .compareTrueFirst(s.isRightOf(a) == s.isIntra(a), s.isRightOf(b) == s.isIntra(b))
          .result());
      return result;
    }
  },

  /** Same-sentence dependents first, then nearest first, right wins ties. */
  CLOSEST_INTRA_RL_INTER_RL("closest-intra-rl-inter-rl") {
    @Override
    List<Integer> order(Siblings s) {
      List<Integer> result = new ArrayList<>(s.targets);
      result.sort((a, b) -> ComparisonChain.start()
          .compareTrueFirst(s.isIntra(a), s.isIntra(b))
          .compare(s.distance(a), s.distance(b))
          .compareTrueFirst(s.isRightOf(a), s.isRightOf(b))
          .result());
      return result;
    }
  },

  /** Same-sentence dependents first, then nearest first, left wins ties. */
  CLOSEST_INTRA_LR_INTER_LR("closest-intra-lr-inter-lr") {
    @Override
    List<Integer> order(Siblings s) {
      List<Integer> result = new ArrayList<>(s.targets);
      result.sort((a, b) -> ComparisonChain.start()
          .compareTrueFirst(s.isIntra(a), s.isIntra(b))
          .compare(s.distance(a), s.distance(b))
          .compareFalseFirst(s.isRightOf(a), s.isRightOf(b))
          .result());
      return result;
    }
  };

  private final String name;

  RankingStrategy(String name) {
    this.name = name;
  }

  /**
   * Orders the dependents of one head.
   * @return every element of s.targets exactly once
   */
  abstract List<Integer> order(Siblings s);

  /** The name this strategy goes by in configuration. */
  public String getName() {
    return name;
  }

  /** True for the strategies that look at sentence ids. */
  public boolean needsSentences() {
    return this == CLOSEST_INTRA_RL_INTER_LR
        || this == CLOSEST_INTRA_RL_INTER_RL
        || this == CLOSEST_INTRA_LR_INTER_LR;
  }

  public static RankingStrategy forName(String name) {
    for (RankingStrategy s : values())
      if (s.name.equals(name))
        return s;
    throw new IllegalArgumentException("Unknown transformation strategy: " + name);
  }

  @Override
  public String toString() {
    return name;
  }

  private static List<Integer> drain(Deque<Integer> first, Deque<Integer> second) {
    List<Integer> result = new ArrayList<>(first.size() + second.size());
    while (!first.isEmpty())
      result.add(first.pop());
    while (!second.isEmpty())
      result.add(second.pop());
    return result;
  }

  private static List<Integer> alternate(Deque<Integer> first, Deque<Integer> second) {
    List<Integer> result = new ArrayList<>(first.size() + second.size());
    while (!first.isEmpty() || !second.isEmpty()) {
      if (!first.isEmpty())
        result.add(first.pop());
      if (!second.isEmpty())
        result.add(second.pop());
    }
    return result;
  }

  /**
   * A head and its dependents, with the dependents split by the side of the
   * head they sit on (by character offset).
   */
  static final class Siblings {
    final DependencyTree tree;
    final int head;
    final List<Integer> targets;      // in the given order
    private final List<Integer> leftOutsideIn;
    private final List<Integer> rightOutsideIn;
    private final Set<Integer> leftSet;

    Siblings(DependencyTree tree, int head, List<Integer> targets) {
      this.tree = tree;
      this.head = head;
      this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
      List<Integer> sorted = new ArrayList<>(targets.size() + 1);
      sorted.add(head);
      sorted.addAll(targets);
      sorted.sort((a, b) -> Integer.compare(tree.getStart(a), tree.getStart(b)));
      int centre = sorted.indexOf(head);
      leftOutsideIn = new ArrayList<>(sorted.subList(0, centre));
      rightOutsideIn = new ArrayList<>(sorted.subList(centre + 1, sorted.size()));
      Collections.reverse(rightOutsideIn);
      leftSet = new HashSet<>(leftOutsideIn);
    }

    /** Fresh stack of left dependents, nearest on top. */
    Deque<Integer> leftStack() {
      return stack(leftOutsideIn);
    }

    /** Fresh stack of right dependents, nearest on top. */
    Deque<Integer> rightStack() {
      return stack(rightOutsideIn);
    }

    private static Deque<Integer> stack(List<Integer> outsideIn) {
      Deque<Integer> d = new ArrayDeque<>(outsideIn.size());
      for (int i : outsideIn)
        d.push(i);
      return d;
    }

    /** Left of the head by character offset. */
    boolean isLeft(int node) {
      return leftSet.contains(node);
    }

    /** Right of the head by raw position. */
    boolean isRightOf(int node) {
      return tree.getIdx(node) > tree.getIdx(head);
    }

    int distance(int node) {
      return Math.abs(tree.getIdx(node) - tree.getIdx(head));
    }

    /** Same sentence as the head. Nothing is in the fake root's sentence. */
    boolean isIntra(int node) {
      if (head == DependencyTree.FAKE_ROOT)
        return false;
      return tree.getSentence(node) == tree.getSentence(head);
    }
  }
}
