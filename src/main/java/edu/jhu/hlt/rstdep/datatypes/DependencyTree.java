package edu.jhu.hlt.rstdep.datatypes;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A discourse dependency tree over n EDUs, stored as n+1 parallel arrays.
 * Index 0 is a fake root which has no EDU; a node i with heads[i] == 0 is a
 * real root of the discourse.
 *
 * Nuclearity, attachment ranks and sentence ids are optional. The first two
 * are filled in by a NuclearityClassifier and an AttachmentRanker (or come
 * from the corpus reader), and are attached with {@link #withNuclearity} and
 * {@link #withRanks}, which return copies: a DependencyTree is never mutated.
 *
 * @author travis
 */
public class DependencyTree implements Serializable {
  private static final long serialVersionUID = -4925160711035542113L;

  public static final int FAKE_ROOT = 0;
  public static final int NO_HEAD = -1;
  public static final String ROOT_LABEL = "ROOT";

  private final Edu[] edus;
  private final int[] heads;
  private final String[] labels;
  private final Nuclearity[] nucs;    // may be null
  private final int[] ranks;          // may be null
  private final int[] sentences;      // may be null
  private final int[] idx;

  private transient int hashCode = 0;

  /**
   * @param edus EDUs indexed by node, edus[0] is ignored (the fake root)
   * @param heads heads[i] is the governor of node i, heads[0] is ignored
   * @param labels labels[i] is the relation on the edge heads[i] -> i
   */
  public DependencyTree(Edu[] edus, int[] heads, String[] labels) {
    this(edus, heads, labels, null, null, null, null);
  }

  /**
   * @param nucs may be null
   * @param ranks may be null
   * @param sentences sentence id of every node, may be null
   * @param idx raw position of every node, null means the identity
   */
  public DependencyTree(Edu[] edus, int[] heads, String[] labels,
      Nuclearity[] nucs, int[] ranks, int[] sentences, int[] idx) {
    int n = heads.length;
    if (n == 0)
      throw new IllegalArgumentException("need at least the fake root");
    checkLength("edus", edus.length, n);
    checkLength("labels", labels.length, n);
    if (nucs != null) checkLength("nucs", nucs.length, n);
    if (ranks != null) checkLength("ranks", ranks.length, n);
    if (sentences != null) checkLength("sentences", sentences.length, n);
    if (idx != null) checkLength("idx", idx.length, n);
    for (int i = 1; i < n; i++) {
      if (heads[i] < 0 || heads[i] >= n)
        throw new IllegalArgumentException("head of " + i + " out of range: " + heads[i]);
      if (heads[i] == i)
        throw new IllegalArgumentException("node " + i + " heads itself");
      if (edus[i] == null)
        throw new IllegalArgumentException("node " + i + " has no EDU");
      if (labels[i] == null)
        throw new IllegalArgumentException("node " + i + " has no relation label");
    }
    this.edus = Arrays.copyOf(edus, n);
    this.heads = Arrays.copyOf(heads, n);
    this.labels = Arrays.copyOf(labels, n);
    this.edus[FAKE_ROOT] = null;
    this.heads[FAKE_ROOT] = NO_HEAD;
    this.labels[FAKE_ROOT] = ROOT_LABEL;
    this.nucs = nucs == null ? null : Arrays.copyOf(nucs, n);
    if (this.nucs != null)
      this.nucs[FAKE_ROOT] = Nuclearity.ROOT;
    this.ranks = ranks == null ? null : Arrays.copyOf(ranks, n);
    this.sentences = sentences == null ? null : Arrays.copyOf(sentences, n);
    if (idx == null) {
      this.idx = new int[n];
      for (int i = 0; i < n; i++)
        this.idx[i] = i;
    } else {
      this.idx = Arrays.copyOf(idx, n);
    }
  }

  private static void checkLength(String name, int length, int n) {
    if (length != n) {
      throw new IllegalArgumentException(
          name + " has length " + length + " but there are " + n + " nodes");
    }
  }

  /** A copy of this tree carrying the given nuclearity annotation. */
  public DependencyTree withNuclearity(Nuclearity[] nucs) {
    return new DependencyTree(edus, heads, labels, nucs, ranks, sentences, idx);
  }

  /** A copy of this tree carrying the given attachment ranks. */
  public DependencyTree withRanks(int[] ranks) {
    return new DependencyTree(edus, heads, labels, nucs, ranks, sentences, idx);
  }

  /** A copy of this tree carrying sentence ids (one per node). */
  public DependencyTree withSentences(int[] sentences) {
    return new DependencyTree(edus, heads, labels, nucs, ranks, sentences, idx);
  }

  /** Number of nodes, including the fake root. */
  public int size() {
    return heads.length;
  }

  /** Number of EDUs, i.e. size() - 1. */
  public int numEdus() {
    return heads.length - 1;
  }

  public Edu getEdu(int i) {
    return edus[i];
  }

  public int getHead(int i) {
    return heads[i];
  }

  public String getLabel(int i) {
    return labels[i];
  }

  public boolean isRealRoot(int i) {
    return i != FAKE_ROOT && heads[i] == FAKE_ROOT;
  }

  public boolean hasNuclearity() {
    return nucs != null;
  }

  /** Throws if no nuclearity is attached. */
  public Nuclearity getNuclearity(int i) {
    if (nucs == null)
      throw new IllegalStateException("no nuclearity attached to this tree");
    return nucs[i];
  }

  public boolean hasRanks() {
    return ranks != null;
  }

  /** Throws if no ranks are attached. */
  public int getRank(int i) {
    if (ranks == null)
      throw new IllegalStateException("no attachment ranks attached to this tree");
    return ranks[i];
  }

  public boolean hasSentences() {
    return sentences != null;
  }

  /** Throws if no sentence ids are attached. */
  public int getSentence(int i) {
    if (sentences == null)
      throw new IllegalStateException("no sentence ids attached to this tree");
    return sentences[i];
  }

  /** Raw position of node i, used to measure distances between nodes. */
  public int getIdx(int i) {
    return idx[i];
  }

  /**
   * Character offset where node i starts. The fake root comes before
   * everything.
   */
  public int getStart(int i) {
    return i == FAKE_ROOT ? Integer.MIN_VALUE : edus[i].getSpan().start;
  }

  /** Nodes attached to the fake root, in index order. */
  public List<Integer> realRoots() {
    List<Integer> roots = new ArrayList<>();
    for (int i = 1; i < heads.length; i++)
      if (heads[i] == FAKE_ROOT)
        roots.add(i);
    return roots;
  }

  /** Children of head, in index order. */
  public List<Integer> children(int head) {
    List<Integer> c = new ArrayList<>();
    for (int i = 1; i < heads.length; i++)
      if (heads[i] == head)
        c.add(i);
    return c;
  }

  /**
   * Children of head sorted by attachment rank, ties broken by index.
   * Requires ranks.
   */
  public List<Integer> deps(int head) {
    if (ranks == null)
      throw new IllegalStateException("no attachment ranks attached to this tree");
    List<Integer> c = children(head);
    c.sort((a, b) -> {
      int r = Integer.compare(ranks[a], ranks[b]);
      return r != 0 ? r : Integer.compare(a, b);
    });
    return c;
  }

  /**
   * True if nuclearity is attached and set for every node. A corpus reader
   * may leave some entries null.
   */
  public boolean hasCompleteNuclearity() {
    if (nucs == null)
      return false;
    for (int i = 1; i < nucs.length; i++)
      if (nucs[i] == null)
        return false;
    return true;
  }

  /** null if no ranks are attached. */
  public int[] getRanks() {
    return ranks == null ? null : Arrays.copyOf(ranks, ranks.length);
  }

  @Override
  public int hashCode() {
    if (hashCode == 0) {
      int n = size();
      for (int i = 0; i < n; i++)
        hashCode = hashCode * 83 + heads[i];
    }
    return hashCode;
  }

  /** Structural equality: same heads and labels. */
  @Override
  public boolean equals(Object other) {
    if (other instanceof DependencyTree) {
      DependencyTree d = (DependencyTree) other;
      return Arrays.equals(heads, d.heads)
          && Arrays.equals(labels, d.labels);
    }
    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("<DependencyTree");
    for (int i = 1; i < heads.length; i++) {
      sb.append(' ').append(heads[i]).append('-').append(labels[i])
        .append("->").append(i);
      if (nucs != null && nucs[i] != null)
        sb.append(':').append(nucs[i].getCode());
      if (ranks != null)
        sb.append('#').append(ranks[i]);
    }
    return sb.append('>').toString();
  }
}
