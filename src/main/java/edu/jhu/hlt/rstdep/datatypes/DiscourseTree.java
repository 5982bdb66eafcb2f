package edu.jhu.hlt.rstdep.datatypes;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A binary RST constituency tree. Every node carries a nuclearity, the range
 * of EDUs and the characters it covers, and a relation label. A node is
 * either a leaf holding one {@link Edu} (relation {@link #LEAF}) or has
 * exactly two children whose spans do not overlap.
 *
 * Immutable.
 *
 * @author travis
 */
public class DiscourseTree implements Serializable {
  private static final long serialVersionUID = 6204170960473925519L;

  public static final String LEAF = "leaf";

  private final Nuclearity nuclearity;
  private final EduSpan eduSpan;
  private final Span span;
  private final String relation;
  private final Edu edu;                  // non-null iff leaf
  private final DiscourseTree left, right;

  private DiscourseTree(Nuclearity nuclearity, EduSpan eduSpan, Span span,
      String relation, Edu edu, DiscourseTree left, DiscourseTree right) {
    if (nuclearity == null)
      throw new IllegalArgumentException("no nuclearity for " + eduSpan);
    this.nuclearity = nuclearity;
    this.eduSpan = eduSpan;
    this.span = span;
    this.relation = relation;
    this.edu = edu;
    this.left = left;
    this.right = right;
  }

  public static DiscourseTree leaf(Nuclearity nuclearity, Edu edu) {
    return new DiscourseTree(nuclearity, EduSpan.single(edu.getNum()),
        edu.getSpan(), LEAF, edu, null, null);
  }

  /**
   * Joins two trees. left must come strictly before right in the text (no
   * overlapping characters) or an IllegalArgumentException is thrown.
   */
  public static DiscourseTree binary(Nuclearity nuclearity, String relation,
      DiscourseTree left, DiscourseTree right) {
    if (left.span.overlaps(right.span) || left.span.compareTo(right.span) > 0) {
      throw new IllegalArgumentException("children out of order or overlapping: "
          + left.span + " " + right.span);
    }
    return new DiscourseTree(nuclearity, left.eduSpan.union(right.eduSpan),
        left.span.merge(right.span), relation, null, left, right);
  }

  public Nuclearity getNuclearity() {
    return nuclearity;
  }

  public EduSpan getEduSpan() {
    return eduSpan;
  }

  public Span getSpan() {
    return span;
  }

  public String getRelation() {
    return relation;
  }

  public boolean isLeaf() {
    return edu != null;
  }

  /** The EDU of a leaf, null for internal nodes. */
  public Edu getEdu() {
    return edu;
  }

  public DiscourseTree getLeft() {
    return left;
  }

  public DiscourseTree getRight() {
    return right;
  }

  public List<DiscourseTree> getChildren() {
    if (isLeaf())
      return Collections.emptyList();
    List<DiscourseTree> c = new ArrayList<>(2);
    c.add(left);
    c.add(right);
    return c;
  }

  /** EDUs at the leaves, left to right. */
  public List<Edu> getLeaves() {
    List<Edu> leaves = new ArrayList<>();
    addLeaves(leaves);
    return leaves;
  }

  private void addLeaves(List<Edu> addTo) {
    if (isLeaf()) {
      addTo.add(edu);
    } else {
      left.addLeaves(addTo);
      right.addLeaves(addTo);
    }
  }

  /** 0 for a leaf. */
  public int getDepth() {
    if (isLeaf())
      return 0;
    return 1 + Math.max(left.getDepth(), right.getDepth());
  }

  @Override
  public int hashCode() {
    int h = nuclearity.hashCode() * 83 + eduSpan.hashCode();
    h = h * 83 + relation.hashCode();
    if (!isLeaf())
      h = h * 83 + left.hashCode() * 7 + right.hashCode();
    return h;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof DiscourseTree) {
      DiscourseTree t = (DiscourseTree) other;
      if (nuclearity != t.nuclearity
          || !eduSpan.equals(t.eduSpan)
          || !span.equals(t.span)
          || !relation.equals(t.relation)
          || isLeaf() != t.isLeaf())
        return false;
      if (isLeaf())
        return edu.equals(t.edu);
      return left.equals(t.left) && right.equals(t.right);
    }
    return false;
  }

  /**
   * Bracketed rendering for debugging, e.g.
   * <code>(R:elaboration (N:leaf e0) (S:leaf e1))</code>
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    toString(sb);
    return sb.toString();
  }

  private void toString(StringBuilder sb) {
    sb.append('(').append(nuclearity.getCode()).append(':').append(relation);
    if (isLeaf()) {
      sb.append(" e").append(edu.getNum());
    } else {
      sb.append(' ');
      left.toString(sb);
      sb.append(' ');
      right.toString(sb);
    }
    sb.append(')');
  }
}
