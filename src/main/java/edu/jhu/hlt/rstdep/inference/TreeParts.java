package edu.jhu.hlt.rstdep.inference;

import edu.jhu.hlt.rstdep.datatypes.DiscourseTree;
import edu.jhu.hlt.rstdep.datatypes.Edu;
import edu.jhu.hlt.rstdep.datatypes.EduSpan;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;
import edu.jhu.hlt.rstdep.datatypes.Span;

/**
 * A partially built discourse tree: everything but its own nuclearity, which
 * is only known once it gets attached to something (or becomes the root).
 */
final class TreeParts {
  final int node;          // dependency tree node this was built from
  final Edu anchor;
  final EduSpan eduSpan;
  final Span span;
  final String relation;
  final DiscourseTree left, right;   // both null for a leaf

  private TreeParts(int node, Edu anchor, EduSpan eduSpan, Span span,
      String relation, DiscourseTree left, DiscourseTree right) {
    this.node = node;
    this.anchor = anchor;
    this.eduSpan = eduSpan;
    this.span = span;
    this.relation = relation;
    this.left = left;
    this.right = right;
  }

  static TreeParts leaf(int node, Edu edu) {
    return new TreeParts(node, edu, EduSpan.single(edu.getNum()), edu.getSpan(),
        DiscourseTree.LEAF, null, null);
  }

  /** Keeps the anchor (and node) of src. */
  static TreeParts join(TreeParts src, String relation,
      DiscourseTree left, DiscourseTree right) {
    return new TreeParts(src.node, src.anchor, left.getEduSpan().union(right.getEduSpan()),
        left.getSpan().merge(right.getSpan()), relation, left, right);
  }

  boolean isLeaf() {
    return left == null;
  }

  DiscourseTree toTree(Nuclearity nuclearity) {
    if (isLeaf())
      return DiscourseTree.leaf(nuclearity, anchor);
    return DiscourseTree.binary(nuclearity, relation, left, right);
  }

  @Override
  public String toString() {
    return "<TreeParts " + anchor + " " + eduSpan + " " + span.shortString()
        + " " + relation + ">";
  }
}
