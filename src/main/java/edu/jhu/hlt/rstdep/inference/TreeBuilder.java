package edu.jhu.hlt.rstdep.inference;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.primitives.Ints;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;
import edu.jhu.hlt.rstdep.datatypes.DiscourseTree;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;
import edu.jhu.hlt.rstdep.datatypes.StructureException;

/**
 * Turns a dependency tree with attachment ranks and nuclearity into a binary
 * {@link DiscourseTree}.
 *
 * Nodes are ordered by text span, so <code>e1 -R-> e2</code> and
 * <code>e2 -R-> e1</code> both become <code>R(e1, e2)</code>; the difference
 * is which side is the nucleus. A head with several dependents is folded
 * rather than mapped: the head's tree is replaced by an increasingly nested
 * tree as its dependents are attached, in rank order.
 * <pre>
 *         r1                     r2
 *     src +--> tgt1             /  \
 *         |r2          ==>    r1   tgt2
 *         +--> tgt2          /  \
 *                          src  tgt1
 * </pre>
 *
 * The walk recurses once per level of the dependency tree. Attachment chains
 * in RST-DT are at most a few dozen deep; for deeper input the walk can be
 * run off an explicit stack of (node, accumulator, next child) frames.
 *
 * @author travis
 */
public class TreeBuilder {
  public static final Logger LOG = Logger.getLogger(TreeBuilder.class);

  public List<DiscourseTree> convert(List<DependencyTree> trees) {
    List<DiscourseTree> out = new ArrayList<>(trees.size());
    for (DependencyTree t : trees)
      out.add(convert(t));
    return out;
  }

  /**
   * @throws StructureException if the tree does not have exactly one real
   * root, has nodes that can't be reached from it, or two subtrees that get
   * attached overlap in the text.
   * @throws IllegalStateException if the tree lacks nuclearity or ranks
   */
  public DiscourseTree convert(DependencyTree tree) {
    if (!tree.hasNuclearity())
      throw new IllegalStateException("tree has no nuclearity, run a NuclearityClassifier first");
    if (!tree.hasRanks())
      throw new IllegalStateException("tree has no attachment ranks, run an AttachmentRanker first");

    List<Integer> roots = tree.realRoots();
    if (roots.size() != 1) {
      throw new StructureException("Cannot convert dependency tree to discourse tree, "
          + (roots.isEmpty() ? "no real root" : "multiple roots: " + roots),
          Ints.toArray(roots));
    }
    int root = roots.get(0);

    Walk w = new Walk(tree);
    TreeParts rparts = w.walk(null, root);
    if (w.visited != tree.numEdus()) {
      List<Integer> unreached = new ArrayList<>();
      for (int i = 1; i < tree.size(); i++)
        if (!w.seen[i])
          unreached.add(i);
      throw new StructureException("nodes not reachable from root " + root
          + " (cycle?)", Ints.toArray(unreached));
    }
    DiscourseTree result = rparts.toTree(Nuclearity.ROOT);
    if (LOG.isDebugEnabled())
      LOG.debug("[convert] " + tree + " => " + result);
    return result;
  }

  /** State for one conversion. */
  private static final class Walk {
    private final DependencyTree tree;
    private final boolean[] seen;
    private int visited = 0;

    Walk(DependencyTree tree) {
      this.tree = tree;
      this.seen = new boolean[tree.size()];
    }

    /**
     * Builds the tree for node and all its descendants and, unless ancestor
     * is null (node is the root), attaches it to ancestor, which is the
     * partial tree of node's head.
     */
    TreeParts walk(TreeParts ancestor, int node) {
      seen[node] = true;
      visited++;
      TreeParts src = TreeParts.leaf(node, tree.getEdu(node));
      // fold, don't map: each dependent is attached to the tree built so far
      for (int tgt : tree.deps(node))
        src = walk(src, tgt);
      if (ancestor == null)
        return src;
      Nuclearity nuc = tree.getNuclearity(node);
      if (nuc == null)
        throw new IllegalStateException("no nuclearity for node " + node);
      return connect(ancestor, src, tree.getLabel(node), nuc);
    }

    /**
     * Puts src and tgt under one node, in text order. src, the side of the
     * head, is the nucleus; tgt gets the nuclearity of the edge.
     */
    TreeParts connect(TreeParts src, TreeParts tgt, String relation, Nuclearity nuc) {
      DiscourseTree left, right;
      if (src.span.overlaps(tgt.span)) {
        throw new StructureException("Span " + src.span + " of " + src.anchor
            + " overlaps with " + tgt.span + " of " + tgt.anchor
            + " on edge " + tree.getHead(tgt.node) + " -" + relation + "-> " + tgt.node,
            tree.getHead(tgt.node), tgt.node);
      } else if (src.span.compareTo(tgt.span) <= 0) {
        left = src.toTree(Nuclearity.NUCLEUS);
        right = tgt.toTree(nuc);
      } else {
        left = tgt.toTree(nuc);
        right = src.toTree(Nuclearity.NUCLEUS);
      }
      return TreeParts.join(src, relation, left, right);
    }
  }
}
