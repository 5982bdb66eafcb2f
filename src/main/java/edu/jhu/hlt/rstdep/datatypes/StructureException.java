package edu.jhu.hlt.rstdep.datatypes;

import java.util.Arrays;

/**
 * A dependency tree that cannot be turned into a discourse tree: zero or
 * several real roots, unreachable nodes, or two subtrees whose character
 * spans overlap. Fatal for the tree at hand, the caller decides whether to
 * skip the document.
 *
 * @author travis
 */
public class StructureException extends RuntimeException {
  private static final long serialVersionUID = -2734459154807232217L;

  private final int[] nodes;

  public StructureException(String msg, int... nodes) {
    super(msg + " nodes=" + Arrays.toString(nodes));
    this.nodes = nodes;
  }

  /** Indices (in the dependency tree) of the nodes that caused the failure. */
  public int[] getNodes() {
    return Arrays.copyOf(nodes, nodes.length);
  }
}
