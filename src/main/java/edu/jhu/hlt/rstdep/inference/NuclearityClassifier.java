package edu.jhu.hlt.rstdep.inference;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;

/**
 * Rule based nuclearity: every dependent whose relation is multinuclear is a
 * nucleus, every other dependent is a satellite (its head being the nucleus).
 * Which relations count as multinuclear depends on the
 * {@link NuclearityStrategy}.
 *
 * @author travis
 */
public class NuclearityClassifier {
  public static final Logger LOG = Logger.getLogger(NuclearityClassifier.class);

  /**
   * Relations that are always multinuclear in the RST-DT training set.
   */
  public static final ImmutableSet<String> UNAMBIGUOUS_MULTINUCLEAR =
      ImmutableSet.of("joint", "same-unit", "textual");

  private final NuclearityStrategy strategy;
  private final NuclearityStatistics statistics;  // may be null
  private ImmutableSet<String> multinuclear;       // null until fit

  public NuclearityClassifier(String strategy) {
    this(NuclearityStrategy.forName(strategy), null);
  }

  public NuclearityClassifier(NuclearityStrategy strategy) {
    this(strategy, null);
  }

  /**
   * @param statistics the most frequent pattern per relation, used by
   * {@link NuclearityStrategy#MOST_FREQUENT_BY_REL}. If null, fit counts them
   * from its training data.
   */
  public NuclearityClassifier(NuclearityStrategy strategy, NuclearityStatistics statistics) {
    if (strategy == null)
      throw new IllegalArgumentException("no nuclearity strategy given");
    this.strategy = strategy;
    this.statistics = statistics;
  }

  public NuclearityStrategy getStrategy() {
    return strategy;
  }

  /**
   * Sets up the multinuclear relation set. Training data is only looked at by
   * MOST_FREQUENT_BY_REL without a statistics table, otherwise both arguments
   * may be null.
   *
   * @param trees training trees
   * @param labels gold nuclearity for each node of each training tree
   */
  public NuclearityClassifier fit(List<DependencyTree> trees, List<Nuclearity[]> labels) {
    switch (strategy) {
      case UNAMB_ELSE_MOST_FREQUENT:
        multinuclear = UNAMBIGUOUS_MULTINUCLEAR;
        break;
      case MOST_FREQUENT_BY_REL:
        NuclearityStatistics stats = statistics;
        if (stats == null) {
          if (trees == null || labels == null) {
            throw new IllegalArgumentException(strategy
                + " needs either a statistics table or training data");
          }
          stats = NuclearityStatistics.fromTraining(trees, labels);
        }
        multinuclear = stats.multinuclearRelations();
        break;
      default:
        throw new IllegalArgumentException("Unknown nuclearity strategy: " + strategy);
    }
    LOG.info("[fit] strategy=" + strategy + " multinuclear=" + multinuclear);
    return this;
  }

  public boolean isFit() {
    return multinuclear != null;
  }

  /** Throws if not fit yet. */
  public ImmutableSet<String> getMultinuclearRelations() {
    checkFit();
    return multinuclear;
  }

  private void checkFit() {
    if (multinuclear == null)
      throw new IllegalStateException("call fit before using this classifier");
  }

  /**
   * @return one nuclearity array per tree, parallel to its nodes; the fake
   * root gets {@link Nuclearity#ROOT}.
   */
  public List<Nuclearity[]> predict(List<DependencyTree> trees) {
    checkFit();
    List<Nuclearity[]> y = new ArrayList<>(trees.size());
    for (DependencyTree t : trees)
      y.add(predict(t));
    return y;
  }

  public Nuclearity[] predict(DependencyTree tree) {
    checkFit();
    Nuclearity[] nucs = new Nuclearity[tree.size()];
    nucs[DependencyTree.FAKE_ROOT] = Nuclearity.ROOT;
    for (int i = 1; i < nucs.length; i++) {
      nucs[i] = multinuclear.contains(tree.getLabel(i))
          ? Nuclearity.NUCLEUS
          : Nuclearity.SATELLITE;
    }
    return nucs;
  }
}
