package edu.jhu.hlt.rstdep.inference;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.rstdep.datatypes.DependencyTree;
import edu.jhu.hlt.rstdep.datatypes.DiscourseTree;
import edu.jhu.hlt.rstdep.datatypes.Nuclearity;
import edu.jhu.hlt.rstdep.datatypes.StructureException;
import edu.jhu.hlt.rstdep.util.ExperimentProperties;

/**
 * Nuclearity, then attachment ranking, then folding into a discourse tree.
 *
 * Settings:
 * <ul>
 * <li>nuclearity.strategy (unamb_else_most_frequent)</li>
 * <li>nuclearity.overwrite (false): predict nuclearity even when the tree
 *     already has some</li>
 * <li>ranking.strategy (id)</li>
 * <li>ranking.overwrite (true): rank even when the tree already has ranks</li>
 * <li>convert.logEvery (100): progress logging interval in convertAll</li>
 * </ul>
 *
 * @author travis
 */
public class DependencyToConstituency {
  public static final Logger LOG = Logger.getLogger(DependencyToConstituency.class);

  private final NuclearityClassifier classifier;
  private final AttachmentRanker ranker;
  private final TreeBuilder builder;
  private final boolean overwriteNuclearity;
  private final boolean overwriteRanks;
  private final int logEvery;

  public DependencyToConstituency(ExperimentProperties config) {
    this(config, null);
  }

  /**
   * @param statistics passed on to the classifier, may be null
   */
  public DependencyToConstituency(ExperimentProperties config, NuclearityStatistics statistics) {
    NuclearityStrategy ns = NuclearityStrategy.forName(
        config.getString("nuclearity.strategy", NuclearityStrategy.UNAMB_ELSE_MOST_FREQUENT.getName()));
    RankingStrategy rs = RankingStrategy.forName(
        config.getString("ranking.strategy", RankingStrategy.ID.getName()));
    this.classifier = new NuclearityClassifier(ns, statistics);
    // only most_frequent_by_rel without a table needs training data
    if (ns == NuclearityStrategy.UNAMB_ELSE_MOST_FREQUENT || statistics != null)
      classifier.fit(null, null);
    this.ranker = new AttachmentRanker(rs);
    this.builder = new TreeBuilder();
    this.overwriteNuclearity = config.getBoolean("nuclearity.overwrite", false);
    this.overwriteRanks = config.getBoolean("ranking.overwrite", true);
    this.logEvery = config.getInt("convert.logEvery", 100);
    LOG.info("[init] nuclearity=" + ns + " overwrite=" + overwriteNuclearity
        + " ranking=" + rs + " overwrite=" + overwriteRanks);
  }

  public NuclearityClassifier getClassifier() {
    return classifier;
  }

  public AttachmentRanker getRanker() {
    return ranker;
  }

  /**
   * Fits the nuclearity classifier, see
   * {@link NuclearityClassifier#fit(List, List)}. Only needed for
   * most_frequent_by_rel without a statistics table.
   */
  public DependencyToConstituency fit(List<DependencyTree> trees, List<Nuclearity[]> labels) {
    classifier.fit(trees, labels);
    return this;
  }

  /**
   * Adds whatever annotation the builder needs and is missing. Unless
   * nuclearity.overwrite is set, given nuclearity is kept node by node and
   * only the unset entries are predicted.
   */
  public DependencyTree annotate(DependencyTree tree) {
    DependencyTree t = tree;
    if (overwriteNuclearity || !t.hasNuclearity()) {
      t = t.withNuclearity(classifier.predict(t));
    } else if (!t.hasCompleteNuclearity()) {
      Nuclearity[] nucs = classifier.predict(t);
      for (int i = 1; i < nucs.length; i++) {
        Nuclearity given = t.getNuclearity(i);
        if (given != null)
          nucs[i] = given;
      }
      t = t.withNuclearity(nucs);
    }
    if (overwriteRanks || !t.hasRanks())
      t = t.withRanks(ranker.predict(t));
    return t;
  }

  public DiscourseTree convert(DependencyTree tree) {
    return builder.convert(annotate(tree));
  }

  /**
   * @param skipMalformed if true, documents that raise a StructureException
   * are logged and left out of the result, otherwise the exception propagates.
   */
  public List<DiscourseTree> convertAll(List<DependencyTree> trees, boolean skipMalformed) {
    List<DiscourseTree> out = new ArrayList<>(trees.size());
    int skipped = 0;
    for (int i = 0; i < trees.size(); i++) {
      try {
        out.add(convert(trees.get(i)));
      } catch (StructureException e) {
        if (!skipMalformed)
          throw e;
        skipped++;
        LOG.warn("[convertAll] skipping document " + i + ": " + e.getMessage());
      }
      if (logEvery > 0 && (i + 1) % logEvery == 0)
        LOG.info("[convertAll] " + (i + 1) + " of " + trees.size() + " documents");
    }
    LOG.info("[convertAll] converted " + out.size() + " documents, skipped " + skipped);
    return out;
  }
}
