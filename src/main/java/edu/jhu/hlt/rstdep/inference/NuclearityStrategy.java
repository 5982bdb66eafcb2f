package edu.jhu.hlt.rstdep.inference;

/**
 * How a {@link NuclearityClassifier} decides which relations are
 * multinuclear.
 */
public enum NuclearityStrategy {
  /**
   * Relations that are unambiguously multinuclear in the RST-DT training set
   * are predicted multinuclear, everything else mononuclear.
   */
  UNAMB_ELSE_MOST_FREQUENT("unamb_else_most_frequent"),

  /**
   * The most frequent nuclearity pattern of each relation in a
   * {@link NuclearityStatistics} table.
   */
  MOST_FREQUENT_BY_REL("most_frequent_by_rel");

  private final String name;

  NuclearityStrategy(String name) {
    this.name = name;
  }

  /** The name this strategy goes by in configuration. */
  public String getName() {
    return name;
  }

  public static NuclearityStrategy forName(String name) {
    for (NuclearityStrategy s : values())
      if (s.name.equals(name))
        return s;
    throw new IllegalArgumentException("Unknown nuclearity strategy: " + name);
  }

  @Override
  public String toString() {
    return name;
  }
}
