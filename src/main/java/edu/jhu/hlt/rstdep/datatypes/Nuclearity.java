package edu.jhu.hlt.rstdep.datatypes;

/**
 * Relative discourse importance of one side of a relation. ROOT only ever
 * labels the top node of a {@link DiscourseTree} (and the fake root of a
 * {@link DependencyTree}).
 */
public enum Nuclearity {
  NUCLEUS("N"),
  SATELLITE("S"),
  ROOT("R");

  private final String code;

  Nuclearity(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
