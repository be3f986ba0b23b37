package pgdeps.models;

public enum EdgeKind
{
  /** The dependent object references the other object in its definition. */
  USES,
  /** The dependent table declares a foreign key into the other object. */
  FOREIGN_KEY
}
