package pgdeps.models;

public enum CaseSensitivity
{
  INSENSITIVE_STORED_LOWER,
  INSENSITIVE_STORED_UPPER,
  INSENSITIVE_STORED_MIXED,
  SENSITIVE
}
