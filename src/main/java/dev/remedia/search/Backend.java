package dev.remedia.search;

/** The two retrieval backends fanned out to for every query. */
public enum Backend {
  TEXT,
  VECTOR
}
