package dev.remedia.search;

/** How the rank lists of a multi-query batch are fused. */
public enum BatchMode {

  /** Fuse each query to its own top list, then merge the lists by summed fused score. */
  PER_QUERY,

  /** Feed every rank list of every query into a single fusion. */
  POOLED
}
