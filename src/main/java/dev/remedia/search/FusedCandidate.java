package dev.remedia.search;

/**
 * A candidate after reciprocal rank fusion.
 *
 * @param candidateId the candidate
 * @param score accumulated RRF score
 * @param bestBackendRank the smallest rank any backend gave the candidate (tie-break key)
 * @param fusedRank 1-based position in the fused ordering
 */
public record FusedCandidate(
    String candidateId, double score, int bestBackendRank, int fusedRank) {}
