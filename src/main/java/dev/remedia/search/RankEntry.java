package dev.remedia.search;

/**
 * A candidate id at its 1-based position in one backend's list (rank 1 = best).
 *
 * @param candidateId the ranked candidate
 * @param rank position in the list, starting at 1
 */
public record RankEntry(String candidateId, int rank) {}
