package dev.remedia.search;

import dev.remedia.chunk.Candidate;

/**
 * A fused candidate placed in its section.
 *
 * @param candidate the fetched chunk
 * @param fusedRank 1-based position after fusion
 * @param fusedScore RRF score
 * @param weight positional weight {@code W / fusedRank^P}
 * @param adjacent true when window {@code index ± 1} of the same section was also fused
 */
public record SectionMember(
    Candidate candidate, int fusedRank, double fusedScore, double weight, boolean adjacent) {}
