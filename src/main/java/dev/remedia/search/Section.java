package dev.remedia.search;

import java.util.List;

/**
 * A group of fused candidates from the same document section.
 *
 * @param sectionId the shared section identifier
 * @param score final score after adjacency bonus and diminishing returns
 * @param rawScore accumulated positional weight plus adjacency bonus, before diminishing returns
 * @param members members in fused-rank order, never empty
 */
public record Section(String sectionId, double score, double rawScore, List<SectionMember> members) {

  public Section {
    if (members.isEmpty()) {
      throw new IllegalArgumentException("A section needs at least one member");
    }
    members = List.copyOf(members);
  }

  /** Fused rank of the best member; the first tie-break between equally scored sections. */
  public int leadRank() {
    return members.get(0).fusedRank();
  }
}
