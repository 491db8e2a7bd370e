package dev.remedia.search;

import dev.remedia.chunk.Candidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Second-stage ranking that consolidates fused candidates into document sections.
 *
 * <p>Scoring, for a member at fused rank {@code r}:
 *
 * <ol>
 *   <li>positional weight {@code w = baseWeight / r^decayExponent}
 *   <li>section raw score accumulates {@code w}, plus {@code adjacencyBonus * w} when window
 *       {@code index ± 1} of the same section is also among the fused candidates
 *   <li>a section with {@code n > 1} members scores {@code raw / (1 + lambda * (n - 1))}
 * </ol>
 *
 * <p>Sections are ordered by score descending, then by the fused rank of their best member, then by
 * section id. Members stay in fused-rank order.
 */
@Component
public class SectionGrouper {

  private static final Logger log = LoggerFactory.getLogger(SectionGrouper.class);

  static final Comparator<Section> SECTION_ORDER =
      Comparator.comparingDouble(Section::score)
          .reversed()
          .thenComparingInt(Section::leadRank)
          .thenComparing(Section::sectionId);

  private final double baseWeight;
  private final double decayExponent;
  private final double adjacencyBonus;
  private final double lambda;

  public SectionGrouper(SearchProperties properties) {
    this(
        properties.getBaseWeight(),
        properties.getDecayExponent(),
        properties.getAdjacencyBonus(),
        properties.getLambda());
  }

  SectionGrouper(double baseWeight, double decayExponent, double adjacencyBonus, double lambda) {
    this.baseWeight = baseWeight;
    this.decayExponent = decayExponent;
    this.adjacencyBonus = adjacencyBonus;
    this.lambda = lambda;
  }

  /**
   * Groups fused candidates by section and orders the sections.
   *
   * @param fused fused candidates in fused-rank order
   * @param candidates fetched content by id; fused ids without content are dropped
   * @return sections, best first; empty when nothing could be placed
   */
  public List<Section> group(List<FusedCandidate> fused, Map<String, Candidate> candidates) {
    List<Placed> placed = new ArrayList<>(fused.size());
    Map<String, Set<Integer>> windowsBySection = new HashMap<>();

    for (FusedCandidate f : fused) {
      Candidate candidate = candidates.get(f.candidateId());
      if (candidate == null) {
        log.debug("No content fetched for fused candidate {}; dropping it", f.candidateId());
        continue;
      }
      placed.add(new Placed(f, candidate));
      if (candidate.hasWindowIndex()) {
        windowsBySection
            .computeIfAbsent(candidate.sectionId(), id -> new HashSet<>())
            .add(candidate.windowIndex());
      }
    }

    Map<String, List<SectionMember>> membersBySection = new LinkedHashMap<>();
    for (Placed p : placed) {
      Candidate candidate = p.candidate();
      Set<Integer> windows = windowsBySection.getOrDefault(candidate.sectionId(), Set.of());
      boolean adjacent =
          candidate.hasWindowIndex()
              && (windows.contains(candidate.windowIndex() - 1)
                  || windows.contains(candidate.windowIndex() + 1));
      SectionMember member =
          new SectionMember(
              candidate,
              p.fused().fusedRank(),
              p.fused().score(),
              positionalWeight(p.fused().fusedRank()),
              adjacent);
      membersBySection.computeIfAbsent(candidate.sectionId(), id -> new ArrayList<>()).add(member);
    }

    List<Section> sections = new ArrayList<>(membersBySection.size());
    membersBySection.forEach((sectionId, members) -> sections.add(score(sectionId, members)));
    sections.sort(SECTION_ORDER);
    return List.copyOf(sections);
  }

  /** Weight of a member at the given fused rank. */
  double positionalWeight(int fusedRank) {
    return baseWeight / Math.pow(fusedRank, decayExponent);
  }

  /** Scores one section from its members, which must already carry weights and adjacency. */
  Section score(String sectionId, List<SectionMember> members) {
    double raw = 0.0;
    for (SectionMember member : members) {
      raw += member.weight();
      if (member.adjacent()) {
        raw += adjacencyBonus * member.weight();
      }
    }
    double score = members.size() > 1 ? raw / (1.0 + lambda * (members.size() - 1)) : raw;
    return new Section(sectionId, score, raw, members);
  }

  private record Placed(FusedCandidate fused, Candidate candidate) {}
}
