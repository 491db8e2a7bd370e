package dev.remedia.search;

import dev.remedia.chunk.Candidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a scored {@link Section} to the {@link ResultUnit} shown to the caller.
 *
 * <p>Members with blank content are skipped; the first remaining member supplies title,
 * attribution and id. A section whose members are all unusable yields nothing.
 */
@Component
public class ResultAssembler {

  private static final Logger log = LoggerFactory.getLogger(ResultAssembler.class);

  private final String toolName;

  public ResultAssembler(SearchProperties properties) {
    this(properties.getToolName());
  }

  ResultAssembler(String toolName) {
    this.toolName = toolName;
  }

  /**
   * Builds the result unit of a section.
   *
   * @param section a scored section
   * @return the unit, or empty when no member has usable content
   */
  public Optional<ResultUnit> assemble(Section section) {
    List<String> sentences = new ArrayList<>(section.members().size());
    Map<String, String> metadata = new LinkedHashMap<>();
    Candidate lead = null;

    for (SectionMember member : section.members()) {
      Candidate candidate = member.candidate();
      if (!candidate.hasContent()) {
        log.debug(
            "Skipping chunk {} of section {}: no content", candidate.id(), section.sectionId());
        continue;
      }
      if (lead == null) {
        lead = candidate;
      }
      sentences.add(candidate.content().strip());
      metadata.putAll(candidate.metadata());
    }

    if (lead == null) {
      log.debug("Section {} has no usable members", section.sectionId());
      return Optional.empty();
    }

    return Optional.of(
        new ResultUnit(
            sentences, lead.attribution(), lead.title(), metadata, toolName, lead.id(), ""));
  }

  /** The terminal unit for a failed or degraded run. */
  public ResultUnit error(String message) {
    return ResultUnit.error(toolName, message);
  }
}
