package dev.remedia.search;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One emitted result: the consolidated content of a section, or a terminal error marker.
 *
 * @param sentences content of the section's members, best member first
 * @param attribution citation of the leading member
 * @param title source title of the leading member
 * @param metadata members' metadata merged in member order, last write wins
 * @param toolName identifier of the tool that produced the unit
 * @param id candidate id of the leading member
 * @param error empty for regular units; the failure description for a terminal error unit
 */
public record ResultUnit(
    List<String> sentences,
    String attribution,
    String title,
    Map<String, String> metadata,
    String toolName,
    String id,
    String error) {

  public ResultUnit {
    sentences = List.copyOf(sentences);
    metadata = Map.copyOf(metadata);
    attribution = Objects.requireNonNullElse(attribution, "");
    title = Objects.requireNonNullElse(title, "");
    toolName = Objects.requireNonNullElse(toolName, "");
    id = Objects.requireNonNullElse(id, "");
    error = Objects.requireNonNullElse(error, "");
  }

  /** A terminal unit carrying only an error. */
  public static ResultUnit error(String toolName, String message) {
    return new ResultUnit(List.of(), "", "", Map.of(), toolName, "", message);
  }

  public boolean isError() {
    return !error.isEmpty();
  }
}
