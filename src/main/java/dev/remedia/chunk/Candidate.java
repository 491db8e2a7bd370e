package dev.remedia.chunk;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One retrievable window of source text, as fetched from the chunk store.
 *
 * <p>Candidates are immutable: the fusion and grouping stages annotate them with scores through
 * wrapper types and never modify them.
 *
 * @param id unique chunk identifier (the store's embedding id)
 * @param sectionId identifier of the document section the window was cut from
 * @param windowIndex position of the window within its section, or -1 when unknown
 * @param content raw window text; may be null or blank for malformed rows
 * @param metadata free-form key/value pairs carried through to the result
 * @param title title of the source document
 * @param attribution citation string for the source
 */
public record Candidate(
    String id,
    String sectionId,
    int windowIndex,
    @Nullable String content,
    Map<String, String> metadata,
    String title,
    String attribution) {

  /** Window index used when the store does not record a position. */
  public static final int UNKNOWN_WINDOW = -1;

  /** Compact constructor validating identity fields and freezing metadata. */
  public Candidate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sectionId, "sectionId");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    title = Objects.requireNonNullElse(title, "");
    attribution = Objects.requireNonNullElse(attribution, "");
  }

  /** Returns true when the window position is known. */
  public boolean hasWindowIndex() {
    return windowIndex >= 0;
  }

  /** Returns true when the content is usable for display. */
  public boolean hasContent() {
    return content != null && !content.isBlank();
  }
}
