package dev.remedia.fixture;

import dev.remedia.chunk.Candidate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight test builder for {@link Candidate}. Provides sensible defaults so tests only override
 * what they care about.
 *
 * <pre>{@code
 * Candidate c = new CandidateBuilder().id("c1").section("s1").window(2).build();
 * }</pre>
 */
public final class CandidateBuilder {

  private String id = "chunk-1";
  private String sectionId = "section-1";
  private int windowIndex = Candidate.UNKNOWN_WINDOW;
  private String content = "Sample remedy text for testing.";
  private final Map<String, String> metadata = new LinkedHashMap<>();
  private String title = "Materia Medica";
  private String attribution = "Boericke, Materia Medica (1901)";

  public CandidateBuilder id(String id) {
    this.id = id;
    return this;
  }

  public CandidateBuilder section(String sectionId) {
    this.sectionId = sectionId;
    return this;
  }

  public CandidateBuilder window(int windowIndex) {
    this.windowIndex = windowIndex;
    return this;
  }

  public CandidateBuilder content(String content) {
    this.content = content;
    return this;
  }

  public CandidateBuilder meta(String key, String value) {
    this.metadata.put(key, value);
    return this;
  }

  public CandidateBuilder title(String title) {
    this.title = title;
    return this;
  }

  public CandidateBuilder attribution(String attribution) {
    this.attribution = attribution;
    return this;
  }

  public Candidate build() {
    return new Candidate(id, sectionId, windowIndex, content, metadata, title, attribution);
  }
}
