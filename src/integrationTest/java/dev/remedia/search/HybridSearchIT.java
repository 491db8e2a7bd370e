package dev.remedia.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.remedia.BaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HybridSearchIT extends BaseIntegrationTest {

  @Autowired HybridSearchEngine searchEngine;

  @BeforeEach
  void seedTestData() {
    seed(
        "Great fear, anxiety, and worry accompany every ailment, however trivial.",
        "aconite-mind",
        0,
        "Aconitum napellus");
    seed(
        "Fear of death; predicts the day he will die. Restless, tosses about.",
        "aconite-mind",
        1,
        "Aconitum napellus");
    seed(
        "Great anguish and restlessness. Fears death and being left alone.",
        "arsenicum-mind",
        0,
        "Arsenicum album");
    seed(
        "Remarkable healing agent, applied locally to open wounds and ulcers.",
        "calendula-skin",
        0,
        "Calendula officinalis");
  }

  @Test
  void homeopathicAnxietyQueryRanksMindSectionsFirst() {
    List<ResultUnit> units =
        searchEngine.search(
            new SearchRequest("homeopathic remedies fear of death anxiety treatment"));

    assertThat(units).isNotEmpty().noneMatch(ResultUnit::isError);
    assertThat(units.get(0).title()).isIn("Aconitum napellus", "Arsenicum album");
    assertThat(units)
        .extracting(ResultUnit::toolName)
        .containsOnly("medicine-rag");
  }

  @Test
  void adjacentWindowsOfOneSectionAreConsolidated() {
    List<ResultUnit> units = searchEngine.search(new SearchRequest("aconite fear of death"));

    ResultUnit aconite =
        units.stream()
            .filter(u -> u.title().equals("Aconitum napellus"))
            .findFirst()
            .orElseThrow();
    assertThat(aconite.sentences()).hasSize(2);
    assertThat(units)
        .extracting(ResultUnit::title)
        .doesNotHaveDuplicates();
  }

  @Test
  void streamEndsAfterLastSection() {
    try (ResultStream stream = searchEngine.run(new SearchRequest("wounds", 1))) {
      assertThat(stream.toList()).hasSize(1);
      assertThat(stream.hasNext()).isFalse();
    }
  }
}
