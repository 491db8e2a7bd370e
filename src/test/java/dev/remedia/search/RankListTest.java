package dev.remedia.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RankListTest {

  @Test
  void entriesAreOneBased() {
    RankList list = new RankList(Backend.TEXT, 1.0, List.of("a", "b"));

    assertThat(list.entries()).containsExactly(new RankEntry("a", 1), new RankEntry("b", 2));
  }

  @Test
  void duplicatesKeepFirstOccurrence() {
    RankList list = new RankList(Backend.VECTOR, 1.0, List.of("a", "b", "a", "c", "b"));

    assertThat(list.ids()).containsExactly("a", "b", "c");
  }

  @Test
  void negativeWeightIsRejected() {
    assertThatThrownBy(() -> new RankList(Backend.TEXT, -1.0, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void emptyListHasNoEntries() {
    RankList list = RankList.empty(Backend.TEXT, 1.0);

    assertThat(list.isEmpty()).isTrue();
    assertThat(list.entries()).isEmpty();
  }
}
