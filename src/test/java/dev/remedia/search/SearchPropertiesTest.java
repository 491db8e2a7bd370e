package dev.remedia.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SearchPropertiesTest {

  @Test
  void defaultsMatchDocumentedValues() {
    SearchProperties props = new SearchProperties();

    assertThat(props.getRrfK()).isEqualTo(60);
    assertThat(props.getAdjacencyBonus()).isEqualTo(0.15);
    assertThat(props.getLambda()).isEqualTo(0.10);
    assertThat(props.getBaseWeight()).isEqualTo(1.0);
    assertThat(props.getDecayExponent()).isEqualTo(1.0);
    assertThat(props.getBatchMode()).isEqualTo(BatchMode.PER_QUERY);
    assertThat(props.getToolName()).isEqualTo("medicine-rag");
    assertThat(props.getQueryPrefix()).isEqualTo(SearchProperties.BGE_QUERY_PREFIX);
  }

  @Test
  void defaultsPassValidation() {
    assertThatCode(() -> new SearchProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void rrfKBelowOneIsRejected() {
    SearchProperties props = new SearchProperties();
    props.setRrfK(0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("rrf-k");
  }

  @Test
  void negativeBackendWeightIsRejected() {
    SearchProperties props = new SearchProperties();
    props.setVectorSearchWeight(-0.1);

    assertThatThrownBy(props::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void candidateLimitsOutsideRangeAreRejected() {
    SearchProperties props = new SearchProperties();
    props.setMaxChunks(201);

    assertThatThrownBy(props::validate).hasMessageContaining("max-chunks");
  }

  @Test
  void nonPositiveBaseWeightIsRejected() {
    SearchProperties props = new SearchProperties();
    props.setBaseWeight(0.0);

    assertThatThrownBy(props::validate).hasMessageContaining("base-weight");
  }

  @Test
  void negativeLambdaIsRejected() {
    SearchProperties props = new SearchProperties();
    props.setLambda(-1.0);

    assertThatThrownBy(props::validate).hasMessageContaining("lambda");
  }

  @Test
  void zeroTimeoutIsRejected() {
    SearchProperties props = new SearchProperties();
    props.setTimeout(Duration.ZERO);

    assertThatThrownBy(props::validate).hasMessageContaining("timeout");
  }

  @Test
  void blankToolNameIsRejected() {
    SearchProperties props = new SearchProperties();
    props.setToolName(" ");

    assertThatThrownBy(props::validate).hasMessageContaining("tool-name");
  }
}
