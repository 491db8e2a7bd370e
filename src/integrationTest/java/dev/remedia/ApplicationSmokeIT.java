package dev.remedia;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;

class ApplicationSmokeIT extends BaseIntegrationTest {

  @Autowired
  @Qualifier("remediaTools")
  ToolCallbackProvider remediaTools;

  @Test
  void contextLoadsAndExposesMedicineRagTool() {
    // If we get here, Spring context loaded successfully with:
    // - Flyway migrations applied
    // - EmbeddingModel bean created (ONNX model loaded)
    // - JPA entity validated against the chunk table
    assertThat(Arrays.stream(remediaTools.getToolCallbacks()))
        .extracting((ToolCallback callback) -> callback.getToolDefinition().name())
        .containsExactly("medicine-rag");
  }
}
