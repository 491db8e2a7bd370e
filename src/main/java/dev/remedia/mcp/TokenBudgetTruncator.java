package dev.remedia.mcp;

import dev.remedia.search.ResultUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders result units as text within a configurable token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). Each section becomes a block with its
 * title, attribution, sentences and metadata; blocks are accumulated in section order until the
 * budget is reached. Error units are not rendered here.
 *
 * <p>If even the first block exceeds the budget, it is included but cut at the character level so
 * at least one result is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${remedia.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats result units, best section first, until the token budget is used up.
   *
   * @param units the units to render; error units are skipped
   * @return formatted text, empty when there is nothing to render
   */
  public String truncate(@Nullable List<ResultUnit> units) {
    if (units == null || units.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;
    int index = 0;

    for (ResultUnit unit : units) {
      if (unit.isError()) {
        continue;
      }
      index++;
      String formatted = formatUnit(index, unit);
      int unitTokens = estimateTokens(formatted);

      if (index == 1 && unitTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + unitTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += unitTokens;
    }

    return output.toString();
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatUnit(int index, ResultUnit unit) {
    StringBuilder sb = new StringBuilder();
    sb.append("## [%d] %s%n".formatted(index, unit.title().isEmpty() ? "Untitled" : unit.title()));
    if (!unit.attribution().isEmpty()) {
      sb.append("Source: ").append(unit.attribution()).append('\n');
    }
    sb.append("Id: ").append(unit.id()).append("\n\n");
    for (String sentence : unit.sentences()) {
      sb.append("- ").append(sentence).append('\n');
    }
    if (!unit.metadata().isEmpty()) {
      sb.append('\n').append(formatMetadata(unit.metadata())).append('\n');
    }
    sb.append("\n---\n");
    return sb.toString();
  }

  private static String formatMetadata(Map<String, String> metadata) {
    return metadata.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .map(e -> e.getKey() + ": " + e.getValue())
        .collect(Collectors.joining(" | ", "Metadata: ", ""));
  }
}
