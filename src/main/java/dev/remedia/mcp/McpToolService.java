package dev.remedia.mcp;

import dev.remedia.search.HybridSearchEngine;
import dev.remedia.search.ResultUnit;
import dev.remedia.search.SearchRequest;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the hybrid search engine as the {@code medicine-rag} tool.
 *
 * <p>Registered via {@link McpToolConfig}. The tool follows the structured error pattern: all
 * exceptions are caught and returned as descriptive error strings, never thrown. A degraded run
 * (results followed by an error unit) returns the results with a trailing warning line.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int DEFAULT_MAX_RESULTS = 10;
  static final int MAX_RESULTS_LIMIT = 50;

  private final HybridSearchEngine searchEngine;
  private final TokenBudgetTruncator truncator;

  public McpToolService(HybridSearchEngine searchEngine, TokenBudgetTruncator truncator) {
    this.searchEngine = searchEngine;
    this.truncator = truncator;
  }

  /** Searches the medical knowledge index and returns section-grouped excerpts for citation. */
  @Tool(
      name = "medicine-rag",
      description =
          "Search and retrieve medical information and remedies from the database for the user "
              + "query. Returns excerpts grouped by source section, best first, with titles and "
              + "attributions for citation.")
  public String search(
      @ToolParam(description = "Search Query to perform search") @Nullable String query,
      @ToolParam(description = "Maximum number of sections (1-50, default 10)", required = false)
          @Nullable Integer maxResults) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      List<ResultUnit> units =
          searchEngine.search(new SearchRequest(query.strip(), clampMaxResults(maxResults)));

      Optional<ResultUnit> error = units.stream().filter(ResultUnit::isError).findFirst();
      String rendered = truncator.truncate(units);

      if (error.isPresent()) {
        if (rendered.isEmpty()) {
          return "Error: " + error.get().error();
        }
        log.warn("Returning degraded results for '{}': {}", query, error.get().error());
        return rendered + "\nWarning: " + error.get().error();
      }
      if (rendered.isEmpty()) {
        return "No results found for query: " + query;
      }
      return rendered;
    } catch (Exception e) {
      log.error("medicine-rag tool failed for '{}'", query, e);
      return "Error searching knowledge base: " + e.getMessage();
    }
  }

  private int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null || maxResults < 1) {
      return DEFAULT_MAX_RESULTS;
    }
    return Math.min(maxResults, MAX_RESULTS_LIMIT);
  }
}
