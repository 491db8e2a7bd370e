package dev.remedia.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the hybrid search pipeline.
 *
 * <p>Properties are bound from {@code remedia.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code rrf-k} - damping constant of reciprocal rank fusion (default 60)
 *   <li>{@code text-search-weight}, {@code vector-search-weight} - per-backend RRF weights (1.0)
 *   <li>{@code text-k}, {@code vec-k} - candidates requested from each backend per query (20)
 *   <li>{@code max-chunks} - fused candidates handed to section grouping (20)
 *   <li>{@code base-weight}, {@code decay-exponent} - positional weight {@code W / r^P} (1.0, 1.0)
 *   <li>{@code adjacency-bonus} - share of a member's weight added when a neighbouring window of
 *       the same section was also retrieved (0.15)
 *   <li>{@code lambda} - diminishing-returns factor for multi-member sections (0.10)
 *   <li>{@code batch-mode} - how multi-query batches are fused (per-query)
 *   <li>{@code timeout} - deadline for the backend fan-out of one run (10s)
 *   <li>{@code stream-capacity} - bound of the result queue between producer and consumer (16)
 *   <li>{@code tool-name} - identifier stamped on every result unit (medicine-rag)
 *   <li>{@code query-prefix} - instruction prepended to queries before embedding
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "remedia.search")
public class SearchProperties {

  /** Query instruction recommended by the bge-small-en-v1.5 model card. */
  public static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private int rrfK = 60;
  private double textSearchWeight = 1.0;
  private double vectorSearchWeight = 1.0;
  private int textK = 20;
  private int vecK = 20;
  private int maxChunks = 20;
  private double baseWeight = 1.0;
  private double decayExponent = 1.0;
  private double adjacencyBonus = 0.15;
  private double lambda = 0.10;
  private BatchMode batchMode = BatchMode.PER_QUERY;
  private Duration timeout = Duration.ofSeconds(10);
  private int streamCapacity = 16;
  private String toolName = "medicine-rag";
  private String queryPrefix = BGE_QUERY_PREFIX;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (rrfK < 1) {
      throw new IllegalStateException("remedia.search.rrf-k must be >= 1, got: " + rrfK);
    }
    if (textSearchWeight < 0.0 || vectorSearchWeight < 0.0) {
      throw new IllegalStateException(
          "remedia.search backend weights must be >= 0, got text="
              + textSearchWeight
              + ", vector="
              + vectorSearchWeight);
    }
    requireInRange("text-k", textK);
    requireInRange("vec-k", vecK);
    requireInRange("max-chunks", maxChunks);
    if (baseWeight <= 0.0) {
      throw new IllegalStateException(
          "remedia.search.base-weight must be > 0, got: " + baseWeight);
    }
    if (decayExponent < 0.0) {
      throw new IllegalStateException(
          "remedia.search.decay-exponent must be >= 0, got: " + decayExponent);
    }
    if (adjacencyBonus < 0.0) {
      throw new IllegalStateException(
          "remedia.search.adjacency-bonus must be >= 0, got: " + adjacencyBonus);
    }
    if (lambda < 0.0) {
      throw new IllegalStateException("remedia.search.lambda must be >= 0, got: " + lambda);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException("remedia.search.timeout must be positive, got: " + timeout);
    }
    if (streamCapacity < 1) {
      throw new IllegalStateException(
          "remedia.search.stream-capacity must be >= 1, got: " + streamCapacity);
    }
    if (toolName == null || toolName.isBlank()) {
      throw new IllegalStateException("remedia.search.tool-name must not be blank");
    }
  }

  private static void requireInRange(String name, int value) {
    if (value < 1 || value > 200) {
      throw new IllegalStateException(
          "remedia.search." + name + " must be in [1, 200], got: " + value);
    }
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public double getTextSearchWeight() {
    return textSearchWeight;
  }

  public void setTextSearchWeight(double textSearchWeight) {
    this.textSearchWeight = textSearchWeight;
  }

  public double getVectorSearchWeight() {
    return vectorSearchWeight;
  }

  public void setVectorSearchWeight(double vectorSearchWeight) {
    this.vectorSearchWeight = vectorSearchWeight;
  }

  public int getTextK() {
    return textK;
  }

  public void setTextK(int textK) {
    this.textK = textK;
  }

  public int getVecK() {
    return vecK;
  }

  public void setVecK(int vecK) {
    this.vecK = vecK;
  }

  public int getMaxChunks() {
    return maxChunks;
  }

  public void setMaxChunks(int maxChunks) {
    this.maxChunks = maxChunks;
  }

  public double getBaseWeight() {
    return baseWeight;
  }

  public void setBaseWeight(double baseWeight) {
    this.baseWeight = baseWeight;
  }

  public double getDecayExponent() {
    return decayExponent;
  }

  public void setDecayExponent(double decayExponent) {
    this.decayExponent = decayExponent;
  }

  public double getAdjacencyBonus() {
    return adjacencyBonus;
  }

  public void setAdjacencyBonus(double adjacencyBonus) {
    this.adjacencyBonus = adjacencyBonus;
  }

  public double getLambda() {
    return lambda;
  }

  public void setLambda(double lambda) {
    this.lambda = lambda;
  }

  public BatchMode getBatchMode() {
    return batchMode;
  }

  public void setBatchMode(BatchMode batchMode) {
    this.batchMode = batchMode;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public int getStreamCapacity() {
    return streamCapacity;
  }

  public void setStreamCapacity(int streamCapacity) {
    this.streamCapacity = streamCapacity;
  }

  public String getToolName() {
    return toolName;
  }

  public void setToolName(String toolName) {
    this.toolName = toolName;
  }

  public String getQueryPrefix() {
    return queryPrefix;
  }

  public void setQueryPrefix(String queryPrefix) {
    this.queryPrefix = queryPrefix;
  }
}
