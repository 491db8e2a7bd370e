package dev.remedia.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.remedia.chunk.Candidate;
import dev.remedia.chunk.ChunkStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans every query of a batch out to both backends in parallel and joins the results.
 *
 * <p>Per query two tasks run on the search executor: a lexical search, and an embed-then-vector
 * search. Each task fetches the content of the ids it ranked (skipping ids another task already
 * cached) into a {@link ConcurrentHashMap} shared by the whole dispatch.
 *
 * <p>A failing task only empties its own rank list; the failure is recorded as a {@link
 * BackendFailure}. When the deadline passes, or the calling thread is interrupted, every task that
 * has not finished is cancelled and the lists gathered so far are returned with {@link
 * DispatchResult#deadlineExceeded()} set.
 */
@Component
public class QueryDispatcher {

  private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);

  private final ChunkStore chunkStore;
  private final EmbeddingModel embeddingModel;
  private final SearchProperties properties;
  private final ExecutorService searchExecutor;

  public QueryDispatcher(
      ChunkStore chunkStore,
      EmbeddingModel embeddingModel,
      SearchProperties properties,
      @Qualifier("searchExecutor") ExecutorService searchExecutor) {
    this.chunkStore = chunkStore;
    this.embeddingModel = embeddingModel;
    this.properties = properties;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Runs both backend searches for every distinct, non-blank query and waits for them.
   *
   * @param queries query texts; blanks are ignored and duplicates dispatched once
   * @return rank lists per query, captured failures and the fetched candidates
   */
  public DispatchResult dispatch(List<String> queries) {
    List<String> distinct =
        queries.stream()
            .filter(Objects::nonNull)
            .map(String::strip)
            .filter(q -> !q.isEmpty())
            .distinct()
            .toList();

    Map<String, Candidate> cache = new ConcurrentHashMap<>();
    List<PendingQuery> pending = new ArrayList<>(distinct.size());
    for (String query : distinct) {
      Future<RankList> text = searchExecutor.submit(() -> searchText(query, cache));
      Future<RankList> vector = searchExecutor.submit(() -> searchVector(query, cache));
      pending.add(new PendingQuery(query, text, vector));
    }

    Join join = new Join(System.nanoTime() + properties.getTimeout().toNanos());
    List<QueryRanks> ranks = new ArrayList<>(pending.size());
    for (PendingQuery p : pending) {
      RankList text = join.await(p.query(), Backend.TEXT, p.text(), textWeight());
      RankList vector = join.await(p.query(), Backend.VECTOR, p.vector(), vectorWeight());
      log.debug(
          "Query '{}' ranked {} text and {} vector candidates", p.query(), text.size(), vector.size());
      ranks.add(new QueryRanks(p.query(), text, vector));
    }

    if (join.cut) {
      log.warn(
          "Backend fan-out stopped early after {} ms; continuing with partial ranks",
          properties.getTimeout().toMillis());
    }

    return new DispatchResult(ranks, join.failures, cache, join.cut, distinct.size() * 2);
  }

  RankList searchText(String query, Map<String, Candidate> cache) {
    List<String> ids = chunkStore.termSearch(query, properties.getTextK());
    cacheMissing(ids, cache);
    return new RankList(Backend.TEXT, textWeight(), ids);
  }

  RankList searchVector(String query, Map<String, Candidate> cache) {
    Embedding embedding = embeddingModel.embed(properties.getQueryPrefix() + query).content();
    List<String> ids = chunkStore.vectorSearch(embedding.vector(), properties.getVecK());
    cacheMissing(ids, cache);
    return new RankList(Backend.VECTOR, vectorWeight(), ids);
  }

  private void cacheMissing(List<String> ids, Map<String, Candidate> cache) {
    List<String> missing = ids.stream().filter(id -> !cache.containsKey(id)).distinct().toList();
    if (!missing.isEmpty()) {
      cache.putAll(chunkStore.fetchByIds(missing));
    }
  }

  private double textWeight() {
    return properties.getTextSearchWeight();
  }

  private double vectorWeight() {
    return properties.getVectorSearchWeight();
  }

  /** Both in-flight backend calls of one query. */
  private record PendingQuery(String query, Future<RankList> text, Future<RankList> vector) {}

  /** Join state of one dispatch: shared deadline, cut flag and collected failures. */
  private static final class Join {
    private final long deadlineNanos;
    private final List<BackendFailure> failures = new ArrayList<>();
    private boolean cut;

    Join(long deadlineNanos) {
      this.deadlineNanos = deadlineNanos;
    }

    RankList await(String query, Backend backend, Future<RankList> future, double weight) {
      if (!cut) {
        try {
          long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
          return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
          return failed(query, backend, weight, causeMessage(e));
        } catch (CancellationException e) {
          return failed(query, backend, weight, "cancelled");
        } catch (TimeoutException e) {
          cut = true;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          cut = true;
        }
      }

      // Past the deadline: keep what already finished, cancel the rest.
      if (future.isDone() && !future.isCancelled()) {
        try {
          return future.get();
        } catch (ExecutionException e) {
          return failed(query, backend, weight, causeMessage(e));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      future.cancel(true);
      return failed(query, backend, weight, "deadline exceeded");
    }

    private RankList failed(String query, Backend backend, double weight, String message) {
      log.warn("{} search failed for query '{}': {}", backend, query, message);
      failures.add(new BackendFailure(query, backend, message));
      return RankList.empty(backend, weight);
    }

    private static String causeMessage(ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
  }
}
