package dev.remedia.search;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer implementing hybrid retrieval with section consolidation.
 *
 * <p>Pipeline: dispatch every query to text and vector search in parallel -> reciprocal rank
 * fusion (per query then merged, or pooled) -> top {@code maxChunks} -> group by document section
 * with positional, adjacency and diminishing-returns scoring -> one {@link ResultUnit} per section,
 * streamed in section order.
 *
 * <p>Failures never escape a run. A backend failing for a query only removes its ranks; when every
 * backend call fails the run emits a single error unit; when the deadline cuts the fan-out short
 * the run emits what it has followed by an error unit. Zero candidates produce an empty stream.
 */
@Service
public class HybridSearchEngine {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchEngine.class);

  private final QueryDispatcher dispatcher;
  private final SectionGrouper sectionGrouper;
  private final ResultAssembler resultAssembler;
  private final SearchProperties properties;
  private final ExecutorService runExecutor;

  public HybridSearchEngine(
      QueryDispatcher dispatcher,
      SectionGrouper sectionGrouper,
      ResultAssembler resultAssembler,
      SearchProperties properties,
      @Qualifier("runExecutor") ExecutorService runExecutor) {
    this.dispatcher = dispatcher;
    this.sectionGrouper = sectionGrouper;
    this.resultAssembler = resultAssembler;
    this.properties = properties;
    this.runExecutor = runExecutor;
  }

  /**
   * Starts a search run and returns its result stream immediately. Units become available as
   * sections are assembled; the stream ends after the last section or after an error unit.
   *
   * @param request queries and the maximum number of sections to emit
   * @return the run's result stream; close it to cancel the run
   */
  public ResultStream run(SearchRequest request) {
    ResultStream stream = new ResultStream(properties.getStreamCapacity());
    stream.attach(runExecutor.submit(() -> produce(request, stream)));
    return stream;
  }

  /**
   * Runs a search and collects every unit.
   *
   * @param request queries and the maximum number of sections to emit
   * @return result units in emission order
   */
  public List<ResultUnit> search(SearchRequest request) {
    try (ResultStream stream = run(request)) {
      return stream.toList();
    }
  }

  void produce(SearchRequest request, ResultStream stream) {
    try {
      execute(request, stream);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Search run for {} cancelled", request.queries());
    } catch (RuntimeException e) {
      log.error("Search run for {} failed: {}", request.queries(), e.getMessage(), e);
      emitError(stream, "Search failed: " + e.getMessage());
    } finally {
      stream.complete();
    }
  }

  private void execute(SearchRequest request, ResultStream stream) throws InterruptedException {
    long started = System.nanoTime();
    DispatchResult dispatch = dispatcher.dispatch(request.queries());

    if (dispatch.allBackendsFailed() && !dispatch.deadlineExceeded()) {
      stream.emit(resultAssembler.error(describeFailures(dispatch.failures())));
      return;
    }

    FusionResult fused = fuse(dispatch);
    List<Section> sections = sectionGrouper.group(fused.top(), dispatch.candidates());
    log.debug(
        "Fused {} candidates into {} sections ({} scored overall)",
        fused.top().size(),
        sections.size(),
        fused.scores().size());

    int emitted = 0;
    for (Section section : sections) {
      if (emitted >= request.maxResults()) {
        break;
      }
      Optional<ResultUnit> unit = resultAssembler.assemble(section);
      if (unit.isPresent()) {
        stream.emit(unit.get());
        emitted++;
      }
    }

    if (dispatch.deadlineExceeded()) {
      stream.emit(
          resultAssembler.error(
              "Search deadline of %d ms exceeded; results may be incomplete"
                  .formatted(properties.getTimeout().toMillis())));
    }

    log.info(
        "Search for {} emitted {} sections in {} ms ({} backend failures)",
        request.queries(),
        emitted,
        (System.nanoTime() - started) / 1_000_000,
        dispatch.failures().size());
  }

  /** Fuses the dispatch's rank lists according to the configured batch mode. */
  FusionResult fuse(DispatchResult dispatch) {
    int rrfK = properties.getRrfK();
    int maxChunks = properties.getMaxChunks();
    return switch (properties.getBatchMode()) {
      case POOLED -> ReciprocalRankFusion.fuse(dispatch.allLists(), rrfK, maxChunks);
      case PER_QUERY -> {
        List<FusionResult> perQuery =
            dispatch.queries().stream()
                .map(q -> ReciprocalRankFusion.fuse(q.lists(), rrfK, maxChunks))
                .toList();
        yield ReciprocalRankFusion.mergeBatch(perQuery, maxChunks);
      }
    };
  }

  private void emitError(ResultStream stream, String message) {
    try {
      stream.emit(resultAssembler.error(message));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static String describeFailures(List<BackendFailure> failures) {
    return "All search backends failed: "
        + failures.stream()
            .map(f -> f.backend() + " (" + f.query() + "): " + f.message())
            .collect(Collectors.joining("; "));
  }
}
