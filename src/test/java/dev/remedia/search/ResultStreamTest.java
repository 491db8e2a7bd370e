package dev.remedia.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ResultStreamTest {

  private final ExecutorService producer = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    producer.shutdownNow();
  }

  private static ResultUnit unit(String id) {
    return new ResultUnit(List.of("text " + id), "", "Title " + id, Map.of(), "medicine-rag", id, "");
  }

  @Test
  void unitsArriveInEmissionOrderAndStreamEnds() throws Exception {
    ResultStream stream = new ResultStream(4);
    stream.emit(unit("1"));
    stream.emit(unit("2"));
    stream.complete();

    assertThat(stream.toList()).extracting(ResultUnit::id).containsExactly("1", "2");
    assertThat(stream.hasNext()).isFalse();
  }

  @Test
  void completedEmptyStreamHasNoUnits() {
    ResultStream stream = new ResultStream(1);
    stream.complete();

    assertThat(stream.hasNext()).isFalse();
    assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void producerBlocksWhenQueueIsFullUntilConsumerReads() throws Exception {
    ResultStream stream = new ResultStream(1);
    CountDownLatch secondEmitted = new CountDownLatch(1);

    Future<?> task =
        producer.submit(
            () -> {
              stream.emit(unit("1"));
              stream.emit(unit("2"));
              secondEmitted.countDown();
              stream.complete();
              return null;
            });
    stream.attach(task);

    assertThat(secondEmitted.await(200, TimeUnit.MILLISECONDS)).isFalse();
    assertThat(stream.next().id()).isEqualTo("1");
    assertThat(secondEmitted.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(stream.toList()).extracting(ResultUnit::id).containsExactly("2");
  }

  @Test
  void closeCancelsBlockedProducer() throws Exception {
    ResultStream stream = new ResultStream(1);
    AtomicBoolean interrupted = new AtomicBoolean();
    CountDownLatch queueFull = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(1);

    Future<?> task =
        producer.submit(
            () -> {
              try {
                stream.emit(unit("1"));
                queueFull.countDown();
                stream.emit(unit("2"));
              } catch (InterruptedException e) {
                interrupted.set(true);
              } finally {
                stream.complete();
                done.countDown();
              }
            });
    stream.attach(task);

    assertThat(queueFull.await(5, TimeUnit.SECONDS)).isTrue();
    stream.close();

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(interrupted).isTrue();
    assertThat(stream.isClosed()).isTrue();
    assertThat(stream.hasNext()).isFalse();
  }

  @Test
  void closeFromAnotherThreadWakesWaitingConsumer() throws Exception {
    ResultStream stream = new ResultStream(2);
    CountDownLatch backendStarted = new CountDownLatch(1);
    CountDownLatch backendGate = new CountDownLatch(1);
    Future<?> task =
        producer.submit(
            () -> {
              try {
                backendStarted.countDown();
                backendGate.await();
                stream.emit(unit("1"));
              } finally {
                stream.complete();
              }
              return null;
            });
    stream.attach(task);
    assertThat(backendStarted.await(5, TimeUnit.SECONDS)).isTrue();

    ExecutorService consumer = Executors.newSingleThreadExecutor();
    try {
      Future<Boolean> hasNext = consumer.submit(stream::hasNext);
      Thread.sleep(100);
      assertThat(hasNext).isNotDone();

      stream.close();

      assertThat(hasNext.get(5, TimeUnit.SECONDS)).isFalse();
      assertThat(task).isCancelled();
    } finally {
      backendGate.countDown();
      consumer.shutdownNow();
    }
  }

  @Test
  void closeDiscardsUnitsAlreadyQueued() throws Exception {
    ResultStream stream = new ResultStream(4);
    stream.emit(unit("1"));
    stream.emit(unit("2"));

    stream.close();

    assertThat(stream.hasNext()).isFalse();
    assertThat(stream.toList()).isEmpty();
  }

  @Test
  void completingFromAnInterruptedProducerDoesNotBlock() throws Exception {
    ResultStream stream = new ResultStream(1);
    stream.emit(unit("1"));

    Thread.currentThread().interrupt();
    try {
      stream.complete();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }

    assertThat(stream.next().id()).isEqualTo("1");
  }

  @Test
  void emitAfterCloseIsRejected() {
    ResultStream stream = new ResultStream(2);
    stream.close();

    assertThatThrownBy(() -> stream.emit(unit("1"))).isInstanceOf(InterruptedException.class);
  }

  @Test
  void attachingToClosedStreamCancelsProducer() {
    ResultStream stream = new ResultStream(2);
    stream.close();
    CompletableFuture<Void> task = new CompletableFuture<>();

    stream.attach(task);

    assertThat(task).isCancelled();
  }

  @Test
  void closeIsIdempotent() {
    ResultStream stream = new ResultStream(2);

    stream.close();
    stream.close();

    assertThat(stream.isClosed()).isTrue();
  }

  @Test
  void closingTheStreamViewClosesTheResultStream() throws Exception {
    ResultStream stream = new ResultStream(4);
    stream.emit(unit("1"));
    stream.complete();

    try (var view = stream.stream()) {
      assertThat(view.map(ResultUnit::id).toList()).containsExactly("1");
    }

    assertThat(stream.isClosed()).isTrue();
  }
}
