package dev.remedia.search;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jspecify.annotations.Nullable;

/**
 * Finite, ordered, single-pass sequence of result units produced by one search run.
 *
 * <p>The producer task writes into a bounded queue and blocks while the consumer lags behind. The
 * sequence ends after the producer signals completion. Closing the stream before the end cancels
 * the producer (and through it any backend calls still running) and discards undelivered units.
 *
 * <p>Consumers should either drain the stream or close it, typically with try-with-resources:
 *
 * <pre>{@code
 * try (ResultStream results = engine.run(request)) {
 *   results.forEachRemaining(this::send);
 * }
 * }</pre>
 */
public final class ResultStream implements Iterator<ResultUnit>, AutoCloseable {

  /** End-of-stream marker, compared by identity. */
  private static final ResultUnit END = ResultUnit.error("", "end of stream");

  private final BlockingQueue<ResultUnit> queue;
  private volatile @Nullable Future<?> producer;
  private volatile boolean closed;
  private @Nullable ResultUnit next;
  private boolean finished;

  ResultStream(int capacity) {
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  void attach(Future<?> producer) {
    this.producer = producer;
    if (closed) {
      producer.cancel(true);
    }
  }

  /**
   * Hands a unit to the consumer, waiting for queue space.
   *
   * @throws InterruptedException if the stream is closed before or while the unit is handed over
   */
  void emit(ResultUnit unit) throws InterruptedException {
    if (closed) {
      throw new InterruptedException("Result stream closed");
    }
    queue.put(unit);
    // close() frees queue space, which can release a blocked put before the interrupt lands.
    if (closed) {
      throw new InterruptedException("Result stream closed");
    }
  }

  /**
   * Signals that no further units follow. Never blocks an interrupted producer: a cancelled run
   * only offers the end marker, since {@link #close()} has already queued one.
   */
  void complete() {
    if (closed) {
      return;
    }
    try {
      queue.put(END);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      queue.offer(END);
    }
  }

  @Override
  public boolean hasNext() {
    if (finished || closed) {
      return false;
    }
    if (next != null) {
      return true;
    }
    try {
      ResultUnit unit = queue.take();
      if (unit == END || closed) {
        finished = true;
        return false;
      }
      next = unit;
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      close();
      return false;
    }
  }

  @Override
  public ResultUnit next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Result stream exhausted");
    }
    ResultUnit unit = next;
    next = null;
    return unit;
  }

  /** Drains the remaining units into a list. */
  public List<ResultUnit> toList() {
    List<ResultUnit> units = new ArrayList<>();
    forEachRemaining(units::add);
    return units;
  }

  /** Sequential view of the remaining units; closing the view closes this stream. */
  public Stream<ResultUnit> stream() {
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(
                this, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(this::close);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops the producer if it is still running and ends the sequence. Idempotent, and safe to call
   * from a thread other than the consumer: a consumer waiting in {@link #hasNext()} wakes up and
   * sees the end of the stream.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    Future<?> running = producer;
    if (running != null) {
      running.cancel(true);
    }
    queue.clear();
    // Fails only if a racing put refilled the queue, which wakes the consumer just the same.
    queue.offer(END);
  }
}
