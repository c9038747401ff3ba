package dev.pergamon.search;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * Thread-safe running counters of completed searches.
 *
 * <p>Total count and cumulative latency are updated together under one lock so a {@link
 * #snapshot()} never observes a count without its latency.
 */
@Component
public class SearchStatistics {

  private final ReentrantLock lock = new ReentrantLock();

  private long totalSearches;
  private long totalNanos;

  /** Records one completed search. */
  public void record(Duration elapsed) {
    lock.lock();
    try {
      totalSearches++;
      totalNanos += elapsed.toNanos();
    } finally {
      lock.unlock();
    }
  }

  public Snapshot snapshot() {
    lock.lock();
    try {
      double average = totalSearches == 0 ? 0.0 : totalNanos / 1_000_000_000.0 / totalSearches;
      return new Snapshot(totalSearches, average);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Consistent view of the counters.
   *
   * @param totalSearches searches completed successfully
   * @param averageSearchTimeSeconds mean execution time, 0.0 before the first search
   */
  public record Snapshot(long totalSearches, double averageSearchTimeSeconds) {}
}
