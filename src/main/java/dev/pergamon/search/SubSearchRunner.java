package dev.pergamon.search;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs independent sub-searches concurrently and joins them at a single barrier.
 *
 * <p>All tasks share one deadline: launch time plus the per-task timeout, shortened to the
 * caller's budget when one is given. A task that fails or is rejected by the executor degrades to
 * an empty outcome; a task that times out is also cancelled with interruption. Interrupting the
 * calling thread cancels every in-flight task and surfaces as {@link SearchCancelledException}.
 */
@Component
public class SubSearchRunner {

  private static final Logger log = LoggerFactory.getLogger(SubSearchRunner.class);

  private final ExecutorService executor;

  public SubSearchRunner(@Qualifier("subSearchExecutor") ExecutorService executor) {
    this.executor = executor;
  }

  /**
   * Launches every task and waits for all of them to complete or time out.
   *
   * @param tasks sub-search tasks, iterated in insertion order
   * @param timeout per-task timeout
   * @param callerBudget overall budget of the calling search, or null for none
   * @return one outcome per task, in task order
   * @throws SearchCancelledException if the calling thread is interrupted while waiting
   */
  public Map<SubSearch, SubSearchOutcome> runAll(
      Map<SubSearch, Callable<List<SearchResult>>> tasks,
      Duration timeout,
      @Nullable Duration callerBudget) {
    Duration effective =
        callerBudget != null && callerBudget.compareTo(timeout) < 0 ? callerBudget : timeout;
    long deadline = System.nanoTime() + effective.toNanos();

    Map<SubSearch, Future<List<SearchResult>>> futures = new EnumMap<>(SubSearch.class);
    Map<SubSearch, SubSearchOutcome> outcomes = new EnumMap<>(SubSearch.class);
    for (Map.Entry<SubSearch, Callable<List<SearchResult>>> task : tasks.entrySet()) {
      try {
        futures.put(task.getKey(), executor.submit(task.getValue()));
      } catch (RejectedExecutionException e) {
        log.warn("{} search rejected by executor: {}", task.getKey().value(), e.getMessage());
        outcomes.put(task.getKey(), SubSearchOutcome.degraded(task.getKey(), "rejected"));
      }
    }

    for (Map.Entry<SubSearch, Future<List<SearchResult>>> entry : futures.entrySet()) {
      SubSearch source = entry.getKey();
      Future<List<SearchResult>> future = entry.getValue();
      try {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        outcomes.put(
            source,
            SubSearchOutcome.completed(source, future.get(remaining, TimeUnit.NANOSECONDS)));
      } catch (TimeoutException e) {
        future.cancel(true);
        log.warn("{} search timed out after {} ms", source.value(), effective.toMillis());
        outcomes.put(
            source,
            SubSearchOutcome.degraded(source, "timed out after " + effective.toMillis() + " ms"));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("{} search failed: {}", source.value(), cause.getMessage());
        outcomes.put(source, SubSearchOutcome.degraded(source, String.valueOf(cause.getMessage())));
      } catch (CancellationException e) {
        log.warn("{} search was cancelled", source.value());
        outcomes.put(source, SubSearchOutcome.degraded(source, "cancelled"));
      } catch (InterruptedException e) {
        futures.values().forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new SearchCancelledException("Search cancelled while waiting for sub-searches", e);
      }
    }
    return outcomes;
  }
}
