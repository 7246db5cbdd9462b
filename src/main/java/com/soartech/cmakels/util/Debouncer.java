package com.soartech.cmakels.util;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The debouncer schedules tasks to be executed on a separate thread, but only after a short delay.
 *
 * <p>The main use case is to schedule an analysis run that is triggered by any change to a
 * document. Document changes can happen at the speed of keystrokes, but there is no point in
 * analysing every intermediate state of the file.
 *
 * <p>All tasks run on the same worker thread, one at a time.
 */
public class Debouncer {
  private Duration delay;

  private final ScheduledExecutorService workerThread =
      Executors.newSingleThreadScheduledExecutor(
          runnable -> {
            Thread thread = new Thread(runnable, "cmakels-analysis");
            thread.setDaemon(true);
            return thread;
          });

  private Future<?> pendingTask = null;

  public Debouncer(Duration delay) {
    this.delay = delay;
  }

  /**
   * Schedule a task to be run after a delay. If there is already a pending task that has not
   * started yet, it will be cancelled.
   */
  public synchronized void submit(Runnable task) {
    if (pendingTask != null) {
      pendingTask.cancel(false);
    }
    pendingTask = workerThread.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  public synchronized void setDelay(Duration delay) {
    this.delay = delay;
  }

  /** Stop the worker thread. Tasks that are still waiting are discarded. */
  public void shutdown() {
    workerThread.shutdownNow();
  }
}
