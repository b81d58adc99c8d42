package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.application.port.MetricsPort;
import ca.gc.cra.mimetic.application.port.PipelineComponent;
import ca.gc.cra.mimetic.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Single-thread lifecycle shared by the pipeline's long-running stages.
 *
 * <p>Subclasses implement {@link #runLoop()} and poll {@link #running()} at their own granularity.
 * The worker thread is tagged with the {@code pipeline} MDC key and its uncaught failures are logged
 * and counted under {@code <name>.worker.uncaught}.</p>
 *
 * <p>{@link #start()} and {@link #stop()} are serialized, so a stop racing a start either prevents
 * the thread from launching or sees it launched; {@link #onStopRequested(boolean)} runs exactly once.</p>
 */
abstract class ManagedWorker implements PipelineComponent {
  private static final Logger log = LoggerFactory.getLogger(ManagedWorker.class);

  private final String name;
  protected final MetricsPort metrics;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final Object lifecycle = new Object();
  private volatile Thread thread;

  ManagedWorker(String name, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final void start() {
    synchronized (lifecycle) {
      if (stopRequested.get()) {
        throw new IllegalStateException(name + " already stopped");
      }
      if (started.get()) {
        throw new IllegalStateException(name + " already started");
      }
      beforeStart();
      started.set(true);
      Thread worker =
          ExecutorFactories.newWorkerThread("mimetic-" + name, this::runTagged, this::handleCrash);
      thread = worker;
      worker.start();
    }
    log.debug("Started {} worker", name);
  }

  @Override
  public final void stop() {
    synchronized (lifecycle) {
      if (!stopRequested.compareAndSet(false, true)) {
        return;
      }
      onStopRequested(started.get());
    }
    log.debug("Stop requested for {}", name);
  }

  @Override
  public final boolean join(Duration timeout) throws InterruptedException {
    Thread worker = thread;
    if (worker == null) {
      return true;
    }
    if (worker == Thread.currentThread()) {
      return false;
    }
    worker.join(Math.max(1L, timeout.toMillis()));
    return !worker.isAlive();
  }

  /** @return {@code true} until {@link #stop()} has been called */
  protected final boolean running() {
    return !stopRequested.get();
  }

  /** Hook run on the caller's thread before the worker starts; may throw to abort start-up. */
  protected void beforeStart() {}

  /**
   * Hook run once, on the thread calling {@link #stop()}. Must not block.
   *
   * @param started whether the worker thread was ever launched
   */
  protected void onStopRequested(boolean started) {}

  /** Hook run on the worker thread after {@link #runLoop()} returns or fails. */
  protected void afterLoop() {}

  /**
   * Worker body. Returns when {@link #running()} turns false or the stage is exhausted.
   *
   * @throws InterruptedException when the worker is interrupted while waiting
   */
  protected abstract void runLoop() throws InterruptedException;

  private void runTagged() {
    MDC.put("pipeline", name);
    try {
      runLoop();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      if (running()) {
        metrics.increment(name + ".worker.interrupted");
        log.warn("{} worker interrupted before stop was requested", name);
      }
    } finally {
      try {
        afterLoop();
      } finally {
        log.debug("{} worker exited", name);
        MDC.remove("pipeline");
      }
    }
  }

  private void handleCrash(Thread worker, Throwable failure) {
    metrics.increment(name + ".worker.uncaught");
    log.error("{} worker {} threw an uncaught exception", name, worker.getName(), failure);
  }
}
