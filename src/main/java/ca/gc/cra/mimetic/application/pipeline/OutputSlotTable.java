package ca.gc.cra.mimetic.application.pipeline;

import ca.gc.cra.mimetic.domain.motion.ActuatorPayload;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named actuator outputs, each backed by its own {@link ActuatorDispatcher}.
 *
 * <p>Slots are registered before the session starts; afterwards only their enabled flag changes. A
 * payload is broadcast to every enabled slot. Disabled slots keep their worker running so they can be
 * switched back on without a restart.</p>
 */
public final class OutputSlotTable {
  private static final Logger log = LoggerFactory.getLogger(OutputSlotTable.class);

  private final Map<String, Slot> slots = new LinkedHashMap<>();

  /**
   * Registers a slot.
   *
   * @param dispatcher sender for the slot; its {@link ActuatorDispatcher#slot()} is the slot name
   * @param enabled initial state
   * @return this table
   * @throws IllegalArgumentException when the name is already taken
   */
  public synchronized OutputSlotTable register(ActuatorDispatcher dispatcher, boolean enabled) {
    Objects.requireNonNull(dispatcher, "dispatcher");
    String name = dispatcher.slot();
    if (slots.containsKey(name)) {
      throw new IllegalArgumentException("duplicate actuator slot: " + name);
    }
    slots.put(name, new Slot(dispatcher, new AtomicBoolean(enabled)));
    return this;
  }

  public void enable(String name) {
    slot(name).enabled().set(true);
    log.info("Actuator slot {} enabled", name);
  }

  public void disable(String name) {
    slot(name).enabled().set(false);
    log.info("Actuator slot {} disabled", name);
  }

  public boolean isEnabled(String name) {
    return slot(name).enabled().get();
  }

  /** @return slot names in registration order */
  public synchronized List<String> names() {
    return List.copyOf(slots.keySet());
  }

  /** @return number of enabled slots */
  public synchronized int enabledCount() {
    int count = 0;
    for (Slot slot : slots.values()) {
      if (slot.enabled().get()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Offers a payload to every enabled slot.
   *
   * @param payload command to send
   * @return number of slots that accepted the payload
   */
  public int broadcast(ActuatorPayload payload) {
    Objects.requireNonNull(payload, "payload");
    int accepted = 0;
    for (Slot slot : snapshot()) {
      if (slot.enabled().get() && slot.dispatcher().send(payload)) {
        accepted++;
      }
    }
    return accepted;
  }

  /** Starts every registered dispatcher. */
  public void startAll() {
    for (Slot slot : snapshot()) {
      slot.dispatcher().start();
    }
  }

  /** Asks every dispatcher to stop; does not wait. */
  public void stopAll() {
    for (Slot slot : snapshot()) {
      slot.dispatcher().stop();
    }
  }

  /**
   * Waits for every dispatcher to exit, sharing one deadline.
   *
   * @param timeout overall bound
   * @return names of slots still running when the deadline passed
   * @throws InterruptedException if interrupted while waiting
   */
  public List<String> joinAll(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    List<String> stuck = new ArrayList<>();
    for (Slot slot : snapshot()) {
      long remaining = Math.max(1L, (deadline - System.nanoTime()) / 1_000_000L);
      if (!slot.dispatcher().join(Duration.ofMillis(remaining))) {
        stuck.add(slot.dispatcher().slot());
      }
    }
    return stuck;
  }

  private synchronized List<Slot> snapshot() {
    return List.copyOf(slots.values());
  }

  private synchronized Slot slot(String name) {
    Slot slot = slots.get(name);
    if (slot == null) {
      throw new IllegalArgumentException("unknown actuator slot: " + name);
    }
    return slot;
  }

  private record Slot(ActuatorDispatcher dispatcher, AtomicBoolean enabled) {}
}
