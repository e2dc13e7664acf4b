package com.github.fluentfsm;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;
import java.util.function.Function;

import com.github.fluentfsm.StateMachineException.Code;

/**
 * A state machine that decouples firing events from processing them. {@link #fire(Object)} only
 * enqueues the event; a single dedicated worker thread drains the queue and runs each step with the
 * same semantics as {@link PassiveStateMachine}.
 *
 * Notes for users:<br>
 * 1. any number of threads may fire concurrently. Events are processed strictly in the order they
 * were enqueued and never two at a time<br>
 *
 * 2. the initial enter actions run on the worker as the first queued item, before any event. If
 * one of them fails the failure is reported like any other and the machine stays started<br>
 *
 * 3. the worker holds the model write lock for the whole of every step, so
 * {@link #readModel(Function)} never observes a half-done step<br>
 *
 * 4. action failures cannot reach fire() callers. They are logged and handed to the
 * {@link ActionFailureListener}, if one was installed, and the worker carries on<br>
 *
 * 5. {@link #stop()} always joins the worker before returning. Whether queued events are still
 * processed is decided by the configured {@link ShutdownMode}<br>
 */
public final class ActiveStateMachine<S, E, M> implements StateMachine<S, E, M>, AutoCloseable {
  private final TransitionEngine<S, E, M> engine;
  private final StateMachineConfiguration config;
  private final ActionFailureListener<S, E> failureListener;
  private final AutoTransition<S, M> autoTransition;

  // unbounded, multi-producer, consumed by the worker only
  private final LinkedBlockingQueue<Command<E>> commandQueue = new LinkedBlockingQueue<>();

  // machine lifecycle locks: fire() shares, start() and stop() exclude
  private final ReentrantReadWriteLock machineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock machineWriteLock = machineSuperLock.writeLock();
  private final ReadLock machineReadLock = machineSuperLock.readLock();

  // model locks: the worker holds the write lock for every step
  private final ReentrantReadWriteLock modelSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock modelWriteLock = modelSuperLock.writeLock();
  private final ReadLock modelReadLock = modelSuperLock.readLock();

  private final AtomicBoolean machineAlive = new AtomicBoolean(true);
  private volatile boolean started;
  private volatile EventDispatcher dispatcher;

  ActiveStateMachine(final StateMachineConfiguration config, final TransitionTable<S, E, M> table,
      final M model, final ActionFailureListener<S, E> failureListener,
      final AutoTransition<S, M> autoTransition) {
    this.engine = new TransitionEngine<>(config.getMachineName(), table, model);
    this.config = config;
    this.failureListener = failureListener;
    this.autoTransition = autoTransition;
    TransitionEngine.logInfo(engine.getMachineId(), "Built active state machine with " + table);
  }

  /**
   * Spawn the worker. The initial state's enter actions are its first item of work.
   */
  @Override
  public void start() throws StateMachineException {
    machineWriteLock.lock();
    try {
      machineAlive();
      if (started) {
        throw new StateMachineException(Code.ALREADY_STARTED);
      }
      commandQueue.offer(Command.<E>start());
      final EventDispatcher worker = new EventDispatcher();
      dispatcher = worker;
      worker.start();
      started = true;
      StateMachineRegistry.getInstance().register(this);
      TransitionEngine.logInfo(engine.getMachineId(), "Started active state machine");
    } finally {
      machineWriteLock.unlock();
    }
  }

  /**
   * Enqueue the event and return immediately. The outcome of processing it is not reported here.
   * Events fired by the machine's own actions once stop() has been called are logged and dropped.
   */
  public void fire(final E event) throws StateMachineException {
    if (event == null) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    machineReadLock.lock();
    try {
      if (!machineAlive.get() && Thread.currentThread() == dispatcher) {
        // a queued step still draining after stop(); follow-ups cannot run any more
        TransitionEngine.logWarning(engine.getMachineId(),
            "Dropped event " + event + " fired by an action after stop");
        return;
      }
      machineAlive();
      if (!started) {
        throw new StateMachineException(Code.NOT_STARTED);
      }
      commandQueue.offer(Command.event(event));
    } finally {
      machineReadLock.unlock();
    }
  }

  /**
   * Run the reader against the model while no step is in progress and return what it computed.
   * Whatever escapes the reader is not protected any more; return copies, not live references.
   */
  public <R> R readModel(final Function<? super M, ? extends R> reader)
      throws StateMachineException {
    if (reader == null) {
      throw new StateMachineException(Code.INVALID_ACTION);
    }
    lockInterruptibly(modelReadLock);
    try {
      return reader.apply(engine.getModel());
    } finally {
      modelReadLock.unlock();
    }
  }

  /**
   * Mutate the model from outside the machine, excluding the worker for the duration.
   */
  public void writeModel(final ModelAction<? super M> writer) throws StateMachineException {
    if (writer == null) {
      throw new StateMachineException(Code.INVALID_ACTION);
    }
    lockInterruptibly(modelWriteLock);
    try {
      writer.execute(engine.getModel());
    } catch (Exception problem) {
      throw new StateMachineException(Code.ACTION_FAILURE, "Model write failed", problem);
    } finally {
      modelWriteLock.unlock();
    }
  }

  /**
   * Stop accepting events, apply the {@link ShutdownMode} to what is still queued and join the
   * worker. Returns true iff this call stopped the machine, false if it was already stopped.
   */
  public boolean stop() throws StateMachineException {
    final EventDispatcher worker;
    boolean stopped = false;
    machineWriteLock.lock();
    try {
      worker = dispatcher;
      if (worker != null && Thread.currentThread() == worker) {
        throw new StateMachineException(Code.ILLEGAL_WORKER_OPERATION,
            "An active state machine cannot be stopped from one of its own actions");
      }
      if (machineAlive.compareAndSet(true, false)) {
        TransitionEngine.logInfo(engine.getMachineId(),
            "Stopping active state machine with " + config.getShutdownMode());
        if (worker != null) {
          if (config.getShutdownMode() == ShutdownMode.DISCARD_PENDING_EVENTS) {
            discardPendingEvents();
          }
          commandQueue.offer(Command.<E>stop());
          StateMachineRegistry.getInstance().unregister(this);
        }
        stopped = true;
      } else {
        TransitionEngine.logInfo(engine.getMachineId(), "State machine is already stopped");
      }
    } finally {
      machineWriteLock.unlock();
    }

    // join outside the lock, actions on the worker may still be firing events
    if (worker != null) {
      try {
        worker.join();
      } catch (InterruptedException exception) {
        Thread.currentThread().interrupt();
        throw new StateMachineException(Code.INTERRUPTED, exception);
      }
    }
    if (stopped) {
      TransitionEngine.logInfo(engine.getMachineId(), "Successfully shut down state machine");
    }
    return stopped;
  }

  @Override
  public void close() throws StateMachineException {
    stop();
  }

  /**
   * Check if the state machine still accepts events.
   */
  public boolean alive() {
    return machineAlive.get();
  }

  /**
   * The state entered by the last fully processed step.
   */
  @Override
  public S currentState() {
    return engine.getCurrentState();
  }

  @Override
  public boolean isStarted() {
    return started;
  }

  @Override
  public String getId() {
    return engine.getMachineId();
  }

  @Override
  public TransitionTable<S, E, M> getTransitionTable() {
    return engine.getTable();
  }

  StateMachineConfiguration getConfiguration() {
    return config;
  }

  Thread getWorker() {
    return dispatcher;
  }

  int pendingCommands() {
    return commandQueue.size();
  }

  @Override
  public String toString() {
    return "ActiveStateMachine [id=" + getId() + ", alive=" + alive() + ", started=" + started
        + ", currentState=" + currentState() + "]";
  }

  private void discardPendingEvents() {
    final List<Command<E>> pending = new ArrayList<>();
    commandQueue.drainTo(pending);
    int discarded = 0;
    for (final Command<E> command : pending) {
      if (command.kind == CommandKind.START) {
        // initial enter actions are never discarded
        commandQueue.offer(command);
      } else {
        discarded++;
      }
    }
    TransitionEngine.logInfo(engine.getMachineId(),
        String.format("Discarded %d pending events", discarded));
  }

  private void machineAlive() throws StateMachineException {
    if (!machineAlive.get()) {
      throw new StateMachineException(Code.MACHINE_NOT_ALIVE,
          "State machine id:" + engine.getMachineId() + " is not alive");
    }
  }

  private static void lockInterruptibly(final Lock lock)
      throws StateMachineException {
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, exception);
    }
  }

  private void reportFailure(final E event, final StateMachineException failure) {
    final S state = engine.getCurrentState();
    TransitionEngine.logError(engine.getMachineId(),
        String.format("Step failed in state %s on event %s", state, event), failure);
    if (failureListener != null) {
      try {
        failureListener.onActionFailure(state, event, failure);
      } catch (RuntimeException problem) {
        TransitionEngine.logError(engine.getMachineId(), "Action failure listener blew up",
            problem);
      }
    }
  }

  private enum CommandKind {
    START, EVENT, STOP;
  }

  private static final class Command<E> {
    private final CommandKind kind;
    private final E event;

    private Command(final CommandKind kind, final E event) {
      this.kind = kind;
      this.event = event;
    }

    private static <E> Command<E> start() {
      return new Command<>(CommandKind.START, null);
    }

    private static <E> Command<E> event(final E event) {
      return new Command<>(CommandKind.EVENT, event);
    }

    private static <E> Command<E> stop() {
      return new Command<>(CommandKind.STOP, null);
    }
  }

  /**
   * The single consumer of the command queue. It exits on the STOP sentinel, which stop() enqueues
   * behind everything that is to be processed, or when interrupted.
   */
  private final class EventDispatcher extends Thread {

    private EventDispatcher() {
      setName("fsm-worker-" + engine.getMachineId());
      setDaemon(true);
      setUncaughtExceptionHandler(new UncaughtExceptionHandler() {
        @Override
        public void uncaughtException(Thread thread, Throwable error) {
          machineAlive.set(false);
          StateMachineRegistry.getInstance().unregister(ActiveStateMachine.this);
          TransitionEngine.logError(engine.getMachineId(),
              "Worker died on an unhandled error, state machine is no longer alive", error);
        }
      });
    }

    @Override
    public void run() {
      TransitionEngine.logInfo(engine.getMachineId(), "Fired up worker");
      try {
        while (true) {
          final Command<E> command = autoTransition == null ? commandQueue.take()
              : commandQueue.poll(config.getAutoTransitionPollMillis(), TimeUnit.MILLISECONDS);
          if (command == null) {
            evaluateAutoTransition();
          } else if (command.kind == CommandKind.STOP) {
            break;
          } else {
            process(command);
          }
        }
      } catch (InterruptedException exception) {
        machineAlive.set(false);
        StateMachineRegistry.getInstance().unregister(ActiveStateMachine.this);
        TransitionEngine.logWarning(engine.getMachineId(), String.format(
            "Worker interrupted, %d queued commands left unprocessed", commandQueue.size()));
        Thread.currentThread().interrupt();
      }
      TransitionEngine.logInfo(engine.getMachineId(), "Successfully shut down worker");
    }

    private void process(final Command<E> command) {
      StateMachineException failure = null;
      modelWriteLock.lock();
      try {
        if (command.kind == CommandKind.START) {
          engine.enterInitialState();
        } else {
          engine.fire(command.event);
        }
      } catch (StateMachineException problem) {
        failure = problem;
      } finally {
        modelWriteLock.unlock();
      }
      if (failure != null) {
        reportFailure(command.event, failure);
      }
    }

    private void evaluateAutoTransition() {
      StateMachineException failure = null;
      modelWriteLock.lock();
      try {
        final S next = autoTransition.next(engine.getCurrentState(), engine.getModel());
        if (next != null) {
          engine.goTo(next);
        }
      } catch (StateMachineException problem) {
        failure = problem;
      } catch (RuntimeException problem) {
        failure = new StateMachineException(Code.ACTION_FAILURE, "Auto transition failed", problem);
      } finally {
        modelWriteLock.unlock();
      }
      if (failure != null) {
        reportFailure(null, failure);
      }
    }
  }
}
