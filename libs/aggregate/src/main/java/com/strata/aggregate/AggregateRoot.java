package com.strata.aggregate;

import com.strata.eventmodel.Event;
import com.strata.eventmodel.EventNode;
import com.strata.eventmodel.id.FlakeIdGenerator;
import com.strata.eventmodel.id.IdProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Base class for event-sourced aggregates.
 *
 * <p>An aggregate owns a projected state, the ordered buffer of events applied since the last
 * commit, and the ordered record of events it was rebuilt from. Subclasses register one state
 * handler per event in their constructor and change state only from those handlers:
 *
 * <pre>{@code
 * public class Account extends AggregateRoot<MapModel, Event> {
 *
 *     public Account(String id) {
 *         super(id, new MapModel());
 *         on(AccountOpened.class, this::onAccountOpened);
 *     }
 *
 *     public void open(String owner) {
 *         apply(new AccountOpened(getId(), owner));
 *     }
 *
 *     private void onAccountOpened(AccountOpened event) {
 *         state.put("id", event.id()).put("owner", event.owner());
 *     }
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe. Callers serialize work per aggregate id.
 *
 * @param <M> the state type
 * @param <E> the event base type
 */
public abstract class AggregateRoot<M extends Model, E extends Event> {

    private static final Logger log = LoggerFactory.getLogger(AggregateRoot.class);

    private static volatile IdProvider defaultIds;

    private final String id;
    private final EventHandlers<E> handlers = new EventHandlers<>();
    private final List<E> uncommittedEvents = new ArrayList<>();
    private final List<E> loadedEvents = new ArrayList<>();
    private final List<EventNode<E>> loadedEventNodes = new ArrayList<>();

    private AggregateFailureHandler failureHandler;
    private AggregateObserver observer = AggregateObserver.NOOP;

    /** Mutated by event handlers only. */
    protected M state;

    /**
     * Creates an aggregate with a generated id.
     *
     * @param initialState state before any event
     * @throws IllegalArgumentException if the flake id settings in the environment are malformed
     */
    protected AggregateRoot(M initialState) {
        this(defaultIds().next(), initialState);
    }

    /**
     * @param id aggregate id
     * @param initialState state before any event
     */
    protected AggregateRoot(String id, M initialState) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("initialState must not be null");
        }
        this.id = id;
        this.state = initialState;
    }

    // ---- Handler registration ----

    /** Registers the state handler for events of {@code type}. */
    protected final <T extends E> void on(Class<T> type, Consumer<? super T> handler) {
        handlers.on(type, handler);
    }

    /** Registers the state handler for every event named {@code eventName}. */
    protected final void on(String eventName, Consumer<? super E> handler) {
        handlers.on(eventName, handler);
    }

    // ---- Accessors ----

    public String getId() {
        return id;
    }

    public M getState() {
        return state;
    }

    /** Events applied since the last commit or uncommit, in order. Read-only view. */
    public List<E> getUncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    /** Every event replayed into this instance, in order. Read-only view. */
    public List<E> getLoadedEvents() {
        return Collections.unmodifiableList(loadedEvents);
    }

    /** Every node replayed through {@link #loadFromEventNodes(List)}, in order. Read-only view. */
    public List<EventNode<E>> getLoadedEventNodes() {
        return Collections.unmodifiableList(loadedEventNodes);
    }

    /** True while there are uncommitted events. */
    public boolean isDirty() {
        return !uncommittedEvents.isEmpty();
    }

    /** Number of events the current state reflects: replayed plus uncommitted. */
    public int getVersion() {
        return loadedEvents.size() + uncommittedEvents.size();
    }


    // ---- Applying events ----

    /** Records {@code event} as uncommitted and dispatches it to its state handler. */
    public void apply(E event) {
        apply(event, false);
    }

    /**
     * Dispatches {@code event} to its state handler, recording it as uncommitted first unless it
     * comes from history. An event without a handler is recorded and leaves state unchanged.
     */
    public void apply(E event, boolean isFromHistory) {
        Objects.requireNonNull(event, "event must not be null");
        if (!isFromHistory) {
            uncommittedEvents.add(event);
        }
        boolean handled = handlers.dispatch(event);
        log.debug("Applied {} to {} (fromHistory={}, handled={})",
                event.eventName(), id, isFromHistory, handled);
        observer.onApply(this, event, isFromHistory);
    }

    /** Clears the uncommitted events once they have been stored. */
    public void commit() {
        List<E> committed = drainUncommitted();
        if (!committed.isEmpty()) {
            log.debug("Committed {} event(s) on {}", committed.size(), id);
        }
        observer.onCommit(this, committed);
    }

    /** Clears the uncommitted events without storing them, e.g. after a failed operation. */
    public void uncommit() {
        List<E> discarded = drainUncommitted();
        if (!discarded.isEmpty()) {
            log.debug("Discarded {} uncommitted event(s) on {}", discarded.size(), id);
        }
        observer.onUncommit(this, discarded);
    }

    // ---- Replay ----

    /**
     * Rebuilds state from past events. Each event is dispatched without being recorded as
     * uncommitted and is appended to {@link #getLoadedEvents()}. Repeated calls accumulate.
     */
    public void loadFromHistory(List<? extends E> history) {
        Objects.requireNonNull(history, "history must not be null");
        for (E event : history) {
            apply(event, true);
            loadedEvents.add(event);
        }
        log.debug("Loaded {} event(s) from history into {}", history.size(), id);
    }

    /**
     * Rebuilds state from stored event nodes. Each node's event is dispatched once and recorded in
     * both {@link #getLoadedEventNodes()} and {@link #getLoadedEvents()}.
     *
     * <p>When {@link #redispatchNodeHistory()} is true the events are then replayed a second time
     * through {@link #loadFromHistory(List)}, reproducing the legacy double dispatch.
     */
    public void loadFromEventNodes(List<? extends EventNode<? extends E>> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        boolean redispatch = redispatchNodeHistory();
        List<E> events = new ArrayList<>(nodes.size());
        for (EventNode<? extends E> node : nodes) {
            E event = node.event();
            apply(event, true);
            loadedEventNodes.add(new EventNode<>(event, node.metadata()));
            events.add(event);
            if (!redispatch) {
                loadedEvents.add(event);
            }
        }
        if (redispatch) {
            loadFromHistory(events);
        } else {
            log.debug("Loaded {} event node(s) into {}", nodes.size(), id);
        }
    }

    /**
     * Whether {@link #loadFromEventNodes(List)} dispatches every event twice, as streams written
     * by the legacy engine expect. False by default.
     */
    protected boolean redispatchNodeHistory() {
        return false;
    }

    /**
     * Condensed-state event a store may persist and later feed back as the first replayed event.
     * Never called by the aggregate itself. Empty by default.
     */
    public Optional<E> snapshot() {
        return Optional.empty();
    }

    // ---- Failures ----

    /** Installs the failure handler, replacing any previous one. */
    public void setFailureHandler(AggregateFailureHandler handler) {
        this.failureHandler = handler;
    }

    /**
     * Routes {@code error} to the installed failure handler, or throws it when there is none.
     */
    public void fail(RuntimeException error) {
        Objects.requireNonNull(error, "error must not be null");
        AggregateFailureHandler handler = failureHandler;
        observer.onFailure(this, error, handler != null);
        if (handler != null) {
            handler.handle(error);
            return;
        }
        log.debug("No failure handler on {}, rethrowing {}", id, error.getClass().getSimpleName());
        throw error;
    }

    // ---- Observation ----

    /** Installs the lifecycle observer, replacing any previous one. Null restores the no-op. */
    public void setObserver(AggregateObserver observer) {
        this.observer = observer == null ? AggregateObserver.NOOP : observer;
    }

    /**
     * Provider for generated ids, read from the environment on first use. A failed read is not
     * remembered, so fixing the settings makes the next call succeed.
     */
    private static IdProvider defaultIds() {
        IdProvider ids = defaultIds;
        if (ids == null) {
            synchronized (AggregateRoot.class) {
                ids = defaultIds;
                if (ids == null) {
                    ids = FlakeIdGenerator.fromEnvironment();
                    defaultIds = ids;
                }
            }
        }
        return ids;
    }

    /** Forgets the generated-id provider so the next generated id re-reads the environment. */
    static void resetDefaultIds() {
        defaultIds = null;
    }

    private List<E> drainUncommitted() {
        List<E> drained = List.copyOf(uncommittedEvents);
        uncommittedEvents.clear();
        return drained;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", uncommitted=" + uncommittedEvents.size()
                + ", loaded=" + loadedEvents.size() + "]";
    }
}
