package io.jobs4j.mixins;

import io.jobs4j.core.JobFlags;
import io.jobs4j.events.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Handles queued events one at a time on the job's own loop thread.
 *
 * <p>Per run iteration the routine either handles up to {@code maxHandlingsPerIteration}
 * events, only the events queued when the iteration began, or (default) waits for one event and
 * then drains the queue.
 */
public class EventJobMixin<E extends JobEvent> extends EventQueueMixin<E> {
    private static final Logger log = LoggerFactory.getLogger(EventJobMixin.class);

    public interface Handler<E extends JobEvent> {

        void onEvent(E event) throws Exception;

        default void onEventError(E event, Exception error) {
            log.warn("event handling failed event={} msg={}", event, error.getMessage(), error);
        }

        default boolean eventCheck(E event) {
            return true;
        }
    }

    private final Handler<E> handler;

    public EventJobMixin(MixinHost host, Set<Class<? extends E>> eventTypes, EventQueueOptions options, Handler<E> handler) {
        super(host, eventTypes, options);
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    @Override
    public boolean eventCheck(JobEvent event) {
        return handler.eventCheck(cast(event));
    }

    @Override
    public void mixinRoutine() throws Exception {
        if (stopIfQueueEmpty()) {
            return;
        }
        JobFlags flags = host.flags();
        int max = options.maxHandlingsPerIteration();

        if (max > 0) {
            int handled = 0;
            JobEvent event = eventQueueIsEmpty() && flags.has(JobFlags.AWAIT_EVENT_DISPATCH) ? awaitNextEvent() : pollEvent();
            while (event != null) {
                handle(event);
                if (++handled >= max) {
                    break;
                }
                event = pollEvent();
            }
        } else if (flags.has(JobFlags.OE_HANDLE_ONLY_INITIAL_EVENTS)) {
            int initial = eventQueueSize();
            for (int i = 0; i < initial; i++) {
                JobEvent event = pollEvent();
                if (event == null) {
                    break;
                }
                handle(event);
            }
        } else {
            if (eventQueueIsEmpty() && flags.has(JobFlags.AWAIT_EVENT_DISPATCH)) {
                JobEvent first = awaitNextEvent();
                if (first == null) {
                    return;
                }
                handle(first);
            }
            JobEvent event;
            while ((event = pollEvent()) != null) {
                handle(event);
            }
        }
    }

    private void handle(JobEvent raw) throws InterruptedException {
        E event = cast(raw);
        try {
            handler.onEvent(event);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("event handling of " + host.identifier() + " was interrupted");
            }
            try {
                handler.onEventError(event, e);
            } catch (RuntimeException hookError) {
                log.warn("event error hook failed id={} msg={}", host.identifier(), hookError.getMessage(), hookError);
            }
        }
    }
}
