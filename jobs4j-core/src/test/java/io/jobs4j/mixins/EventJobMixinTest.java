package io.jobs4j.mixins;

import io.jobs4j.core.JobFlags;
import io.jobs4j.core.JobStopReason;
import io.jobs4j.events.CustomJobEvent;
import io.jobs4j.events.JobEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventJobMixinTest {

    static class Tick extends CustomJobEvent {
        final int n;

        Tick(int n) {
            this.n = n;
        }
    }

    private final JobFlags flags = new JobFlags();
    private final List<Integer> handled = new ArrayList<>();
    private final List<Exception> errors = new ArrayList<>();
    private MixinHost host;

    @BeforeEach
    void setUp() {
        host = mock(MixinHost.class);
        when(host.flags()).thenReturn(flags);
        when(host.identifier()).thenReturn("TickJob-1-2");
        when(host.isRunning()).thenReturn(true);
    }

    private EventJobMixin<Tick> mixin(EventQueueOptions options) {
        return new EventJobMixin<>(host, Set.of(Tick.class), options, new EventJobMixin.Handler<>() {
            @Override
            public void onEvent(Tick event) {
                if (event.n < 0) {
                    throw new IllegalStateException("negative tick");
                }
                handled.add(event.n);
            }

            @Override
            public void onEventError(Tick event, Exception error) {
                errors.add(error);
            }
        });
    }

    @Test
    void fullQueueShouldRejectOrDropOldestDependingOnOverflow() {
        EventJobMixin<Tick> strict = mixin(EventQueueOptions.builder().maxQueueSize(2).build());
        assertThat(strict.addEvent(new Tick(1))).isTrue();
        assertThat(strict.addEvent(new Tick(2))).isTrue();
        assertThat(strict.addEvent(new Tick(3))).isFalse();
        assertThat(strict.queuedEvents()).extracting(e -> ((Tick) e).n).containsExactly(1, 2);

        EventJobMixin<Tick> lenient = mixin(EventQueueOptions.builder().maxQueueSize(2).allowQueueOverflow(true).build());
        lenient.addEvent(new Tick(1));
        lenient.addEvent(new Tick(2));
        assertThat(lenient.addEvent(new Tick(3))).isTrue();
        assertThat(lenient.queuedEvents()).extracting(e -> ((Tick) e).n).containsExactly(2, 3);
    }

    @Test
    void blockedQueueShouldRejectEventsUntilUnblocked() {
        EventJobMixin<Tick> events = mixin(EventQueueOptions.defaults());

        events.blockQueue();
        assertThat(events.queueIsBlocked()).isTrue();
        assertThat(events.addEvent(new Tick(1))).isFalse();

        events.unblockQueue();
        assertThat(events.addEvent(new Tick(1))).isTrue();
        assertThat(events.eventQueueSize()).isEqualTo(1);
    }

    @Test
    void stoppedJobShouldRejectEventsByDefault() {
        when(host.isRunning()).thenReturn(false);
        EventJobMixin<Tick> events = mixin(EventQueueOptions.defaults());

        assertThat(events.addEvent(new Tick(1))).isFalse();
        verify(host, never()).start();
    }

    @Test
    void dispatchToStoppedJobShouldStartItWhenConfigured() {
        when(host.isRunning()).thenReturn(false);
        EventJobMixin<Tick> events = mixin(EventQueueOptions.builder()
                .startOnEventDispatch(true)
                .blockEventsWhileStopped(false)
                .clearEventsAtStartup(false)
                .build());

        assertThat(events.addEvent(new Tick(7))).isTrue();
        verify(host).start();
        assertThat(events.eventQueueSize()).isEqualTo(1);
    }

    @Test
    void routineShouldRespectMaxHandlingsPerIteration() throws Exception {
        EventJobMixin<Tick> events = mixin(EventQueueOptions.builder()
                .maxHandlingsPerIteration(2)
                .awaitEventDispatch(false)
                .build());
        for (int i = 1; i <= 3; i++) {
            events.addEvent(new Tick(i));
        }

        events.mixinRoutine();
        assertThat(handled).containsExactly(1, 2);

        events.mixinRoutine();
        assertThat(handled).containsExactly(1, 2, 3);
    }

    @Test
    void failingHandlerShouldGoToErrorHookAndKeepDraining() throws Exception {
        EventJobMixin<Tick> events = mixin(EventQueueOptions.builder().awaitEventDispatch(false).build());
        events.addEvent(new Tick(-1));
        events.addEvent(new Tick(4));

        events.mixinRoutine();

        assertThat(errors).singleElement().isInstanceOf(IllegalStateException.class);
        assertThat(handled).containsExactly(4);
    }

    @Test
    void emptyQueueShouldStopJobWhenConfigured() throws Exception {
        EventJobMixin<Tick> events = mixin(EventQueueOptions.builder().stopOnEmptyQueue(true).build());

        events.mixinRoutine();

        verify(host).stop(false);
        assertThat(events.stoppingReason()).isEqualTo(JobStopReason.Internal.EMPTY_EVENT_QUEUE);
        events.onMixinStopCleanup();
        assertThat(events.stoppingReason()).isNull();
    }

    @Test
    void startupShouldClearQueuedEventsByDefault() throws Exception {
        EventJobMixin<Tick> events = mixin(EventQueueOptions.defaults());
        events.addEvent(new Tick(1));

        events.onMixinStart();

        assertThat(events.eventQueueIsEmpty()).isTrue();
        assertThat(events.eventTypes()).containsExactly(Tick.class);
        assertThat(events.eventCheck((JobEvent) new Tick(2))).isTrue();
    }
}
