package io.jobs4j.events;

import java.time.Instant;

/**
 * Base class for events defined and dispatched by jobs themselves. Dispatching these needs a
 * lower permission level than dispatching other events.
 */
public class CustomJobEvent extends JobEvent {

    public CustomJobEvent() {
        super();
    }

    public CustomJobEvent(Instant timestamp) {
        super(timestamp);
    }
}
