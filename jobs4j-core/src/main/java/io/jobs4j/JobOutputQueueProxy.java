package io.jobs4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * An independent consumer of a job's output queues.
 *
 * <p>Each queue gets its own read position, so several consumers can read the same queue
 * without affecting one another or the producing job. A consumer may enable a rescue buffer per
 * queue: when the job clears the queue, the values this consumer had not read yet are moved into
 * the buffer and are returned before any newer values.
 *
 * <p>Read positions are guarded by the producing job's state lock, the same lock the job holds
 * while it pushes to or clears a queue.
 */
public final class JobOutputQueueProxy {

    private final JobProxy jobProxy;
    private final Function<String, List<Object>> source;
    private final Object lock;
    private final Map<String, View> views = new LinkedHashMap<>();
    private boolean defaultUseRescueBuffer;

    private static final class View {
        private int cursor;
        private ArrayDeque<Object> rescue;
        private boolean configured;
    }

    JobOutputQueueProxy(JobProxy jobProxy, Set<String> queueNames, Function<String, List<Object>> source,
                        Object lock) {
        this.jobProxy = Objects.requireNonNull(jobProxy, "jobProxy must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        for (String name : queueNames) {
            views.put(name, new View());
        }
    }

    public JobProxy jobProxy() {
        return jobProxy;
    }

    private View view(String name) {
        Objects.requireNonNull(name, "name must not be null");
        View v = views.get(name);
        if (v == null) {
            throw new IllegalArgumentException("job class " + jobProxy.jobClass().getName() + " declares no output queue '" + name + "'");
        }
        return v;
    }

    public boolean verifyOutputQueueSupport(String name) {
        return name != null && views.containsKey(name);
    }

    /**
     * @param useRescueBuffer {@code true} to collect unread values when the job clears the queue
     */
    public void configOutputQueue(String name, boolean useRescueBuffer) {
        synchronized (lock) {
            View v = view(name);
            v.configured = true;
            if (useRescueBuffer) {
                if (v.rescue == null) {
                    v.rescue = new ArrayDeque<>();
                }
            } else {
                v.rescue = null;
            }
        }
    }

    /**
     * Rescue buffer setting for queues not configured individually.
     */
    public void configOutputQueueDefaults(boolean useRescueBuffer) {
        synchronized (lock) {
            this.defaultUseRescueBuffer = useRescueBuffer;
            for (View v : views.values()) {
                if (!v.configured) {
                    v.rescue = useRescueBuffer ? (v.rescue != null ? v.rescue : new ArrayDeque<>()) : null;
                }
            }
        }
    }

    public boolean defaultUseRescueBuffer() {
        synchronized (lock) {
            return defaultUseRescueBuffer;
        }
    }

    /**
     * Called by the job, holding its state lock, right before it clears a queue.
     */
    void outputQueueClearAlert(String name, List<Object> values) {
        synchronized (lock) {
            View v = views.get(name);
            if (v == null) {
                return;
            }
            if (v.rescue != null) {
                for (int i = v.cursor; i < values.size(); i++) {
                    v.rescue.addLast(values.get(i));
                }
            }
            v.cursor = 0;
        }
    }

    /**
     * The oldest unread value.
     *
     * @throws NoSuchElementException if the queue is empty or every value was read already
     */
    public Object popOutputQueue(String name) {
        synchronized (lock) {
            View v = view(name);
            if (v.rescue != null && !v.rescue.isEmpty()) {
                return v.rescue.pollFirst();
            }
            List<Object> queue = source.apply(name);
            if (queue.isEmpty()) {
                throw new NoSuchElementException("output queue '" + name + "' is empty");
            }
            if (v.cursor >= queue.size()) {
                throw new NoSuchElementException("output queue '" + name + "' is exhausted");
            }
            return queue.get(v.cursor++);
        }
    }

    /**
     * Up to {@code amount} of the oldest unread values.
     */
    public List<Object> popOutputQueue(String name, int amount) {
        synchronized (lock) {
            if (amount <= 0) {
                throw new IllegalArgumentException("amount must be positive");
            }
            return pop(name, amount);
        }
    }

    public List<Object> popAllOutputQueue(String name) {
        synchronized (lock) {
            return pop(name, Integer.MAX_VALUE);
        }
    }

    private List<Object> pop(String name, int amount) {
        View v = view(name);
        List<Object> queue = source.apply(name);
        List<Object> out = new ArrayList<>();
        while (out.size() < amount) {
            if (v.rescue != null && !v.rescue.isEmpty()) {
                out.add(v.rescue.pollFirst());
            } else if (v.cursor < queue.size()) {
                out.add(queue.get(v.cursor++));
            } else {
                break;
            }
        }
        return out;
    }

    /**
     * True if neither the rescue buffer nor the job's queue hold any values.
     */
    public boolean outputQueueIsEmpty(String name) {
        synchronized (lock) {
            return outputQueueIsEmpty(name, false);
        }
    }

    public boolean outputQueueIsEmpty(String name, boolean ignoreRescueBuffer) {
        synchronized (lock) {
            View v = view(name);
            boolean queueEmpty = source.apply(name).isEmpty();
            if (ignoreRescueBuffer) {
                return queueEmpty;
            }
            return queueEmpty && (v.rescue == null || v.rescue.isEmpty());
        }
    }

    /**
     * True if the job's queue has values and all of them were read by this consumer.
     */
    public boolean outputQueueIsExhausted(String name) {
        synchronized (lock) {
            View v = view(name);
            List<Object> queue = source.apply(name);
            return !queue.isEmpty() && v.cursor >= queue.size();
        }
    }

    public int rescuedCount(String name) {
        synchronized (lock) {
            View v = view(name);
            return v.rescue != null ? v.rescue.size() : 0;
        }
    }

    public CompletableFuture<Object> awaitOutputQueueAdd(String name, Duration timeout, boolean cancelIfCleared) {
        view(name);
        return jobProxy.awaitOutputQueueAdd(name, timeout, cancelIfCleared);
    }
}
