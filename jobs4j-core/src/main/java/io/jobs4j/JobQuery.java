package io.jobs4j;

import io.jobs4j.core.JobPermissionLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * JobQuery describes which registered jobs {@link JobManager#findJobs(JobQuery)} returns.
 *
 * <p>Every criterion left unset is ignored. With {@link MatchMode#ALL} a job must satisfy all set
 * criteria, with {@link MatchMode#ANY} at least one. A query without criteria matches every job.
 */
public final class JobQuery {

    public enum MatchMode {
        ALL,
        ANY
    }

    private final Set<Class<? extends ManagedJob>> classes;
    private final boolean exactClassMatch;
    private final MatchMode matchMode;
    private final int limit;
    private final List<Predicate<ManagedJob>> criteria;

    private JobQuery(Set<Class<? extends ManagedJob>> classes, boolean exactClassMatch, MatchMode matchMode,
                     int limit, List<Predicate<ManagedJob>> criteria) {
        this.classes = Collections.unmodifiableSet(new LinkedHashSet<>(classes));
        this.exactClassMatch = exactClassMatch;
        this.matchMode = matchMode;
        this.limit = limit;
        this.criteria = List.copyOf(criteria);
    }

    public Set<Class<? extends ManagedJob>> classes() {
        return classes;
    }

    public boolean exactClassMatch() {
        return exactClassMatch;
    }

    public MatchMode matchMode() {
        return matchMode;
    }

    /**
     * Maximum number of results, {@code 0} for no limit.
     */
    public int limit() {
        return limit;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    boolean matches(ManagedJob job) {
        if (criteria.isEmpty()) {
            return true;
        }
        if (matchMode == MatchMode.ALL) {
            for (Predicate<ManagedJob> c : criteria) {
                if (!c.test(job)) {
                    return false;
                }
            }
            return true;
        }
        for (Predicate<ManagedJob> c : criteria) {
            if (c.test(job)) {
                return true;
            }
        }
        return false;
    }

    public static JobQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<Class<? extends ManagedJob>> classes = new LinkedHashSet<>();
        private boolean exactClassMatch;
        private JobProxy creator;
        private JobProxy guardian;
        private Instant createdBefore;
        private Instant createdAfter;
        private JobPermissionLevel permissionLevel;
        private JobPermissionLevel abovePermissionLevel;
        private JobPermissionLevel belowPermissionLevel;
        private Boolean alive;
        private Boolean starting;
        private Boolean running;
        private Boolean idling;
        private Boolean beingGuarded;
        private Boolean stopping;
        private Boolean restarting;
        private Boolean beingKilled;
        private Boolean completing;
        private Boolean stopped;
        private MatchMode matchMode = MatchMode.ALL;
        private int limit;

        @SafeVarargs
        public final Builder classes(Class<? extends ManagedJob>... classes) {
            for (Class<? extends ManagedJob> cls : classes) {
                this.classes.add(Objects.requireNonNull(cls, "class must not be null"));
            }
            return this;
        }

        /**
         * Whether subclasses of {@link #classes(Class[])} are excluded.
         */
        public Builder exactClassMatch(boolean exactClassMatch) {
            this.exactClassMatch = exactClassMatch;
            return this;
        }

        public Builder creator(JobProxy creator) {
            this.creator = creator;
            return this;
        }

        public Builder guardian(JobProxy guardian) {
            this.guardian = guardian;
            return this;
        }

        public Builder createdBefore(Instant createdBefore) {
            this.createdBefore = createdBefore;
            return this;
        }

        public Builder createdAfter(Instant createdAfter) {
            this.createdAfter = createdAfter;
            return this;
        }

        public Builder permissionLevel(JobPermissionLevel permissionLevel) {
            this.permissionLevel = permissionLevel;
            return this;
        }

        public Builder abovePermissionLevel(JobPermissionLevel level) {
            this.abovePermissionLevel = level;
            return this;
        }

        public Builder belowPermissionLevel(JobPermissionLevel level) {
            this.belowPermissionLevel = level;
            return this;
        }

        public Builder alive(boolean alive) {
            this.alive = alive;
            return this;
        }

        public Builder starting(boolean starting) {
            this.starting = starting;
            return this;
        }

        public Builder running(boolean running) {
            this.running = running;
            return this;
        }

        public Builder idling(boolean idling) {
            this.idling = idling;
            return this;
        }

        public Builder beingGuarded(boolean beingGuarded) {
            this.beingGuarded = beingGuarded;
            return this;
        }

        public Builder stopping(boolean stopping) {
            this.stopping = stopping;
            return this;
        }

        public Builder restarting(boolean restarting) {
            this.restarting = restarting;
            return this;
        }

        public Builder beingKilled(boolean beingKilled) {
            this.beingKilled = beingKilled;
            return this;
        }

        public Builder completing(boolean completing) {
            this.completing = completing;
            return this;
        }

        public Builder stopped(boolean stopped) {
            this.stopped = stopped;
            return this;
        }

        public Builder matchMode(MatchMode matchMode) {
            this.matchMode = Objects.requireNonNull(matchMode, "matchMode must not be null");
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public JobQuery build() {
            if (limit < 0) {
                throw new IllegalStateException("limit must not be negative");
            }
            if (abovePermissionLevel != null && belowPermissionLevel != null
                    && !abovePermissionLevel.isBelow(belowPermissionLevel)) {
                throw new IllegalStateException("abovePermissionLevel must be lower than belowPermissionLevel");
            }

            List<Predicate<ManagedJob>> criteria = new ArrayList<>();
            if (!classes.isEmpty()) {
                Set<Class<? extends ManagedJob>> wanted = Set.copyOf(classes);
                if (exactClassMatch) {
                    criteria.add(job -> wanted.contains(job.getClass()));
                } else {
                    criteria.add(job -> wanted.stream().anyMatch(c -> c.isInstance(job)));
                }
            }
            if (creator != null) {
                JobProxy c = creator;
                criteria.add(job -> c.equals(job.creator()));
            }
            if (guardian != null) {
                JobProxy g = guardian;
                criteria.add(job -> g.equals(job.guardian()));
            }
            if (createdBefore != null) {
                Instant t = createdBefore;
                criteria.add(job -> job.createdAt().isBefore(t));
            }
            if (createdAfter != null) {
                Instant t = createdAfter;
                criteria.add(job -> job.createdAt().isAfter(t));
            }
            if (permissionLevel != null) {
                JobPermissionLevel l = permissionLevel;
                criteria.add(job -> job.permissionLevel() == l);
            }
            if (abovePermissionLevel != null) {
                JobPermissionLevel l = abovePermissionLevel;
                criteria.add(job -> job.permissionLevel() != null && job.permissionLevel().isAbove(l));
            }
            if (belowPermissionLevel != null) {
                JobPermissionLevel l = belowPermissionLevel;
                criteria.add(job -> job.permissionLevel() != null && job.permissionLevel().isBelow(l));
            }
            addState(criteria, alive, ManagedJob::isAlive);
            addState(criteria, starting, ManagedJob::isStarting);
            addState(criteria, running, ManagedJob::isRunning);
            addState(criteria, idling, ManagedJob::isIdling);
            addState(criteria, beingGuarded, ManagedJob::isBeingGuarded);
            addState(criteria, stopping, ManagedJob::isStopping);
            addState(criteria, restarting, ManagedJob::isRestarting);
            addState(criteria, beingKilled, ManagedJob::isBeingKilled);
            addState(criteria, completing, ManagedJob::isCompleting);
            addState(criteria, stopped, ManagedJob::isStopped);

            return new JobQuery(classes, exactClassMatch, matchMode, limit, criteria);
        }

        private static void addState(List<Predicate<ManagedJob>> criteria, Boolean expected, Predicate<ManagedJob> state) {
            if (expected != null) {
                boolean e = expected;
                criteria.add(job -> state.test(job) == e);
            }
        }
    }
}
