package io.dispatch4j.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    /**
     * Statuses that count against a tenant's active-job ceiling.
     */
    public static final Set<JobStatus> ACTIVE = Collections.unmodifiableSet(EnumSet.of(PENDING, RUNNING));

    public abstract boolean isTerminal();
}
