package tech.gatehouse.platform.authentication.lockout;

import java.time.Instant;
import java.util.Objects;

/**
 * Lock state of a principal at a point in time.
 */
public sealed interface LockoutState permits LockoutState.Active, LockoutState.Locked {

    boolean isLocked();

    static LockoutState active() {
        return Active.INSTANCE;
    }

    record Active() implements LockoutState {
        private static final Active INSTANCE = new Active();

        @Override
        public boolean isLocked() {
            return false;
        }
    }

    record Locked(Instant until) implements LockoutState {
        public Locked {
            Objects.requireNonNull(until, "until");
        }

        @Override
        public boolean isLocked() {
            return true;
        }
    }
}
