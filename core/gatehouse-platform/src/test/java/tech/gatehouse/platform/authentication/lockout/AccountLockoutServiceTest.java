package tech.gatehouse.platform.authentication.lockout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.gatehouse.platform.principal.FailedLoginTally;
import tech.gatehouse.platform.principal.Principal;
import tech.gatehouse.platform.principal.PrincipalRepository;
import tech.gatehouse.platform.testing.InMemoryPrincipalRepository;
import tech.gatehouse.platform.testing.TestConfigs;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccountLockoutService.
 */
class AccountLockoutServiceTest {

    private static final String ID = "prn_0HZTEST00001";
    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private InMemoryPrincipalRepository principalRepo;
    private AccountLockoutService service;

    @BeforeEach
    void setUp() {
        principalRepo = new InMemoryPrincipalRepository();
        Principal principal = new Principal();
        principal.id = ID;
        principal.email = "u@acme.com";
        principalRepo.save(principal);
        service = new AccountLockoutService(principalRepo, new LockoutPolicy(5, Duration.ofMinutes(30)));
    }

    private Principal reload() {
        return principalRepo.findById(ID).orElseThrow();
    }

    // ========================================
    // recordFailure TESTS
    // ========================================

    @Test
    @DisplayName("recordFailure should stay active below the threshold")
    void recordFailure_shouldStayActive_belowThreshold() {
        for (int i = 0; i < 4; i++) {
            assertThat(service.recordFailure(reload(), T0)).isInstanceOf(LockoutState.Active.class);
        }

        assertThat(reload().failedLoginCount).isEqualTo(4);
        assertThat(reload().lockedUntil).isNull();
    }

    @Test
    @DisplayName("recordFailure should lock for the configured duration on the fifth failure")
    void recordFailure_shouldLock_whenThresholdReached() {
        // Arrange
        for (int i = 0; i < 4; i++) {
            service.recordFailure(reload(), T0);
        }

        // Act
        LockoutState state = service.recordFailure(reload(), T0);

        // Assert
        assertThat(state).isEqualTo(new LockoutState.Locked(T0.plus(Duration.ofMinutes(30))));
        Principal principal = reload();
        assertThat(principal.locked).isTrue();
        assertThat(principal.lockedUntil).isEqualTo(T0.plus(Duration.ofMinutes(30)));
        assertThat(service.stateOf(principal, T0.plusSeconds(60)).isLocked()).isTrue();
    }

    @Test
    @DisplayName("recordFailure should write the count and the lock in a single repository call")
    void recordFailure_shouldWriteCountAndLockTogether_whenThresholdReached() {
        // Arrange
        PrincipalRepository repository = mock(PrincipalRepository.class);
        Instant until = T0.plus(Duration.ofMinutes(30));
        when(repository.recordFailedLogin(ID, T0, 5, until)).thenReturn(new FailedLoginTally(5, until));
        AccountLockoutService lockout = new AccountLockoutService(repository, new LockoutPolicy(5, Duration.ofMinutes(30)));

        // Act
        LockoutState state = lockout.recordFailure(reload(), T0);

        // Assert
        assertThat(state).isEqualTo(new LockoutState.Locked(until));
        verify(repository).recordFailedLogin(ID, T0, 5, until);
        verifyNoMoreInteractions(repository);
    }

    @Test
    @DisplayName("recordFailure should propagate a failed write and leave the stored counters untouched")
    void recordFailure_shouldLeaveNoPartialLockout_whenWriteFails() {
        // Arrange
        for (int i = 0; i < 4; i++) {
            service.recordFailure(reload(), T0);
        }
        InMemoryPrincipalRepository failing = new InMemoryPrincipalRepository() {
            @Override
            public synchronized FailedLoginTally recordFailedLogin(String principalId, Instant now,
                                                                   int maxFailedAttempts, Instant lockUntil) {
                throw new IllegalStateException("database unavailable");
            }
        };
        failing.save(principalRepo.stored(ID));
        AccountLockoutService lockout = new AccountLockoutService(failing, new LockoutPolicy(5, Duration.ofMinutes(30)));

        // Act & Assert
        assertThatThrownBy(() -> lockout.recordFailure(reload(), T0))
            .isInstanceOf(IllegalStateException.class);
        assertThat(reload().failedLoginCount).isEqualTo(4);
        assertThat(reload().lockedUntil).isNull();

        // the retried failure still locks
        assertThat(service.recordFailure(reload(), T0).isLocked()).isTrue();
        assertThat(reload().failedLoginCount).isEqualTo(5);
        assertThat(reload().lockedUntil).isEqualTo(T0.plus(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("recordFailure should keep the lock already in force when another failure arrives")
    void recordFailure_shouldKeepExistingLock_whenAlreadyLocked() {
        // Arrange
        for (int i = 0; i < 5; i++) {
            service.recordFailure(reload(), T0);
        }

        // Act
        LockoutState state = service.recordFailure(reload(), T0.plus(Duration.ofMinutes(1)));

        // Assert
        assertThat(state).isEqualTo(new LockoutState.Locked(T0.plus(Duration.ofMinutes(30))));
        assertThat(reload().failedLoginCount).isEqualTo(6);
        assertThat(reload().lockedUntil).isEqualTo(T0.plus(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("stateOf should report active once the lock has expired")
    void stateOf_shouldBeActive_afterExpiry() {
        for (int i = 0; i < 5; i++) {
            service.recordFailure(reload(), T0);
        }

        assertThat(service.stateOf(reload(), T0.plus(Duration.ofMinutes(30)))).isInstanceOf(LockoutState.Active.class);
    }

    @Test
    @DisplayName("recordFailure should restart the count after an expired lock")
    void recordFailure_shouldRestartCount_afterExpiredLock() {
        // Arrange
        for (int i = 0; i < 5; i++) {
            service.recordFailure(reload(), T0);
        }
        Instant later = T0.plus(Duration.ofMinutes(31));

        // Act
        LockoutState state = service.recordFailure(reload(), later);

        // Assert
        assertThat(state.isLocked()).isFalse();
        assertThat(reload().failedLoginCount).isEqualTo(1);
        assertThat(reload().lockedUntil).isNull();
    }

    @Test
    @DisplayName("recordFailure should not lose increments under concurrent failures")
    void recordFailure_shouldCountEveryConcurrentFailure() throws Exception {
        // Arrange
        service = new AccountLockoutService(principalRepo, new LockoutPolicy(100, Duration.ofMinutes(30)));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<LockoutState>> tasks = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            tasks.add(() -> service.recordFailure(reload(), T0));
        }

        // Act
        try {
            for (Future<LockoutState> future : pool.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        // Assert
        assertThat(reload().failedLoginCount).isEqualTo(40);
    }

    // ========================================
    // recordSuccess TESTS
    // ========================================

    @Test
    @DisplayName("recordSuccess should reset the count and clear the lock")
    void recordSuccess_shouldResetCountAndLock() {
        // Arrange
        for (int i = 0; i < 3; i++) {
            service.recordFailure(reload(), T0);
        }

        // Act
        service.recordSuccess(reload(), T0.plusSeconds(5));

        // Assert
        Principal principal = reload();
        assertThat(principal.failedLoginCount).isZero();
        assertThat(principal.locked).isFalse();
        assertThat(principal.lockedUntil).isNull();
        assertThat(principal.lastLoginAt).isEqualTo(T0.plusSeconds(5));
    }

    // ========================================
    // CONFIGURATION TESTS
    // ========================================

    @Test
    @DisplayName("init should build the policy from configuration")
    void init_shouldBuildPolicyFromConfig() {
        AccountLockoutService configured = new AccountLockoutService();
        configured.authConfig = TestConfigs.authConfig(3, Duration.ofMinutes(10));
        configured.principalRepo = principalRepo;

        configured.init();

        assertThat(configured.policy()).isEqualTo(new LockoutPolicy(3, Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("LockoutPolicy should reject non-positive threshold or duration")
    void lockoutPolicy_shouldRejectNonPositiveValues() {
        assertThatThrownBy(() -> new LockoutPolicy(0, Duration.ofMinutes(30)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max-failed-attempts");
        assertThatThrownBy(() -> new LockoutPolicy(5, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duration");
    }
}
