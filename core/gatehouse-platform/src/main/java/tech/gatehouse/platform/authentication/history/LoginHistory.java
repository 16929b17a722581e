package tech.gatehouse.platform.authentication.history;

import tech.gatehouse.platform.shared.EntityType;
import tech.gatehouse.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Append-only record of a login attempt against a known principal.
 */
public class LoginHistory {

    public String id;

    public String principalId;

    public LoginOutcome outcome;

    public String ipAddress;

    public String userAgent;

    public Instant attemptedAt;

    public LoginHistory() {
    }

    public static LoginHistory of(String principalId, LoginOutcome outcome,
                                  String ipAddress, String userAgent, Instant at) {
        LoginHistory entry = new LoginHistory();
        entry.id = TsidGenerator.generate(EntityType.LOGIN_HISTORY);
        entry.principalId = principalId;
        entry.outcome = outcome;
        entry.ipAddress = ipAddress;
        entry.userAgent = userAgent;
        entry.attemptedAt = at;
        return entry;
    }
}
