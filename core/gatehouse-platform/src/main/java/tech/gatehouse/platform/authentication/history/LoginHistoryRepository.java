package tech.gatehouse.platform.authentication.history;

import java.util.List;

public interface LoginHistoryRepository {

    void append(LoginHistory entry);

    /**
     * Most recent attempts first.
     */
    List<LoginHistory> findRecent(String principalId, int limit);
}
