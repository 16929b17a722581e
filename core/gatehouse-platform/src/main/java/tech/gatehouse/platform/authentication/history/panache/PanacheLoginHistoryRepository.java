package tech.gatehouse.platform.authentication.history.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.gatehouse.platform.authentication.history.LoginHistory;
import tech.gatehouse.platform.authentication.history.LoginHistoryRepository;
import tech.gatehouse.platform.authentication.history.entity.LoginHistoryEntity;

import java.util.List;

/**
 * Panache-based implementation of LoginHistoryRepository.
 */
@ApplicationScoped
public class PanacheLoginHistoryRepository
    implements LoginHistoryRepository, PanacheRepositoryBase<LoginHistoryEntity, String> {

    @Override
    @Transactional
    public void append(LoginHistory entry) {
        persist(toEntity(entry));
    }

    @Override
    public List<LoginHistory> findRecent(String principalId, int limit) {
        return find("principalId", Sort.descending("attemptedAt"), principalId)
            .page(Page.ofSize(limit))
            .list()
            .stream()
            .map(PanacheLoginHistoryRepository::toDomain)
            .toList();
    }

    private static LoginHistoryEntity toEntity(LoginHistory domain) {
        LoginHistoryEntity entity = new LoginHistoryEntity();
        entity.id = domain.id;
        entity.principalId = domain.principalId;
        entity.outcome = domain.outcome;
        entity.ipAddress = domain.ipAddress;
        entity.userAgent = domain.userAgent;
        entity.attemptedAt = domain.attemptedAt;
        return entity;
    }

    private static LoginHistory toDomain(LoginHistoryEntity entity) {
        LoginHistory domain = new LoginHistory();
        domain.id = entity.id;
        domain.principalId = entity.principalId;
        domain.outcome = entity.outcome;
        domain.ipAddress = entity.ipAddress;
        domain.userAgent = entity.userAgent;
        domain.attemptedAt = entity.attemptedAt;
        return domain;
    }
}
