package com.openforge.posgate.repository;

import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUserId(String userId);

    /**
     * Row-locked load used for every refresh-token mutation, so two rotations
     * of the same token are serialized and only one of them sees it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.userId = :userId")
    Optional<User> lockByUserId(@Param("userId") String userId);

    /**
     * Login lookup. Same email may exist once per tenant. Returns bare columns,
     * so the row stays out of the persistence context until {@link #lockByUserId}
     * loads it under the lock.
     */
    List<Credentials> findCredentialsByEmailOrderByIdAsc(String email);

    Optional<User> findByTenantIdAndEmail(String tenantId, String email);

    boolean existsByTenantIdAndEmail(String tenantId, String email);

    boolean existsByRole(Role role);

    Optional<User> findFirstByRoleOrderByIdAsc(Role role);

    boolean existsByTenantIdAndRole(String tenantId, Role role);

    interface Credentials {
        String getUserId();
        String getTenantId();
        Role getRole();
        String getPasswordHash();
    }
}
