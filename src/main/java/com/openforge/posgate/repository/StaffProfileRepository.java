package com.openforge.posgate.repository;

import com.openforge.posgate.domain.StaffProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StaffProfileRepository extends JpaRepository<StaffProfile, Long> {

    Optional<StaffProfile> findByUserId(String userId);

    Optional<StaffProfile> findByTenantIdAndStaffId(String tenantId, String staffId);

    boolean existsByTenantIdAndEmail(String tenantId, String email);

    List<StaffProfile> findByTenantIdOrderByIdAsc(String tenantId);
}
