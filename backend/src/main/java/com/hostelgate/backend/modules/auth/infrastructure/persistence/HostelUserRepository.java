package com.hostelgate.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.auth.domain.HostelUser;
import com.hostelgate.backend.modules.auth.domain.HostelUserStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HostelUserRepository extends JpaRepository<HostelUser, UUID> {

    @Query("select hu from HostelUser hu where lower(hu.loginId) = lower(:loginId)")
    Optional<HostelUser> findByLoginIdIgnoreCase(@Param("loginId") String loginId);

    List<HostelUser> findByRoleAndStatus(HostelRole role, HostelUserStatus status);
}
