package com.ricemill.stockkeeper.repository;

import com.ricemill.stockkeeper.model.DashboardPreference;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DashboardPreferenceRepository extends JpaRepository<DashboardPreference, Long> {
    Optional<DashboardPreference> findByUserId(Long userId);
}
