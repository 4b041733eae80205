package com.heroespath.repository;

import com.heroespath.entity.UserDiscoverySettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserDiscoverySettingsRepository extends JpaRepository<UserDiscoverySettings, String> {
}
