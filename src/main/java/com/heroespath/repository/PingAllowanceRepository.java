package com.heroespath.repository;

import com.heroespath.entity.PingAllowance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PingAllowanceRepository extends JpaRepository<PingAllowance, String> {
}
