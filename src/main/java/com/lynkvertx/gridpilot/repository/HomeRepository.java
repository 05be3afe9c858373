package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.Home;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Home Repository
 */
@Repository
public interface HomeRepository extends JpaRepository<Home, Long> {

    List<Home> findByAutopilotEnabledTrue();

    List<Home> findAllByOrderByCreatedAtDesc();
}
