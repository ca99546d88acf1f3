package com.gemflush.orchestrator.repository;

import com.gemflush.orchestrator.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface TeamRepository extends JpaRepository<Team, UUID> {
}
