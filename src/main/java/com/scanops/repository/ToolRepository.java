package com.scanops.repository;

import com.scanops.entity.Tool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link Tool} entities.
 * Provides lookup by the tool's unique slug.
 */
@Repository
public interface ToolRepository extends JpaRepository<Tool, UUID> {
    /**
     * Finds a {@link Tool} entity by its unique slug.
     *
     * @param slug The slug of the tool.
     * @return An {@link Optional} containing the found {@link Tool}, or empty if no tool with the given slug exists.
     */
    Optional<Tool> findBySlug(String slug);
}
