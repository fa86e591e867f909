package com.realestate.spatial.infrastructure.persistence;

import com.realestate.spatial.application.port.out.SavedAreaRepository;
import com.realestate.spatial.domain.model.SavedArea;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA implementation of SavedAreaRepository output port.
 */
@Repository
public interface SavedAreaJpaRepository extends JpaRepository<SavedArea, UUID>, SavedAreaRepository {

    @Override
    @Query("SELECT a FROM SavedArea a ORDER BY a.createdAt DESC, a.id ASC")
    List<SavedArea> findAllOrdered();

    @Override
    @Query("SELECT a FROM SavedArea a WHERE a.active = true ORDER BY a.createdAt DESC, a.id ASC")
    List<SavedArea> findActiveOrdered();
}
