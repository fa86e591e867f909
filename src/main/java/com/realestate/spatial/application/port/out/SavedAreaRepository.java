package com.realestate.spatial.application.port.out;

import com.realestate.spatial.domain.model.SavedArea;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Output port for saved area persistence.
 */
public interface SavedAreaRepository {

  SavedArea save(SavedArea area);

  Optional<SavedArea> findById(UUID id);

  /**
   * Newest first.
   */
  List<SavedArea> findAllOrdered();

  /**
   * Active areas only, newest first.
   */
  List<SavedArea> findActiveOrdered();

  /**
   * Soft delete: clears the active flag, geometry stays untouched.
   */
  default void deactivate(SavedArea area) {
    area.setActive(false);
    save(area);
  }
}
