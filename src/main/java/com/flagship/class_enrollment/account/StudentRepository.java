package com.flagship.class_enrollment.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudentRepository extends JpaRepository<StudentEntity, UUID> {

    /**
     * Students are only ever resolved through their parent, so a student id that
     * belongs to another account looks exactly like a missing one.
     */
    Optional<StudentEntity> findByIdAndParentId(UUID id, UUID parentId);
}
