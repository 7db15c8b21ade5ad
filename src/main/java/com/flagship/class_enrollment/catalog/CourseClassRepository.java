package com.flagship.class_enrollment.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CourseClassRepository extends JpaRepository<CourseClassEntity, UUID> {

    /**
     * Loads the requested classes with their courses in one query.
     * Unknown ids are silently absent from the result.
     */
    @Query("SELECT c FROM CourseClassEntity c JOIN FETCH c.course WHERE c.id IN :ids")
    List<CourseClassEntity> findAllWithCourseByIdIn(@Param("ids") Collection<UUID> ids);

    @Query("SELECT c FROM CourseClassEntity c JOIN FETCH c.course WHERE c.id = :id")
    Optional<CourseClassEntity> findWithCourseById(@Param("id") UUID id);
}
