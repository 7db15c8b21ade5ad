package com.flagship.class_enrollment.enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EnrollmentRepository extends JpaRepository<EnrollmentEntity, UUID> {

    List<EnrollmentEntity> findByStudentIdOrderByCreatedAtAsc(UUID studentId);
}
