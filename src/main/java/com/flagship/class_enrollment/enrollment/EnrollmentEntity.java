package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.catalog.CourseClass;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for enrollments.
 *
 * Insert-only: every column is {@code updatable = false} and there are no
 * mutators. Student and class are kept as ids; the domain object is assembled
 * by the caller that already holds them.
 */
@Entity
@Table(
    name = "enrollments",
    indexes = {
        @Index(name = "idx_enrollments_student_id", columnList = "student_id"),
        @Index(name = "idx_enrollments_class_id", columnList = "class_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnrollmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "class_id", nullable = false, updatable = false)
    private UUID classId;

    @Column(nullable = false, updatable = false)
    private String source;

    @Column(nullable = false, updatable = false)
    private String campaign;

    @Column(name = "promotion_id", updatable = false)
    private UUID promotionId;

    @Column(name = "credit_id", updatable = false)
    private UUID creditId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public static EnrollmentEntity create(UUID studentId, UUID classId, EnrollmentAttribution attribution,
                                          UUID promotionId, UUID creditId) {
        return new EnrollmentEntity(
            UUID.randomUUID(),
            studentId,
            classId,
            attribution.getSource(),
            attribution.getCampaign(),
            promotionId,
            creditId,
            Instant.now()
        );
    }

    /**
     * @throws IllegalArgumentException if the student or class is not the one this row references
     */
    public Enrollment toDomain(Student student, CourseClass courseClass) {
        if (!student.getId().equals(studentId) || !courseClass.getId().equals(classId)) {
            throw new IllegalArgumentException("Enrollment " + id + " does not reference the given student and class");
        }
        return new Enrollment(id, student, courseClass, source, campaign, promotionId, creditId, createdAt);
    }
}
