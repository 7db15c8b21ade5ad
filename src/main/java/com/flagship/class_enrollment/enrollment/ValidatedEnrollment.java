package com.flagship.class_enrollment.enrollment;

import com.flagship.class_enrollment.account.Account;
import com.flagship.class_enrollment.account.Student;
import com.flagship.class_enrollment.catalog.CourseClass;
import lombok.Value;

import java.util.List;

/**
 * What the pre-transaction checks resolved: the caller, the student and the
 * classes in request order.
 */
@Value
public class ValidatedEnrollment {
    Account account;
    Student student;
    List<CourseClass> classes;
    String chargeIdempotencyKey;
}
