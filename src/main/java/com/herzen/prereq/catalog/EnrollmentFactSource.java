package com.herzen.prereq.catalog;

import com.herzen.prereq.domain.DomainModels.Enrollment;

import java.util.List;

public interface EnrollmentFactSource {
    List<Enrollment> findEnrollments(long userId, long courseId);
}
