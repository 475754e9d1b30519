package com.herzen.prereq.catalog;

import com.herzen.prereq.domain.DomainModels.Course;

import java.util.Optional;

public interface CourseCatalog {
    Optional<Course> findCourse(long courseId);

    default boolean exists(long courseId) {
        return findCourse(courseId).isPresent();
    }
}
