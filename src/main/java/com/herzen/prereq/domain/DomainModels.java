package com.herzen.prereq.domain;

import java.time.Instant;
import java.util.Locale;

public class DomainModels {
    public record Course(long id, String title, CourseStatus status) {}

    public record Enrollment(long userId,
                             long courseId,
                             EnrollmentStatus status,
                             Double finalScore,
                             Instant enrolledAt,
                             Instant completedAt) {}

    public enum CourseStatus {
        DRAFT, PUBLISHED, ARCHIVED;

        public static CourseStatus fromCode(String code) {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum EnrollmentStatus {
        ENROLLED, IN_PROGRESS, COMPLETED, DROPPED;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean countsAsEnrolled() {
            return this != DROPPED;
        }

        public static EnrollmentStatus fromCode(String code) {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        }
    }
}
