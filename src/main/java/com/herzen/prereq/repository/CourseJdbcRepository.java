package com.herzen.prereq.repository;

import com.herzen.prereq.catalog.CourseCatalog;
import com.herzen.prereq.domain.DomainModels.Course;
import com.herzen.prereq.domain.DomainModels.CourseStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseJdbcRepository implements CourseCatalog {
    private final JdbcTemplate jdbcTemplate;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Course> findCourse(long courseId) {
        List<Course> rows = jdbcTemplate.query(
                "SELECT id, title, status FROM courses WHERE id = ?",
                (rs, n) -> new Course(rs.getLong(1), rs.getString(2), CourseStatus.fromCode(rs.getString(3))),
                courseId);
        return rows.stream().findFirst();
    }
}
