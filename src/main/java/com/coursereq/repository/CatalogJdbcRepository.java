package com.coursereq.repository;

import com.coursereq.domain.CatalogModels.BlacklistedCourse;
import com.coursereq.domain.CatalogModels.CatalogCourse;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class CatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void replaceCatalog(List<CatalogCourse> courses) {
        jdbcTemplate.update("DELETE FROM catalog_courses");
        courses.forEach(c -> jdbcTemplate.update(
                "INSERT INTO catalog_courses(dept, course_number, title, notes, prerequisites, corequisites) VALUES (?,?,?,?,?,?)",
                c.department(), c.number(), c.title(), c.notes(), c.prerequisites(), c.corequisites()));
    }

    public List<CatalogCourse> loadCatalog() {
        return jdbcTemplate.query(
                "SELECT dept, course_number, title, notes, prerequisites, corequisites FROM catalog_courses ORDER BY listing_order",
                (rs, n) -> new CatalogCourse(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getString(4), rs.getString(5), rs.getString(6)));
    }

    /**
     * @return false when the course was already blacklisted; the first reason is kept
     */
    @Transactional
    public boolean addToBlacklist(String department, String number, String reason) {
        if (findBlacklisted(department, number).isPresent()) return false;
        jdbcTemplate.update(
                "INSERT INTO requirement_blacklist(dept, course_number, reason, ts) VALUES (?,?,?,?)",
                department, number, reason, Instant.now().toString());
        return true;
    }

    public Optional<BlacklistedCourse> findBlacklisted(String department, String number) {
        return jdbcTemplate.query(
                "SELECT dept, course_number, reason, ts FROM requirement_blacklist WHERE dept=? AND course_number=?",
                (rs, n) -> new BlacklistedCourse(rs.getString(1), rs.getString(2), rs.getString(3), Instant.parse(rs.getString(4))),
                department, number).stream().findFirst();
    }

    public List<BlacklistedCourse> loadBlacklist() {
        return jdbcTemplate.query(
                "SELECT dept, course_number, reason, ts FROM requirement_blacklist ORDER BY ts",
                (rs, n) -> new BlacklistedCourse(rs.getString(1), rs.getString(2), rs.getString(3), Instant.parse(rs.getString(4))));
    }
}
