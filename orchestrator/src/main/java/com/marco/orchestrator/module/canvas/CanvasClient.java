package com.marco.orchestrator.module.canvas;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only view of a Canvas LMS account.
 *
 * All methods throw {@link CanvasClientException} on failure.
 */
public interface CanvasClient {

    List<Course> listCourses();

    List<Assignment> listAssignments(long courseId);

    List<Announcement> listAnnouncements(long courseId);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Course(
            long id,
            String name,
            @JsonProperty("course_code") String courseCode) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Assignment(
            long id,
            String name,
            @JsonProperty("due_at")   String dueAt,
            @JsonProperty("html_url") String htmlUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Announcement(
            long id,
            String title,
            @JsonProperty("posted_at") String postedAt,
            String message) {}
}
