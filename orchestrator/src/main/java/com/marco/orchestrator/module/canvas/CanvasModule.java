package com.marco.orchestrator.module.canvas;

import com.marco.orchestrator.intent.ParamSpec;
import com.marco.orchestrator.intent.ParamType;
import com.marco.orchestrator.module.ExecutionResult;
import com.marco.orchestrator.module.McpModule;
import com.marco.orchestrator.module.ModuleExecutionException;
import com.marco.orchestrator.module.ModuleExecutionException.Kind;
import com.marco.orchestrator.registry.ActionSpec;
import com.marco.orchestrator.registry.CapabilityDescriptor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Learning-platform module ("canvas"): courses, assignments and
 * announcements of the configured Canvas account. All actions are read-only.
 *
 * {@code find_course} resolves a course by name; when exactly one course
 * matches it records the {@code course_id} fact and asks the orchestrator to
 * re-classify the original request, so "show assignments for biology" runs
 * as find_course followed by list_assignments.
 */
@Component
public class CanvasModule implements McpModule {

    public static final String NAME = "canvas";
    public static final String FACT_COURSE_ID = "course_id";

    private static final CapabilityDescriptor DESCRIPTOR = CapabilityDescriptor
            .builder(NAME, "Canvas LMS: the user's courses, assignments and announcements.")
            .action(ActionSpec.readOnly("list_courses", "List the user's active courses."))
            .action(ActionSpec.readOnly("find_course", "Find a course id by (part of) its name or code.",
                    ParamSpec.required("name", ParamType.STRING, "course name or code")))
            .action(ActionSpec.readOnly("list_assignments", "List the assignments of a course.",
                    ParamSpec.required("course_id", ParamType.INTEGER, "numeric Canvas course id")))
            .action(ActionSpec.readOnly("list_announcements", "List the announcements of a course.",
                    ParamSpec.required("course_id", ParamType.INTEGER, "numeric Canvas course id")))
            .build();

    private final CanvasClient client;

    public CanvasModule(CanvasClient client) {
        this.client = client;
    }

    @Override
    public CapabilityDescriptor capabilities() {
        return DESCRIPTOR;
    }

    @Override
    public ExecutionResult execute(String action, Map<String, Object> parameters) {
        try {
            return switch (action) {
                case "list_courses"       -> listCourses();
                case "find_course"        -> findCourse(String.valueOf(parameters.get("name")));
                case "list_assignments"   -> listAssignments(courseId(parameters));
                case "list_announcements" -> listAnnouncements(courseId(parameters));
                default -> throw new ModuleExecutionException(Kind.REJECTED, "Unknown canvas action: " + action);
            };
        } catch (CanvasClientException e) {
            Kind kind = e.isTransient() ? Kind.TRANSIENT
                      : e.isAuthFailure() ? Kind.REJECTED
                      : Kind.FAILED;
            throw new ModuleExecutionException(kind, e.getMessage(), e);
        }
    }

    private ExecutionResult listCourses() {
        List<CanvasClient.Course> courses = client.listCourses();
        return ExecutionResult.of(courses.size() + " active course(s)", courses);
    }

    private ExecutionResult findCourse(String name) {
        String needle = name.strip().toLowerCase(Locale.ROOT);
        List<CanvasClient.Course> matches = client.listCourses().stream()
                .filter(c -> contains(c.name(), needle) || contains(c.courseCode(), needle))
                .toList();

        if (matches.size() == 1) {
            CanvasClient.Course course = matches.get(0);
            String label = course.name() != null ? course.name() : course.courseCode();
            Map<String, Object> facts = new LinkedHashMap<>();
            facts.put(FACT_COURSE_ID, course.id());
            if (label != null) {
                facts.put("course_name", label);
            }
            return ExecutionResult.withFacts("Found course %s (id %d)".formatted(label, course.id()), course, facts)
                    .thenContinue(null);
        }
        if (matches.isEmpty()) {
            throw new ModuleExecutionException(Kind.REJECTED, "No course matches '" + name + "'");
        }
        return ExecutionResult.of("%d courses match '%s'; please be more specific".formatted(matches.size(), name),
                matches);
    }

    private ExecutionResult listAssignments(long courseId) {
        List<CanvasClient.Assignment> assignments = client.listAssignments(courseId);
        return ExecutionResult.withFacts(assignments.size() + " assignment(s) in course " + courseId,
                assignments, Map.of(FACT_COURSE_ID, courseId));
    }

    private ExecutionResult listAnnouncements(long courseId) {
        List<CanvasClient.Announcement> announcements = client.listAnnouncements(courseId);
        return ExecutionResult.withFacts(announcements.size() + " announcement(s) in course " + courseId,
                announcements, Map.of(FACT_COURSE_ID, courseId));
    }

    private static long courseId(Map<String, Object> parameters) {
        Object value = parameters.get(FACT_COURSE_ID);
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw new ModuleExecutionException(Kind.REJECTED, "course_id must be a number, got " + value);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
