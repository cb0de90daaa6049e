package com.marco.orchestrator.module.canvas;

import com.marco.orchestrator.module.ExecutionResult;
import com.marco.orchestrator.module.ModuleExecutionException;
import com.marco.orchestrator.module.canvas.CanvasClient.Assignment;
import com.marco.orchestrator.module.canvas.CanvasClient.Course;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CanvasModule. The HTTP client is mocked with Mockito.
 */
@ExtendWith(MockitoExtension.class)
class CanvasModuleTest {

    @Mock CanvasClient client;

    CanvasModule canvas;

    static final List<Course> COURSES = List.of(
            new Course(101, "Intro to Biology", "BIO-101"),
            new Course(202, "Organic Chemistry", "CHEM-202"),
            new Course(203, "Chemistry Lab", "CHEM-203"));

    @BeforeEach
    void setUp() {
        canvas = new CanvasModule(client);
    }

    @Test
    void allActionsAreReadOnly() {
        assertThat(canvas.capabilities().destructiveActions()).isEmpty();
        assertThat(canvas.capabilities().actions().values()).allMatch(a -> a.idempotent());
    }

    @Test
    void findCourse_uniqueMatch_setsCourseIdAndAsksForFollowUp() {
        when(client.listCourses()).thenReturn(COURSES);

        ExecutionResult result = canvas.execute("find_course", Map.of("name", "biology"));

        assertThat(result.facts()).containsEntry(CanvasModule.FACT_COURSE_ID, 101L);
        assertThat(result.followUp()).isTrue();
        assertThat(result.nextInput()).isNull();
    }

    @Test
    void findCourse_severalMatches_returnsThemWithoutFollowUp() {
        when(client.listCourses()).thenReturn(COURSES);

        ExecutionResult result = canvas.execute("find_course", Map.of("name", "chem"));

        assertThat(result.followUp()).isFalse();
        assertThat(result.facts()).doesNotContainKey(CanvasModule.FACT_COURSE_ID);
        assertThat(result.summary()).startsWith("2 courses match");
    }

    @Test
    void findCourse_matchedByCodeOnly_withoutName_stillResolves() {
        when(client.listCourses()).thenReturn(List.of(new Course(305, null, "HIST-305")));

        ExecutionResult result = canvas.execute("find_course", Map.of("name", "hist-305"));

        assertThat(result.facts()).containsEntry(CanvasModule.FACT_COURSE_ID, 305L)
                .containsEntry("course_name", "HIST-305");
        assertThat(result.summary()).isEqualTo("Found course HIST-305 (id 305)");
        assertThat(result.followUp()).isTrue();
    }

    @Test
    void findCourse_noMatch_isRejected() {
        when(client.listCourses()).thenReturn(COURSES);

        assertThatThrownBy(() -> canvas.execute("find_course", Map.of("name", "history")))
                .isInstanceOfSatisfying(ModuleExecutionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ModuleExecutionException.Kind.REJECTED));
    }

    @Test
    void listAssignments_usesCourseId() {
        when(client.listAssignments(101L)).thenReturn(List.of(
                new Assignment(1, "Lab report", "2026-10-30T23:59:00Z", "https://canvas/a/1")));

        ExecutionResult result = canvas.execute("list_assignments", Map.of("course_id", 101L));

        assertThat(result.summary()).isEqualTo("1 assignment(s) in course 101");
    }

    @Test
    void rateLimit_mapsToTransient_authFailure_mapsToRejected() {
        when(client.listCourses())
                .thenThrow(new CanvasClientException(429, "slow down"))
                .thenThrow(new CanvasClientException(401, "bad token"))
                .thenThrow(new CanvasClientException(404, "gone"));

        assertThatThrownBy(() -> canvas.execute("list_courses", Map.of()))
                .isInstanceOfSatisfying(ModuleExecutionException.class, e -> assertThat(e.isTransient()).isTrue());
        assertThatThrownBy(() -> canvas.execute("list_courses", Map.of()))
                .isInstanceOfSatisfying(ModuleExecutionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ModuleExecutionException.Kind.REJECTED));
        assertThatThrownBy(() -> canvas.execute("list_courses", Map.of()))
                .isInstanceOfSatisfying(ModuleExecutionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ModuleExecutionException.Kind.FAILED));
    }
}
