package com.marco.orchestrator.api;

import com.marco.orchestrator.intent.ClarificationRequest;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.module.ScriptedModule;
import com.marco.orchestrator.registry.CapabilityRegistry;
import com.marco.orchestrator.workflow.CommandHandle;
import com.marco.orchestrator.workflow.IllegalCommandStateException;
import com.marco.orchestrator.workflow.UnknownCommandException;
import com.marco.orchestrator.workflow.WorkflowOrchestrator;
import com.marco.orchestrator.workflow.WorkflowPhase;
import com.marco.orchestrator.workflow.WorkflowSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for CommandController and ApiExceptionHandler.
 *
 * @WebMvcTest spins up only the web layer; the orchestrator and registry are mocks.
 */
@WebMvcTest(CommandController.class)
class CommandControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean WorkflowOrchestrator orchestrator;
    @MockitoBean CapabilityRegistry   registry;

    static final UUID ID = UUID.fromString("6f1c1c9e-0000-4000-8000-000000000042");

    // ------------------------------------------------------------------
    // POST /commands
    // ------------------------------------------------------------------

    @Test
    void submit_returns202WithSnapshot() throws Exception {
        when(orchestrator.submitCommand(eq("list files in src"), any())).thenReturn(new CommandHandle(ID));
        when(orchestrator.getStatus(new CommandHandle(ID)))
                .thenReturn(Optional.of(snapshot(WorkflowPhase.CLASSIFYING, null)));

        mockMvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"list files in src"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.commandId").value(ID.toString()))
                .andExpect(jsonPath("$.phase").value("CLASSIFYING"));
    }

    @Test
    void submit_blankText_returns400() throws Exception {
        when(orchestrator.submitCommand(any(), any()))
                .thenThrow(new IllegalArgumentException("Command text must not be blank"));

        mockMvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Command text must not be blank"));
    }

    // ------------------------------------------------------------------
    // GET /commands/{id}
    // ------------------------------------------------------------------

    @Test
    void getCommand_awaitingClarification_showsTheQuestion() throws Exception {
        ClarificationRequest question = new ClarificationRequest("Which path should I use for fs.delete_file?",
                List.of(), Set.of("path"), Intent.of("fs", "delete_file", Map.of()));
        when(orchestrator.getStatus(new CommandHandle(ID)))
                .thenReturn(Optional.of(snapshot(WorkflowPhase.AWAITING_CLARIFICATION, question)));

        mockMvc.perform(get("/commands/{id}", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("AWAITING_CLARIFICATION"))
                .andExpect(jsonPath("$.pendingClarification.fields[0]").value("path"));
    }

    @Test
    void getCommand_unknownId_returns404() throws Exception {
        when(orchestrator.getStatus(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/commands/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // answer / confirm / cancel
    // ------------------------------------------------------------------

    @Test
    void answer_forwardsTextToOrchestrator() throws Exception {
        when(orchestrator.answer(new CommandHandle(ID), "notes.txt"))
                .thenReturn(snapshot(WorkflowPhase.CLASSIFYING, null));

        mockMvc.perform(post("/commands/{id}/answer", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"notes.txt\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("CLASSIFYING"));
    }

    @Test
    void confirm_inWrongPhase_returns409() throws Exception {
        when(orchestrator.confirm(new CommandHandle(ID), true))
                .thenThrow(new IllegalCommandStateException(ID, WorkflowPhase.DONE, "confirm"));

        mockMvc.perform(post("/commands/{id}/confirm", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\":true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.phase").value("DONE"));
    }

    @Test
    void confirm_missingApproved_countsAsDecline() throws Exception {
        when(orchestrator.confirm(new CommandHandle(ID), false))
                .thenReturn(snapshot(WorkflowPhase.CANCELLED, null));

        mockMvc.perform(post("/commands/{id}/confirm", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("CANCELLED"));
        verify(orchestrator).confirm(new CommandHandle(ID), false);
    }

    @Test
    void cancel_unknownCommand_returns404() throws Exception {
        when(orchestrator.cancel(new CommandHandle(ID))).thenThrow(new UnknownCommandException(ID));

        mockMvc.perform(post("/commands/{id}/cancel", ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    // ------------------------------------------------------------------
    // GET /capabilities
    // ------------------------------------------------------------------

    @Test
    void capabilities_listsRegisteredModules() throws Exception {
        when(registry.descriptors()).thenReturn(List.of(new ScriptedModule().capabilities()));

        mockMvc.perform(get("/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("demo"))
                .andExpect(jsonPath("$[0].actions.purge.params[0].name").value("target"));
    }

    private static WorkflowSnapshot snapshot(WorkflowPhase phase, ClarificationRequest question) {
        Instant now = Instant.parse("2026-10-19T10:00:00Z");
        return new WorkflowSnapshot(ID, "list files in src", phase, List.of(), question, null,
                Map.of(), question == null ? 0 : 1, null, now, now);
    }
}
