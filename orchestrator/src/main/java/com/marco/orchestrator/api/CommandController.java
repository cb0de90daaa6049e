package com.marco.orchestrator.api;

import com.marco.orchestrator.api.dto.AnswerRequest;
import com.marco.orchestrator.api.dto.ConfirmRequest;
import com.marco.orchestrator.api.dto.SubmitCommandRequest;
import com.marco.orchestrator.registry.CapabilityDescriptor;
import com.marco.orchestrator.registry.CapabilityRegistry;
import com.marco.orchestrator.workflow.CommandHandle;
import com.marco.orchestrator.workflow.UnknownCommandException;
import com.marco.orchestrator.workflow.WorkflowOrchestrator;
import com.marco.orchestrator.workflow.WorkflowSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST front-end for the command agent.
 *
 * POST /commands                — submit a natural-language command
 * GET  /commands/{id}           — poll the command's snapshot
 * POST /commands/{id}/answer    — answer the pending clarification question
 * POST /commands/{id}/confirm   — approve or decline the pending destructive action
 * POST /commands/{id}/cancel    — cancel the command
 * GET  /capabilities            — registered modules and their actions
 */
@RestController
public class CommandController {

    private final WorkflowOrchestrator orchestrator;
    private final CapabilityRegistry   registry;

    public CommandController(WorkflowOrchestrator orchestrator, CapabilityRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
    }

    /**
     * Submit a command. Processing continues in the background; poll
     * GET /commands/{id} for progress.
     *
     * Example:
     *   curl -X POST http://localhost:8080/commands \
     *     -H "Content-Type: application/json" \
     *     -d '{"text":"list files in src"}'
     */
    @PostMapping("/commands")
    public ResponseEntity<WorkflowSnapshot> submit(@RequestBody SubmitCommandRequest req) {
        CommandHandle handle = orchestrator.submitCommand(req.text(), req.sessionContext());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(snapshot(handle));
    }

    @GetMapping("/commands/{id}")
    public WorkflowSnapshot getCommand(@PathVariable UUID id) {
        return snapshot(new CommandHandle(id));
    }

    @PostMapping("/commands/{id}/answer")
    public WorkflowSnapshot answer(@PathVariable UUID id, @RequestBody AnswerRequest req) {
        return orchestrator.answer(new CommandHandle(id), req.answer());
    }

    @PostMapping("/commands/{id}/confirm")
    public WorkflowSnapshot confirm(@PathVariable UUID id, @RequestBody ConfirmRequest req) {
        return orchestrator.confirm(new CommandHandle(id), req.approved());
    }

    @PostMapping("/commands/{id}/cancel")
    public WorkflowSnapshot cancel(@PathVariable UUID id) {
        return orchestrator.cancel(new CommandHandle(id));
    }

    @GetMapping("/capabilities")
    public List<CapabilityDescriptor> capabilities() {
        return registry.descriptors();
    }

    private WorkflowSnapshot snapshot(CommandHandle handle) {
        return orchestrator.getStatus(handle)
                .orElseThrow(() -> new UnknownCommandException(handle.id()));
    }
}
