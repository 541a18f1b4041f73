package br.com.fantasydraft.backend.controller;

import br.com.fantasydraft.backend.dto.*;
import br.com.fantasydraft.backend.service.BudgetLedger;
import br.com.fantasydraft.backend.service.DraftLifecycleService;
import br.com.fantasydraft.backend.service.UndoService;
import br.com.fantasydraft.backend.util.ParticipantAuthUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Superfície administrativa do host. A checagem de host fica nos serviços.
 */
@Slf4j
@RestController
@RequestMapping("/api/drafts/{draftId}/admin")
@RequiredArgsConstructor
public class AdminController {

    private final DraftLifecycleService lifecycleService;
    private final UndoService undoService;
    private final BudgetLedger budgetLedger;

    @PostMapping("/start")
    public ResponseEntity<DraftDTO> start(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.startDraft(draftId, hostId(httpRequest)));
    }

    @PostMapping("/pause")
    public ResponseEntity<DraftDTO> pause(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.pauseDraft(draftId, hostId(httpRequest)));
    }

    @PostMapping("/resume")
    public ResponseEntity<DraftDTO> resume(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.resumeDraft(draftId, hostId(httpRequest)));
    }

    @PostMapping("/end")
    public ResponseEntity<DraftDTO> end(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.endDraft(draftId, hostId(httpRequest)));
    }

    @PostMapping("/reset")
    public ResponseEntity<DraftDTO> reset(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.resetDraft(draftId, hostId(httpRequest)));
    }

    @PostMapping("/shuffle")
    public ResponseEntity<List<TeamDTO>> shuffle(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.shuffleOrder(draftId, hostId(httpRequest)));
    }

    @PostMapping("/skip-turn")
    public ResponseEntity<TurnAdvanceResult> skipTurn(@PathVariable Long draftId,
            @Valid @RequestBody SettingsRequests.SkipTurn request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.skipTurn(draftId, hostId(httpRequest), request.expectedTurn()));
    }

    @PostMapping("/undo")
    public ResponseEntity<UndoResult> undo(@PathVariable Long draftId,
            @RequestBody(required = false) SettingsRequests.Undo request, HttpServletRequest httpRequest) {
        Long expectedPickId = request != null ? request.expectedPickId() : null;
        return ResponseEntity.ok(undoService.undoLastPick(draftId, hostId(httpRequest), expectedPickId));
    }

    @PostMapping("/archive")
    public ResponseEntity<DraftDTO> archive(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.archiveDraft(draftId, hostId(httpRequest)));
    }

    @PutMapping("/budget")
    public ResponseEntity<Map<String, Object>> overrideBudget(@PathVariable Long draftId,
            @Valid @RequestBody SettingsRequests.BudgetOverride request, HttpServletRequest httpRequest) {
        int budget = budgetLedger.overrideBudget(draftId, hostId(httpRequest), request.teamId(),
                request.newBudget(), request.reason());
        return ResponseEntity.ok(Map.of("teamId", request.teamId(), "budgetRemaining", budget));
    }

    @PutMapping("/timer")
    public ResponseEntity<DraftDTO> setTimer(@PathVariable Long draftId,
            @Valid @RequestBody SettingsRequests.TurnTimer request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.setTurnTimer(draftId, hostId(httpRequest), request.seconds()));
    }

    @PutMapping("/auction-duration")
    public ResponseEntity<DraftDTO> setAuctionDuration(@PathVariable Long draftId,
            @Valid @RequestBody SettingsRequests.AuctionDuration request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.setAuctionDuration(draftId, hostId(httpRequest),
                request.seconds()));
    }

    @PutMapping("/proxy-picking")
    public ResponseEntity<DraftDTO> setProxyPicking(@PathVariable Long draftId,
            @Valid @RequestBody SettingsRequests.Toggle request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.setProxyPicking(draftId, hostId(httpRequest), request.enabled()));
    }

    @PutMapping("/undo-setting")
    public ResponseEntity<DraftDTO> setUndo(@PathVariable Long draftId,
            @Valid @RequestBody SettingsRequests.Toggle request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(lifecycleService.setAllowUndo(draftId, hostId(httpRequest), request.enabled()));
    }

    @GetMapping("/ledger")
    public ResponseEntity<Map<String, Object>> verifyLedger(@PathVariable Long draftId) {
        List<LedgerViolationDTO> violations = budgetLedger.verifyLedger(draftId);
        return ResponseEntity.ok(Map.of("consistent", violations.isEmpty(), "violations", violations));
    }

    private static Long hostId(HttpServletRequest httpRequest) {
        return ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
    }
}
