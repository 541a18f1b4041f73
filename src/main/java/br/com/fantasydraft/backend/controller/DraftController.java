package br.com.fantasydraft.backend.controller;

import br.com.fantasydraft.backend.dto.*;
import br.com.fantasydraft.backend.service.DraftQueryService;
import br.com.fantasydraft.backend.service.DraftSessionService;
import br.com.fantasydraft.backend.service.PickCommitService;
import br.com.fantasydraft.backend.util.ParticipantAuthUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/drafts")
@RequiredArgsConstructor
public class DraftController {

    private final DraftSessionService sessionService;
    private final DraftQueryService queryService;
    private final PickCommitService pickCommitService;

    @PostMapping
    public ResponseEntity<CreateDraftResult> createDraft(@Valid @RequestBody CreateDraftRequest request) {
        CreateDraftResult result = sessionService.createDraft(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping
    public ResponseEntity<List<PublicDraftDTO>> listPublicDrafts() {
        return ResponseEntity.ok(queryService.listPublicDrafts());
    }

    @PostMapping("/join")
    public ResponseEntity<JoinResult> joinDraft(@Valid @RequestBody JoinDraftRequest request) {
        return ResponseEntity.ok(sessionService.joinDraft(request));
    }

    @PostMapping("/spectate")
    public ResponseEntity<JoinResult> spectate(@Valid @RequestBody JoinDraftRequest request) {
        return ResponseEntity.ok(sessionService.joinAsSpectator(request.getRoomCode(), request.getDisplayName()));
    }

    @GetMapping("/{draftId}")
    public ResponseEntity<DraftStateDTO> getDraftState(@PathVariable Long draftId) {
        return ResponseEntity.ok(queryService.getDraftState(draftId));
    }

    @GetMapping("/{draftId}/order")
    public ResponseEntity<List<Integer>> getSnakeOrder(@PathVariable Long draftId) {
        return ResponseEntity.ok(queryService.getSnakeOrder(draftId));
    }

    @GetMapping("/{draftId}/history")
    public ResponseEntity<List<DraftActionLogDTO>> getHistory(@PathVariable Long draftId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queryService.getHistory(draftId, limit));
    }

    @PostMapping("/{draftId}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable Long draftId,
            HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        sessionService.heartbeat(draftId, participantId);
        return ResponseEntity.ok(Map.of("success", true));
    }

    @PostMapping("/{draftId}/leave")
    public ResponseEntity<Map<String, Object>> leave(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        sessionService.leaveDraft(draftId, participantId);
        return ResponseEntity.ok(Map.of("success", true));
    }

    @PostMapping("/{draftId}/picks")
    public ResponseEntity<PickResult> makePick(@PathVariable Long draftId, @Valid @RequestBody PickRequest request,
            HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        log.debug("[Draft] Participante {} pick {} no turno {} do draft {}", participantId, request.getEntityId(),
                request.getExpectedTurn(), draftId);
        return ResponseEntity.ok(pickCommitService.makePick(draftId, participantId, request.getEntityId(),
                request.getCost(), request.getExpectedTurn()));
    }

    @PostMapping("/{draftId}/proxy-picks")
    public ResponseEntity<PickResult> makeProxyPick(@PathVariable Long draftId,
            @Valid @RequestBody ProxyPickRequest request, HttpServletRequest httpRequest) {
        Long hostId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(pickCommitService.makeProxyPick(draftId, hostId, request.getTeamId(),
                request.getEntityId(), request.getCost(), request.getExpectedTurn()));
    }
}
