package br.com.fantasydraft.backend.controller;

import br.com.fantasydraft.backend.dto.*;
import br.com.fantasydraft.backend.service.AuctionService;
import br.com.fantasydraft.backend.util.ParticipantAuthUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/drafts/{draftId}/auctions")
@RequiredArgsConstructor
public class AuctionController {

    private final AuctionService auctionService;

    @GetMapping("/current")
    public ResponseEntity<AuctionDTO> getCurrentAuction(@PathVariable Long draftId) {
        return auctionService.getCurrentAuction(draftId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping
    public ResponseEntity<AuctionDTO> nominate(@PathVariable Long draftId,
            @Valid @RequestBody NominateRequest request, HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        AuctionDTO auction = auctionService.nominate(draftId, participantId, request.getEntityId(),
                request.getStartingBid());
        return ResponseEntity.status(HttpStatus.CREATED).body(auction);
    }

    @PostMapping("/{auctionId}/bids")
    public ResponseEntity<BidResult> placeBid(@PathVariable Long draftId, @PathVariable Long auctionId,
            @Valid @RequestBody BidRequest request, HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(auctionService.placeBid(draftId, auctionId, participantId, request.getAmount()));
    }

    @GetMapping("/{auctionId}/bids")
    public ResponseEntity<List<BidDTO>> getBidHistory(@PathVariable Long draftId, @PathVariable Long auctionId) {
        return ResponseEntity.ok(auctionService.getBidHistory(draftId, auctionId));
    }

    @PostMapping("/{auctionId}/resolve")
    public ResponseEntity<AuctionResolution> resolve(@PathVariable Long draftId, @PathVariable Long auctionId,
            HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(auctionService.resolveAuction(draftId, auctionId, participantId));
    }

    @PostMapping("/{auctionId}/extend")
    public ResponseEntity<AuctionDTO> extend(@PathVariable Long draftId, @PathVariable Long auctionId,
            @Valid @RequestBody SettingsRequests.ExtendAuction request, HttpServletRequest httpRequest) {
        Long hostId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(auctionService.extendAuction(draftId, auctionId, hostId, request.seconds()));
    }

    @PostMapping("/{auctionId}/cancel")
    public ResponseEntity<AuctionDTO> cancel(@PathVariable Long draftId, @PathVariable Long auctionId,
            HttpServletRequest httpRequest) {
        Long hostId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(auctionService.cancelAuction(draftId, auctionId, hostId));
    }

    @GetMapping("/stats")
    public ResponseEntity<AuctionStatsDTO> getStats(@PathVariable Long draftId) {
        return ResponseEntity.ok(auctionService.getAuctionStats(draftId));
    }
}
