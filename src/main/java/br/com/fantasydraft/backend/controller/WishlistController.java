package br.com.fantasydraft.backend.controller;

import br.com.fantasydraft.backend.dto.WishlistItemDTO;
import br.com.fantasydraft.backend.dto.WishlistRequests;
import br.com.fantasydraft.backend.service.WishlistService;
import br.com.fantasydraft.backend.util.ParticipantAuthUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Wishlist do participante identificado pelo header.
 */
@RestController
@RequestMapping("/api/drafts/{draftId}/wishlist")
@RequiredArgsConstructor
public class WishlistController {

    private final WishlistService wishlistService;

    @GetMapping
    public ResponseEntity<List<WishlistItemDTO>> list(@PathVariable Long draftId, HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(wishlistService.list(draftId, participantId));
    }

    @PostMapping
    public ResponseEntity<WishlistItemDTO> add(@PathVariable Long draftId,
            @Valid @RequestBody WishlistRequests.Add request, HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        WishlistItemDTO item = wishlistService.add(draftId, participantId, request.entityId(), request.entityName(),
                request.cost());
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @DeleteMapping("/{itemId}")
    public ResponseEntity<Void> remove(@PathVariable Long draftId, @PathVariable Long itemId,
            HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        wishlistService.remove(draftId, participantId, itemId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/order")
    public ResponseEntity<List<WishlistItemDTO>> reorder(@PathVariable Long draftId,
            @Valid @RequestBody WishlistRequests.Reorder request, HttpServletRequest httpRequest) {
        Long participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(wishlistService.reorder(draftId, participantId, request.itemIds()));
    }
}
