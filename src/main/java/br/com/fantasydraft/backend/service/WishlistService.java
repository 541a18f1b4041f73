package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.Participant;
import br.com.fantasydraft.backend.domain.entity.WishlistItem;
import br.com.fantasydraft.backend.domain.repository.PickRepository;
import br.com.fantasydraft.backend.domain.repository.WishlistItemRepository;
import br.com.fantasydraft.backend.dto.WishlistItemDTO;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import br.com.fantasydraft.backend.mapper.DraftMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wishlist ordenada por participante. Prioridades sempre contíguas 1..N.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WishlistService {

    private final WishlistItemRepository wishlistItemRepository;
    private final PickRepository pickRepository;
    private final DraftGuard draftGuard;
    private final DraftMapper draftMapper;

    @Transactional(readOnly = true)
    public List<WishlistItemDTO> list(Long draftId, Long participantId) {
        draftGuard.requireParticipant(draftId, participantId);
        return draftMapper.toWishlistDTOs(
                wishlistItemRepository.findByDraftIdAndParticipantIdOrderByPriorityAsc(draftId, participantId));
    }

    @Transactional
    public WishlistItemDTO add(Long draftId, Long participantId, String entityId, String entityName, int cost) {
        draftGuard.requireDraft(draftId);
        Participant participant = draftGuard.requireParticipant(draftId, participantId);
        draftGuard.requireTeamOf(participant);
        if (cost < 0) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, "Custo não pode ser negativo");
        }
        if (wishlistItemRepository.existsByParticipantIdAndEntityId(participantId, entityId)) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT, entityId + " já está na wishlist");
        }

        WishlistItem item = wishlistItemRepository.save(WishlistItem.builder()
                .draftId(draftId)
                .participantId(participantId)
                .entityId(entityId)
                .entityName(entityName)
                .cost(cost)
                .priority(wishlistItemRepository.findMaxPriority(participantId) + 1)
                .available(!pickRepository.existsByDraftIdAndEntityId(draftId, entityId))
                .build());

        log.debug("[Wishlist] Participante {} adicionou {} na posição {}", participantId, entityId,
                item.getPriority());
        return draftMapper.toDTO(item);
    }

    @Transactional
    public void remove(Long draftId, Long participantId, Long itemId) {
        draftGuard.requireParticipant(draftId, participantId);
        List<WishlistItem> items = wishlistItemRepository.findByDraftIdAndParticipantIdOrderByPriorityAsc(draftId,
                participantId);
        WishlistItem target = items.stream()
                .filter(i -> i.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new DraftException(DraftErrorCode.INVALID_INPUT,
                        "Item " + itemId + " não está na wishlist"));

        wishlistItemRepository.delete(target);
        List<WishlistItem> remaining = new ArrayList<>(items);
        remaining.remove(target);
        renumber(remaining);
    }

    /**
     * Reordena a wishlist inteira; os ids informados precisam ser exatamente
     * os itens atuais.
     */
    @Transactional
    public List<WishlistItemDTO> reorder(Long draftId, Long participantId, List<Long> itemIds) {
        draftGuard.requireParticipant(draftId, participantId);
        List<WishlistItem> items = wishlistItemRepository.findByDraftIdAndParticipantIdOrderByPriorityAsc(draftId,
                participantId);

        Map<Long, WishlistItem> byId = items.stream()
                .collect(Collectors.toMap(WishlistItem::getId, Function.identity()));
        if (itemIds.size() != items.size() || !byId.keySet().equals(new HashSet<>(itemIds))) {
            throw new DraftException(DraftErrorCode.INVALID_INPUT,
                    "A nova ordem precisa conter exatamente os " + items.size() + " itens da wishlist");
        }

        List<WishlistItem> reordered = itemIds.stream().map(byId::get).collect(Collectors.toList());
        renumber(reordered);
        return draftMapper.toWishlistDTOs(reordered);
    }

    private void renumber(List<WishlistItem> items) {
        for (int i = 0; i < items.size(); i++) {
            items.get(i).setPriority(i + 1);
        }
        wishlistItemRepository.saveAll(items);
    }
}
