package br.com.fantasydraft.backend.mapper;

import br.com.fantasydraft.backend.domain.entity.*;
import br.com.fantasydraft.backend.dto.*;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DraftMapper {

    DraftDTO toDTO(Draft draft);

    @Mapping(target = "pickCount", ignore = true) // Será preenchido externamente
    TeamDTO toDTO(Team team);

    @Mapping(target = "online", ignore = true) // Será preenchido externamente
    ParticipantDTO toDTO(Participant participant);

    PickDTO toDTO(Pick pick);

    @Mapping(target = "secondsRemaining", ignore = true) // Será preenchido externamente
    AuctionDTO toDTO(Auction auction);

    BidDTO toDTO(BidHistory bid);

    WishlistItemDTO toDTO(WishlistItem item);

    DraftActionLogDTO toDTO(DraftActionLog log);

    List<PickDTO> toPickDTOs(List<Pick> picks);

    List<BidDTO> toBidDTOs(List<BidHistory> bids);

    List<WishlistItemDTO> toWishlistDTOs(List<WishlistItem> items);

    List<DraftActionLogDTO> toActionLogDTOs(List<DraftActionLog> logs);
}
