package br.com.fantasydraft.backend.service;

import br.com.fantasydraft.backend.domain.entity.AuctionStatus;
import br.com.fantasydraft.backend.domain.entity.DraftActionType;
import br.com.fantasydraft.backend.domain.entity.DraftStatus;
import br.com.fantasydraft.backend.domain.entity.DraftType;
import br.com.fantasydraft.backend.domain.entity.Team;
import br.com.fantasydraft.backend.dto.AuctionDTO;
import br.com.fantasydraft.backend.dto.AuctionResolution;
import br.com.fantasydraft.backend.dto.AuctionStatsDTO;
import br.com.fantasydraft.backend.dto.BidResult;
import br.com.fantasydraft.backend.exception.DraftErrorCode;
import br.com.fantasydraft.backend.exception.DraftException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class AuctionServiceTest {

    private DraftTestFixture fx;
    private AuctionService service;

    @BeforeEach
    void setup() {
        fx = new DraftTestFixture().activeDraft(DraftType.AUCTION, 2, 2, 10);
        fx.withEntity("garchomp", 0).withEntity("rotom", 0).withEntity("ferrothorn", 0);
        service = new AuctionService(fx.draftRepository, fx.teamRepository, fx.pickRepository,
                fx.auctionRepository, fx.bidHistoryRepository, fx.wishlistItemRepository, fx.guard,
                fx.budgetLedger, fx.validator, fx.actionLogService, fx.mapper, fx.properties, fx.eventPublisher,
                fx.clock);
    }

    @Test
    void testNominateOpensAuction() {
        // act
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // assert
        assertThat(auction.getStatus()).isEqualTo(AuctionStatus.ACTIVE);
        assertThat(auction.getCurrentBid()).isEqualTo(1);
        assertThat(auction.getCurrentBidderTeamId()).isNull();
        assertThat(auction.getNominatingTeamId()).isEqualTo(fx.team(1).getId());
        assertThat(auction.getSecondsRemaining()).isEqualTo(30L);
        assertThat(fx.draft.getActiveAuctionId()).isEqualTo(auction.getId());
    }

    @Test
    void testNominateOutOfRotation() {
        // act & assert
        assertThatThrownBy(() -> service.nominate(1L, fx.ownerOf(2), "garchomp", null))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.NOT_YOUR_NOMINATION);
        assertThat(fx.auctions).isEmpty();
    }

    @Test
    void testSecondNominationWhileAuctionOpen() {
        // given
        service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act & assert
        assertThatThrownBy(() -> service.nominate(1L, fx.ownerOf(1), "rotom", null))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.ACTIVE_AUCTION_EXISTS);
    }

    @Test
    void testNominateOnSnakeDraft() {
        // given
        fx.draft.setDraftType(DraftType.SNAKE);

        // act & assert
        assertThatThrownBy(() -> service.nominate(1L, fx.ownerOf(1), "garchomp", null))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.WRONG_DRAFT_TYPE);
    }

    @Test
    void testStartingBidAboveBudget() {
        // act & assert
        assertThatThrownBy(() -> service.nominate(1L, fx.ownerOf(1), "garchomp", 11))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INSUFFICIENT_BUDGET);
    }

    @Test
    void testBidMustExceedCurrent() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", 3);

        // act & assert
        assertThatThrownBy(() -> service.placeBid(1L, auction.getId(), fx.ownerOf(2), 3))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.BID_TOO_LOW);
        assertThat(fx.auctions.get(0).getCurrentBidderTeamId()).isNull();
        assertThat(fx.bids).isEmpty();
    }

    @Test
    void testBidAboveBudget() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act & assert
        assertThatThrownBy(() -> service.placeBid(1L, auction.getId(), fx.ownerOf(2), 11))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INSUFFICIENT_BUDGET);
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(10);
    }

    @Test
    void testBidAfterExpiry() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        fx.auctions.get(0).setAuctionEnd(DraftTestFixture.NOW.minusSeconds(1));

        // act & assert
        assertThatThrownBy(() -> service.placeBid(1L, auction.getId(), fx.ownerOf(2), 5))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.AUCTION_EXPIRED);
    }

    @Test
    void testBidsDoNotDebitUntilResolution() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act
        BidResult first = service.placeBid(1L, auction.getId(), fx.ownerOf(2), 4);
        BidResult second = service.placeBid(1L, auction.getId(), fx.ownerOf(1), 6);

        // assert
        assertThat(first.amount()).isEqualTo(4);
        assertThat(second.teamId()).isEqualTo(fx.team(1).getId());
        assertThat(fx.auctions.get(0).getCurrentBid()).isEqualTo(6);
        assertThat(fx.bids).hasSize(2);
        assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(10);
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(10);
    }

    @Test
    void testResolveAwardsHighestBidder() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 4);

        // act
        AuctionResolution resolution = service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // assert
        assertThat(resolution.sold()).isTrue();
        assertThat(resolution.winnerTeamId()).isEqualTo(fx.team(2).getId());
        assertThat(resolution.price()).isEqualTo(4);
        assertThat(resolution.currentTurn()).isEqualTo(2);
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(6);
        assertThat(fx.picks).hasSize(1);
        assertThat(fx.picks.get(0).getCost()).isEqualTo(4);
        assertThat(fx.auctions.get(0).getStatus()).isEqualTo(AuctionStatus.COMPLETED);
        assertThat(fx.draft.getActiveAuctionId()).isNull();
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(2);
        assertThat(fx.loggedActions()).containsExactly(DraftActionType.AUCTION_WON);
    }

    @Test
    void testResolveWithoutBidsCreatesNoPick() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act
        AuctionResolution resolution = service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // assert
        assertThat(resolution.sold()).isFalse();
        assertThat(resolution.pickId()).isNull();
        assertThat(resolution.currentTurn()).isEqualTo(1);
        assertThat(fx.picks).isEmpty();
        assertThat(fx.team(1).getBudgetRemaining()).isEqualTo(10);
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(10);
        assertThat(fx.draft.getActiveAuctionId()).isNull();
        verify(fx.teamRepository, never()).debitIfUnchanged(anyLong(), anyInt(), anyInt());
    }

    @Test
    void testOverrideCannotDropLeaderBelowStandingBid() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 8);
        Long leaderId = fx.team(2).getId();

        // act & assert
        assertThatThrownBy(() -> fx.budgetLedger.overrideBudget(1L, DraftTestFixture.HOST_ID, leaderId, 3, null))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INVALID_INPUT);
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(10);

        assertThat(fx.budgetLedger.overrideBudget(1L, DraftTestFixture.HOST_ID, leaderId, 8, null)).isEqualTo(8);
        assertThat(fx.budgetLedger.overrideBudget(1L, DraftTestFixture.HOST_ID, fx.team(1).getId(), 0, null))
                .isZero();
    }

    @Test
    void testResolveWhenLeaderCanNoLongerPayClosesWithoutSale() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 8);
        fx.team(2).setBudgetRemaining(3);

        // act
        AuctionResolution resolution = service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // assert
        assertThat(resolution.sold()).isFalse();
        assertThat(resolution.currentTurn()).isEqualTo(1);
        assertThat(fx.picks).isEmpty();
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(3);
        assertThat(fx.auctions.get(0).getStatus()).isEqualTo(AuctionStatus.COMPLETED);
        assertThat(fx.draft.getActiveAuctionId()).isNull();
        assertThat(fx.loggedActions()).containsExactly(DraftActionType.AUCTION_NO_SALE);

        assertThat(service.nominate(1L, fx.ownerOf(1), "rotom", null).getStatus()).isEqualTo(AuctionStatus.ACTIVE);
    }

    @Test
    void testNominationRotatesAfterSale() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 2);
        service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // act
        List<Team> teams = fx.teamRepository.findByDraftIdOrderByDraftOrderAsc(1L);

        // assert
        assertThat(service.resolveNominator(fx.draft, teams)).contains(fx.team(2));
        assertThatThrownBy(() -> service.nominate(1L, fx.ownerOf(1), "rotom", null))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.NOT_YOUR_NOMINATION);
    }

    @Test
    void testNominatorSkipsFullTeam() {
        // given: time 2 completa o elenco primeiro
        fx.draft.setEntitiesPerTeam(1);
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 2);
        service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // act
        List<Team> teams = fx.teamRepository.findByDraftIdOrderByDraftOrderAsc(1L);

        // assert
        assertThat(service.resolveNominator(fx.draft, teams)).contains(fx.team(1));
    }

    @Test
    void testLastSaleCompletesDraft() {
        // given
        fx.draft.setEntitiesPerTeam(1);
        AuctionDTO first = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, first.getId(), fx.ownerOf(1), 2);
        service.resolveAuction(1L, first.getId(), DraftTestFixture.HOST_ID);
        AuctionDTO second = service.nominate(1L, fx.ownerOf(2), "rotom", null);
        service.placeBid(1L, second.getId(), fx.ownerOf(2), 3);

        // act
        AuctionResolution resolution = service.resolveAuction(1L, second.getId(), DraftTestFixture.HOST_ID);

        // assert
        assertThat(resolution.draftCompleted()).isTrue();
        assertThat(fx.draft.getStatus()).isEqualTo(DraftStatus.COMPLETED);
        assertThat(fx.picks).hasSize(2);
        assertThat(fx.budgetLedger.verifyLedger(1L)).isEmpty();
    }

    @Test
    void testNonHostCannotResolveBeforeExpiry() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act & assert
        assertThatThrownBy(() -> service.resolveAuction(1L, auction.getId(), fx.ownerOf(2)))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.HOST_ONLY);
    }

    @Test
    void testResolveExpiredWaitsForDeadline() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act & assert
        assertThatThrownBy(() -> service.resolveExpiredAuction(1L, auction.getId()))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.AUCTION_NOT_ACTIVE);

        fx.auctions.get(0).setAuctionEnd(DraftTestFixture.NOW);
        assertThat(service.findExpiredAuctions(DraftTestFixture.NOW)).hasSize(1);
        assertThat(service.resolveExpiredAuction(1L, auction.getId()).sold()).isFalse();
    }

    @Test
    void testResolveTwiceIsRejected() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // act & assert
        assertThatThrownBy(() -> service.resolveAuction(1L, auction.getId(), DraftTestFixture.HOST_ID))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.AUCTION_NOT_ACTIVE);
    }

    @Test
    void testCancelReleasesSlotWithoutPick() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 4);

        // act
        AuctionDTO cancelled = service.cancelAuction(1L, auction.getId(), DraftTestFixture.HOST_ID);

        // assert
        assertThat(cancelled.getStatus()).isEqualTo(AuctionStatus.CANCELLED);
        assertThat(fx.draft.getActiveAuctionId()).isNull();
        assertThat(fx.draft.getCurrentTurn()).isEqualTo(1);
        assertThat(fx.picks).isEmpty();
        assertThat(fx.team(2).getBudgetRemaining()).isEqualTo(10);
    }

    @Test
    void testExtendExpiredAuctionCountsFromNow() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        fx.auctions.get(0).setAuctionEnd(DraftTestFixture.NOW.minusSeconds(10));

        // act
        AuctionDTO extended = service.extendAuction(1L, auction.getId(), DraftTestFixture.HOST_ID, 15);

        // assert
        assertThat(extended.getAuctionEnd()).isEqualTo(DraftTestFixture.NOW.plusSeconds(15));
        assertThat(extended.getSecondsRemaining()).isEqualTo(15L);
    }

    @Test
    void testExtendRequiresPositiveSeconds() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);

        // act & assert
        assertThatThrownBy(() -> service.extendAuction(1L, auction.getId(), DraftTestFixture.HOST_ID, 0))
                .isInstanceOf(DraftException.class)
                .extracting("code").isEqualTo(DraftErrorCode.INVALID_INPUT);
    }

    @Test
    void testAuctionStats() {
        // given
        AuctionDTO auction = service.nominate(1L, fx.ownerOf(1), "garchomp", null);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 3);
        service.placeBid(1L, auction.getId(), fx.ownerOf(1), 5);
        service.placeBid(1L, auction.getId(), fx.ownerOf(2), 7);

        // act
        AuctionStatsDTO stats = service.getAuctionStats(1L);

        // assert
        assertThat(stats.getTotalAuctions()).isEqualTo(1);
        assertThat(stats.getTotalBids()).isEqualTo(3);
        assertThat(stats.getAverageBidsPerAuction()).isEqualTo(3.0);
        assertThat(stats.getHighestBid()).isEqualTo(7);
        assertThat(stats.getHighestBidEntityName()).isEqualTo("GARCHOMP");
        assertThat(stats.getMostActiveTeamId()).isEqualTo(fx.team(2).getId());
    }
}
