package br.com.fantasydraft.backend.domain.repository;

import br.com.fantasydraft.backend.domain.entity.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * UPDATEs condicionais contra um banco real (H2): o retorno de 0 linhas é o
 * que os serviços usam para detectar corrida.
 */
@DataJpaTest
class ConditionalUpdateRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @Autowired
    private DraftRepository draftRepository;

    @Autowired
    private TeamRepository teamRepository;

    @Autowired
    private AuctionRepository auctionRepository;

    private Draft draft;
    private Team team;

    @BeforeEach
    void setup() {
        draft = draftRepository.saveAndFlush(Draft.builder()
                .roomCode("XYZ789")
                .name("Liga")
                .status(DraftStatus.ACTIVE)
                .draftType(DraftType.SNAKE)
                .currentTurn(1)
                .currentRound(1)
                .maxTeams(4)
                .budgetPerTeam(10)
                .entitiesPerTeam(2)
                .timeLimitSeconds(60)
                .pendingTimeLimitSeconds(90)
                .build());
        team = teamRepository.saveAndFlush(Team.builder()
                .draftId(draft.getId())
                .name("Time 1")
                .draftOrder(1)
                .budgetRemaining(10)
                .build());
    }

    @Test
    void testAdvanceTurnOnlyOnce() {
        // act
        int first = draftRepository.advanceTurn(draft.getId(), 1, 2, 1, DraftStatus.ACTIVE, DraftStatus.ACTIVE, NOW);
        int second = draftRepository.advanceTurn(draft.getId(), 1, 2, 1, DraftStatus.ACTIVE, DraftStatus.ACTIVE, NOW);

        // assert
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        Draft reloaded = draftRepository.findById(draft.getId()).orElseThrow();
        assertThat(reloaded.getCurrentTurn()).isEqualTo(2);
        assertThat(reloaded.getTimeLimitSeconds()).isEqualTo(90);
        assertThat(reloaded.getPendingTimeLimitSeconds()).isNull();
    }

    @Test
    void testAdvanceTurnRequiresStatus() {
        // given
        assertThat(draftRepository.pause(draft.getId(), NOW)).isEqualTo(1);

        // act & assert
        assertThat(draftRepository.advanceTurn(draft.getId(), 1, 2, 1, DraftStatus.ACTIVE, DraftStatus.ACTIVE, NOW))
                .isZero();
    }

    @Test
    void testPauseStampsAndResumeClears() {
        // act & assert
        assertThat(draftRepository.pause(draft.getId(), NOW)).isEqualTo(1);
        assertThat(draftRepository.pause(draft.getId(), NOW)).isZero();
        assertThat(draftRepository.findById(draft.getId()).orElseThrow().getPausedAt()).isEqualTo(NOW);

        assertThat(draftRepository.resume(draft.getId(), NOW.plusSeconds(60))).isEqualTo(1);
        Draft reloaded = draftRepository.findById(draft.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(DraftStatus.ACTIVE);
        assertThat(reloaded.getPausedAt()).isNull();
        assertThat(reloaded.getTurnStartedAt()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void testDebitNeverGoesNegative() {
        // act & assert
        assertThat(teamRepository.debitIfAffordable(team.getId(), 7)).isEqualTo(1);
        assertThat(teamRepository.debitIfAffordable(team.getId(), 4)).isZero();
        assertThat(teamRepository.findBudgetRemaining(team.getId())).contains(3);
        assertThat(teamRepository.debitIfUnchanged(team.getId(), 10, 1)).isZero();
        assertThat(teamRepository.debitIfUnchanged(team.getId(), 3, 3)).isEqualTo(1);
        assertThat(teamRepository.findBudgetRemaining(team.getId())).contains(0);
    }

    @Test
    void testPlaceBidRules() {
        // given
        Auction auction = auctionRepository.saveAndFlush(Auction.builder()
                .draftId(draft.getId())
                .entityId("garchomp")
                .nominatingTeamId(team.getId())
                .currentBid(1)
                .auctionEnd(NOW.plusSeconds(30))
                .status(AuctionStatus.ACTIVE)
                .build());

        // act & assert
        assertThat(auctionRepository.placeBid(auction.getId(), team.getId(), 5, NOW)).isEqualTo(1);
        assertThat(auctionRepository.placeBid(auction.getId(), team.getId(), 5, NOW)).isZero();
        assertThat(auctionRepository.placeBid(auction.getId(), team.getId(), 11, NOW)).isZero();
        assertThat(auctionRepository.placeBid(auction.getId(), team.getId(), 6, NOW.plusSeconds(30))).isZero();

        assertThat(auctionRepository.finishIfActive(auction.getId(), AuctionStatus.COMPLETED, NOW)).isEqualTo(1);
        assertThat(auctionRepository.finishIfActive(auction.getId(), AuctionStatus.CANCELLED, NOW)).isZero();

        Auction reloaded = auctionRepository.findById(auction.getId()).orElseThrow();
        assertThat(reloaded.getCurrentBid()).isEqualTo(5);
        assertThat(reloaded.getCurrentBidderTeamId()).isEqualTo(team.getId());
        assertThat(reloaded.getStatus()).isEqualTo(AuctionStatus.COMPLETED);
    }
}
