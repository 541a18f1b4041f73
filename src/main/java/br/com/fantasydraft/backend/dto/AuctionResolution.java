package br.com.fantasydraft.backend.dto;

/**
 * Resultado do encerramento de um leilão. Sem vencedor, winnerTeamId, price e
 * pickId ficam nulos.
 */
public record AuctionResolution(
        Long auctionId,
        Long winnerTeamId,
        Integer price,
        Long pickId,
        int currentTurn,
        boolean draftCompleted) {

    public boolean sold() {
        return winnerTeamId != null;
    }
}
