package br.com.fantasydraft.backend.dto;

/**
 * Veredito do validador: se a entidade pode ser escolhida no formato e o custo
 * autoritativo dela.
 */
public record LegalityResult(boolean legal, String reason, int cost, String entityName) {

    public static LegalityResult legal(int cost, String entityName) {
        return new LegalityResult(true, null, cost, entityName);
    }

    public static LegalityResult illegal(String reason) {
        return new LegalityResult(false, reason, 0, null);
    }
}
