package br.com.fantasydraft.backend.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cálculo da ordem snake: rodadas ímpares seguem 1..N, rodadas pares N..1.
 * Turnos e rodadas são 1-indexados.
 */
public final class SnakeOrderGenerator {

    private SnakeOrderGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Posição (draftOrder) do time que escolhe no turno informado.
     */
    public static int teamOrderForTurn(int turn, int teamCount) {
        requirePositive(turn, "turn");
        requirePositive(teamCount, "teamCount");

        int roundIndex = (turn - 1) / teamCount;
        int positionInRound = (turn - 1) % teamCount;
        return roundIndex % 2 == 0 ? positionInRound + 1 : teamCount - positionInRound;
    }

    public static int roundForTurn(int turn, int teamCount) {
        requirePositive(turn, "turn");
        requirePositive(teamCount, "teamCount");
        return (turn - 1) / teamCount + 1;
    }

    public static int pickInRound(int turn, int teamCount) {
        requirePositive(turn, "turn");
        requirePositive(teamCount, "teamCount");
        return (turn - 1) % teamCount + 1;
    }

    /**
     * Sequência completa de posições para todas as rodadas.
     */
    public static List<Integer> generate(int teamCount, int rounds) {
        requirePositive(teamCount, "teamCount");
        if (rounds < 0) {
            throw new IllegalArgumentException("rounds não pode ser negativo");
        }

        List<Integer> sequence = new ArrayList<>(teamCount * rounds);
        for (int turn = 1; turn <= teamCount * rounds; turn++) {
            sequence.add(teamOrderForTurn(turn, teamCount));
        }
        return sequence;
    }

    /**
     * Verifica se as posições formam exatamente uma permutação de 1..N.
     */
    public static boolean isValidPermutation(List<Integer> draftOrders) {
        if (draftOrders == null || draftOrders.isEmpty()) {
            return false;
        }
        int n = draftOrders.size();
        Set<Integer> seen = new HashSet<>();
        for (Integer order : draftOrders) {
            if (order == null || order < 1 || order > n || !seen.add(order)) {
                return false;
            }
        }
        return true;
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " deve ser >= 1 (recebido " + value + ")");
        }
    }
}
