package br.com.fantasydraft.backend.util;

import java.security.SecureRandom;

public final class RoomCodeGenerator {

    // sem 0/O e 1/I para evitar confusão na leitura
    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int CODE_LENGTH = 6;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RoomCodeGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String generate() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase();
    }
}
