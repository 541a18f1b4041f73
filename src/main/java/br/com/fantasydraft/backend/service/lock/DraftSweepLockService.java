package br.com.fantasydraft.backend.service.lock;

import br.com.fantasydraft.backend.config.properties.DraftProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

/**
 * ✅ Lease distribuído da varredura de timers
 *
 * Várias instâncias rodam o mesmo @Scheduled; o SETNX com TTL deixa uma só
 * varrer por tick. A corretude não depende do lease: turnos e leilões já são
 * protegidos pelos CAS no banco, então Redis fora do ar libera a varredura.
 *
 * CHAVES REDIS:
 * - lock:draft:sweep → dono atual do lease (token da instância)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftSweepLockService {

    static final String SWEEP_LOCK_KEY = "lock:draft:sweep";

    private final RedisTemplate<String, Object> redisTemplate;
    private final DraftProperties draftProperties;

    private final String instanceToken = UUID.randomUUID().toString();

    public boolean acquireSweepLock() {
        try {
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(SWEEP_LOCK_KEY, instanceToken,
                            Duration.ofMillis(draftProperties.getSweep().getLockTtlMs()));

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("🔒 [SweepLock] Lease adquirido");
                return true;
            }
            log.debug("⏭️ [SweepLock] Lease com outra instância");
            return false;

        } catch (Exception e) {
            log.warn("⚠️ [SweepLock] Redis indisponível, varrendo sem lease: {}", e.getMessage());
            return true;
        }
    }

    /**
     * Libera o lease só se ele ainda for desta instância.
     */
    public void releaseSweepLock() {
        try {
            Object owner = redisTemplate.opsForValue().get(SWEEP_LOCK_KEY);
            if (instanceToken.equals(owner)) {
                redisTemplate.delete(SWEEP_LOCK_KEY);
                log.debug("🔓 [SweepLock] Lease liberado");
            } else {
                log.debug("⚠️ [SweepLock] Lease já expirou ou pertence a outra instância");
            }
        } catch (Exception e) {
            log.error("❌ [SweepLock] Erro ao liberar lease", e);
        }
    }

    String getInstanceToken() {
        return instanceToken;
    }
}
