package br.com.fantasydraft.backend.config;

import br.com.fantasydraft.backend.service.DraftEventBroadcastService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * ✅ Configuração Redis Pub/Sub
 *
 * PROBLEMA RESOLVIDO:
 * - Várias instâncias do backend, cada uma com seus próprios WebSockets
 * - Um pick confirmado na instância A precisa chegar aos clientes da instância B
 *
 * SOLUÇÃO:
 * - Todo evento de draft é publicado em draft:{draftId}
 * - Cada instância escuta draft:* e entrega para os seus assinantes locais
 */
@Slf4j
@Configuration
public class RedisPubSubConfig {

    public static final String DRAFT_CHANNEL_PREFIX = "draft:";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter draftListenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(draftListenerAdapter, new PatternTopic(DRAFT_CHANNEL_PREFIX + "*"));

        log.info("✅ [RedisPubSub] Configurado para escutar canais: draft:*");

        return container;
    }

    @Bean
    public MessageListenerAdapter draftListenerAdapter(DraftEventBroadcastService draftEventBroadcastService) {
        MessageListenerAdapter adapter = new MessageListenerAdapter(
                draftEventBroadcastService,
                "handleDraftEvent");

        // payload e canal chegam como String
        adapter.setSerializer(new StringRedisSerializer());

        log.info("✅ [RedisPubSub] Draft listener adapter criado");
        return adapter;
    }
}
