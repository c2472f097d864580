package io.atom.governor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Reactive Redis template for the Redis cache backend.
 * JSON mapping uses the application's auto-configured {@code ObjectMapper}.
 */
@Configuration
public class RedisConfig {

    public static final String TEMPLATE_BEAN = "governanceRedisTemplate";

    @Bean(TEMPLATE_BEAN)
    @ConditionalOnProperty(prefix = "governor.cache", name = "backend", havingValue = "redis")
    public ReactiveRedisTemplate<String, String> governanceRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        StringRedisSerializer serializer = new StringRedisSerializer();

        RedisSerializationContext<String, String> context = RedisSerializationContext
                .<String, String>newSerializationContext(serializer)
                .value(serializer)
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }
}
