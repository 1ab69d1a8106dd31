package com.rateview.config.redis;

import io.lettuce.core.ReadFrom;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisStaticMasterReplicaConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Redis 연결 설정.
 * <p>
 * 기본 템플릿은 replica 우선 읽기를, master 템플릿은 master 전용 읽기를 사용합니다.
 * 캐시 값은 문자열(JSON)로 저장되므로 key/value 모두 문자열 직렬화기를 사용합니다.
 * </p>
 */
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {
    private static final String CONNECTION_MASTER = "redisConnectionMaster";
    public static final String REDIS_TEMPLATE_MASTER = "redisTemplateMaster";
    private static final Duration COMMAND_TIMEOUT = Duration.ofMillis(500);

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    @Primary
    @Bean
    public LettuceConnectionFactory defaultRedisConnectionFactory() {
        return lettuceConnectionFactory(b -> b.readFrom(ReadFrom.REPLICA_PREFERRED));
    }

    @Qualifier(CONNECTION_MASTER)
    @Bean
    public LettuceConnectionFactory masterRedisConnectionFactory() {
        return lettuceConnectionFactory(b -> b.readFrom(ReadFrom.MASTER));
    }

    @Primary
    @Bean
    public RedisTemplate<String, String> defaultRedisTemplate(LettuceConnectionFactory lettuceConnectionFactory) {
        return stringRedisTemplate(lettuceConnectionFactory);
    }

    @Qualifier(REDIS_TEMPLATE_MASTER)
    @Bean
    public RedisTemplate<String, String> masterRedisTemplate(
        @Qualifier(CONNECTION_MASTER) LettuceConnectionFactory lettuceConnectionFactory
    ) {
        return stringRedisTemplate(lettuceConnectionFactory);
    }

    private LettuceConnectionFactory lettuceConnectionFactory(
        Consumer<LettuceClientConfiguration.LettuceClientConfigurationBuilder> customizer
    ) {
        // 캐시 계층은 느린 Redis를 기다리지 않도록 명령 타임아웃을 짧게 둡니다.
        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder = LettuceClientConfiguration.builder()
            .commandTimeout(COMMAND_TIMEOUT);
        customizer.accept(builder);

        RedisNodeInfo master = redisProperties.master();
        RedisStaticMasterReplicaConfiguration masterReplicaConfig =
            new RedisStaticMasterReplicaConfiguration(master.host(), master.port());
        masterReplicaConfig.setDatabase(redisProperties.database());
        for (RedisNodeInfo replica : redisProperties.replicas()) {
            masterReplicaConfig.addNode(replica.host(), replica.port());
        }
        return new LettuceConnectionFactory(masterReplicaConfig, builder.build());
    }

    private RedisTemplate<String, String> stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        StringRedisSerializer serializer = new StringRedisSerializer();
        template.setKeySerializer(serializer);
        template.setValueSerializer(serializer);
        template.setHashKeySerializer(serializer);
        template.setHashValueSerializer(serializer);
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
