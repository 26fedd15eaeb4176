/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.consistency.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.consistency.config.ConsistencyEngineAutoConfiguration;
import com.firefly.consistency.saga.SagaStateStore;
import com.firefly.consistency.serialization.JacksonEventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Auto-configuration for Redis-based saga state.
 * <p>
 * Only loaded when the Redis classes are on the classpath and
 * {@code firefly.consistency.redis.enabled=true}. Runs before
 * {@link ConsistencyEngineAutoConfiguration} so the in-memory saga store backs off.
 * An application {@link ReactiveRedisConnectionFactory} is reused when present.
 */
@AutoConfiguration(before = ConsistencyEngineAutoConfiguration.class, after = RedisReactiveAutoConfiguration.class)
@EnableConfigurationProperties(RedisStoreProperties.class)
@ConditionalOnClass({ReactiveRedisTemplate.class, LettuceConnectionFactory.class})
@ConditionalOnProperty(name = "firefly.consistency.redis.enabled", havingValue = "true")
public class RedisConsistencyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RedisConsistencyAutoConfiguration.class);

    /**
     * Lettuce connection factory for the saga store.
     * Only created when the application does not provide a reactive connection factory.
     */
    @Bean
    @ConditionalOnMissingBean(ReactiveRedisConnectionFactory.class)
    public LettuceConnectionFactory consistencyRedisConnectionFactory(RedisStoreProperties properties) {
        log.info("Configuring Redis connection factory for saga state: {}:{}",
                properties.getHost(), properties.getPort());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(properties.getHost(), properties.getPort());
        standalone.setDatabase(properties.getDatabase());
        if (properties.getPassword() != null) {
            standalone.setPassword(RedisPassword.of(properties.getPassword()));
        }
        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone);
        factory.setValidateConnection(true);
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(name = "consistencyRedisTemplate")
    public ReactiveRedisTemplate<String, byte[]> consistencyRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        log.debug("Configuring reactive Redis template for saga state");

        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext()
                .key(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .value(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .hashKey(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .hashValue(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    @ConditionalOnMissingBean(SagaStateStore.class)
    public RedisSagaStateStore redisSagaStateStore(
            @Qualifier("consistencyRedisTemplate") ReactiveRedisOperations<String, byte[]> redisTemplate,
            RedisStoreProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {

        log.info("Configuring Redis saga state store with key prefix: {}", properties.getKeyPrefix());

        return new RedisSagaStateStore(redisTemplate,
                objectMapper.getIfUnique(JacksonEventSerializer::defaultObjectMapper),
                properties.getKeyPrefix(),
                properties.getTerminalTtl());
    }
}
