package com.dicehub.baseball.infrastructure.redis;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 连接配置（基础设施层）。
 * 会话以 JSON 字符串存储，序列化由仓储自己用 Jackson 完成，这里只需要字符串模板。
 * WATCH/MULTI/EXEC 通过 SessionCallback 在同一连接上执行。
 */
@Configuration
@ConditionalOnProperty(name = "baseball.store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        StringRedisTemplate tpl = new StringRedisTemplate(factory);
        tpl.afterPropertiesSet();
        return tpl;
    }
}
