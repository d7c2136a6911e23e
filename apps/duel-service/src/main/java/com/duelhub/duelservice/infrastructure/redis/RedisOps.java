package com.duelhub.duelservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 公用 Redis 工具类：只提供原语级方法，键名由各仓储组织。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    private final RedisTemplate<String, Object> redis;

    /**
     * 仅当不存在时写入（SETNX），带 TTL。
     * @return true 表示写入成功，false 表示键已存在
     */
    public boolean setNx(String key, Object val, Duration ttl) {
        Boolean ok = redis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    /**
     * 读取并转换为指定类型；类型不符返回 null。
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }
}
