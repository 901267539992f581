package com.slb.fleet_backend.common.service;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class RedisService {

    // 仅当 value 仍是自己的 token 时才删除，避免误删他人续上的租约
    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * 将一个键值对存入 Redis，并设置有效期。
     * @param key 键
     * @param value 值
     * @param ttl 有效期
     */
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    /**
     * 读取键值；键不存在或已过期返回 null。
     */
    public String get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    /**
     * 检查指定的键是否存在于 Redis 中。
     * @param key 键
     * @return 如果存在返回 true
     */
    public boolean hasKey(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    /**
     * 短租约（SET NX PX）。拿到返回 true；租约到期自动释放，进程崩溃也不会永久占用。
     */
    public boolean tryAcquireLease(String key, String token, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, token, ttl));
    }

    public boolean releaseLease(String key, String token) {
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), token);
        return deleted != null && deleted > 0;
    }
}
