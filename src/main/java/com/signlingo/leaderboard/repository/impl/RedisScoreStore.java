package com.signlingo.leaderboard.repository.impl;

import com.signlingo.leaderboard.exception.StoreException;
import com.signlingo.leaderboard.model.ScoreRecord;
import com.signlingo.leaderboard.repository.ScoreStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Score store over a Redis key layout maintained by the progress collaborator:
 * <ul>
 *   <li>{@code leaderboard:order} sorted set. Member {@code <created_at epoch micros, 16 digits>:<id>},
 *       score {@code -score}, so an ascending ZRANGE walks the ranking order.</li>
 *   <li>{@code leaderboard:distinct-scores} sorted set holding each score value in use once.</li>
 *   <li>{@code leaderboard:user:<id>} hash with {@code username}, {@code avatar}, {@code score}
 *       and {@code created_at} (ISO-8601).</li>
 * </ul>
 * This class never writes to Redis.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.store.type", havingValue = "redis")
public class RedisScoreStore implements ScoreStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisScoreStore.class);

    static final String ORDER_KEY = "leaderboard:order";
    static final String DISTINCT_SCORES_KEY = "leaderboard:distinct-scores";
    static final String USER_KEY_PREFIX = "leaderboard:user:";
    static final int CREATED_AT_WIDTH = 16;

    private JedisPool jedisPool;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    public RedisScoreStore() {
    }

    RedisScoreStore(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
    }

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(128);
            poolConfig.setMaxIdle(32);
            poolConfig.setMinIdle(8);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout)
                .ssl(redisSsl);
            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                logger.info("Connected to Redis score store at {}:{}{}", redisHost, redisPort,
                    redisSsl ? " (SSL enabled)" : "");
            }
        } catch (JedisException e) {
            // the pool stays open; queries fail with StoreException until Redis is reachable
            logger.error("Failed to connect to Redis score store at {}:{}", redisHost, redisPort, e);
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public List<ScoreRecord> fetchPage(long offset, int limit) {
        try (Jedis jedis = borrow()) {
            List<String> members = jedis.zrange(ORDER_KEY, offset, offset + limit - 1);
            if (members.isEmpty()) {
                return List.of();
            }

            Pipeline pipeline = jedis.pipelined();
            List<Response<Map<String, String>>> hashes = new ArrayList<>(members.size());
            for (String member : members) {
                hashes.add(pipeline.hgetAll(USER_KEY_PREFIX + idFromMember(member)));
            }
            pipeline.sync();

            List<ScoreRecord> page = new ArrayList<>(members.size());
            for (int i = 0; i < members.size(); i++) {
                String id = idFromMember(members.get(i));
                Map<String, String> fields = hashes.get(i).get();
                if (fields == null || fields.isEmpty()) {
                    throw new StoreException("Ranking order references user " + id + " without a user hash");
                }
                page.add(toRecord(id, fields));
            }
            return page;
        } catch (JedisException e) {
            throw new StoreException("Failed to fetch score page at offset " + offset + " from Redis", e);
        }
    }

    @Override
    public Optional<ScoreRecord> fetchById(String id) {
        try (Jedis jedis = borrow()) {
            Map<String, String> fields = jedis.hgetAll(USER_KEY_PREFIX + id);
            if (fields == null || fields.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(toRecord(id, fields));
        } catch (JedisException e) {
            throw new StoreException("Failed to fetch score record " + id + " from Redis", e);
        }
    }

    @Override
    public long countDistinctScoresGreaterThan(long score) {
        try (Jedis jedis = borrow()) {
            return jedis.zcount(DISTINCT_SCORES_KEY, "(" + score, "+inf");
        } catch (JedisException e) {
            throw new StoreException("Failed to count distinct scores above " + score + " in Redis", e);
        }
    }

    private Jedis borrow() {
        if (jedisPool == null || jedisPool.isClosed()) {
            throw new StoreException("Redis score store is not initialized");
        }
        return jedisPool.getResource();
    }

    static String orderMember(Instant createdAt, String id) {
        long micros = Math.multiplyExact(createdAt.getEpochSecond(), 1_000_000L) + createdAt.getNano() / 1_000;
        return String.format("%0" + CREATED_AT_WIDTH + "d:%s", micros, id);
    }

    static String idFromMember(String member) {
        if (member.length() <= CREATED_AT_WIDTH || member.charAt(CREATED_AT_WIDTH) != ':') {
            throw new StoreException("Malformed ranking member in Redis: " + member);
        }
        return member.substring(CREATED_AT_WIDTH + 1);
    }

    private ScoreRecord toRecord(String id, Map<String, String> fields) {
        String createdAt = fields.get("created_at");
        if (createdAt == null) {
            throw new StoreException("User hash in Redis has no created_at for user " + id);
        }
        try {
            String avatar = fields.get("avatar");
            return ScoreRecord.builder()
                .id(id)
                .username(fields.get("username"))
                .avatar(avatar == null || avatar.isEmpty() ? null : avatar)
                .score(Long.parseLong(fields.getOrDefault("score", "0")))
                .createdAt(Instant.parse(createdAt))
                .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new StoreException("Malformed user hash in Redis for user " + id, e);
        }
    }
}
