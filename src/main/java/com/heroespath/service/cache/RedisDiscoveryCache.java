package com.heroespath.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Redis 캐시
 * discovery:{userId}:{routeId}:{placeId} -> Discovery JSON
 * discovery:id:{discoveryId} -> 위 키, discovery:route:{userId}:{routeId} / discovery:user:{userId} -> 키 집합
 * discovery:discovered-route:{userId}:{routeId} -> DiscoveredRoute JSON
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "discovery.cache.type", havingValue = "redis")
public class RedisDiscoveryCache implements LocalDiscoveryCache {

    private static final String PENDING_KEY = KEY_PREFIX + "pending";
    private static final String PENDING_ROUTES_KEY = KEY_PREFIX + "pending-routes";

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisDiscoveryCache(RedisTemplate<String, Object> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void put(Discovery discovery) {
        String key = LocalDiscoveryCache.keyOf(discovery);
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(discovery));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize discovery " + discovery.getDiscoveryId(), e);
        }
        redisTemplate.opsForValue().set(idKey(discovery.getDiscoveryId()), key);
        redisTemplate.opsForSet().add(routeKey(discovery.getUserId(), discovery.getRouteId()), key);
        redisTemplate.opsForSet().add(userKey(discovery.getUserId()), key);
        log.debug("[Redis] put - key: {}, status: {}", key, discovery.getStatus());
    }

    @Override
    public Optional<Discovery> findById(String discoveryId) {
        Object key = redisTemplate.opsForValue().get(idKey(discoveryId));
        if (key == null) {
            return Optional.empty();
        }
        return read(key.toString());
    }

    @Override
    public List<Discovery> findByRoute(String userId, String routeId) {
        List<Discovery> discoveries = readAll(redisTemplate.opsForSet().members(routeKey(userId, routeId)));
        discoveries.sort(Comparator.comparing(Discovery::getDiscoveredAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return discoveries;
    }

    @Override
    public List<Discovery> findByUser(String userId) {
        return readAll(redisTemplate.opsForSet().members(userKey(userId)));
    }

    @Override
    public void markPending(String discoveryId) {
        redisTemplate.opsForSet().add(PENDING_KEY, discoveryId);
    }

    @Override
    public Set<String> pendingIds() {
        Set<Object> members = redisTemplate.opsForSet().members(PENDING_KEY);
        if (members == null) {
            return Collections.emptySet();
        }
        return members.stream().map(Object::toString).collect(Collectors.toSet());
    }

    @Override
    public void clearPending(String discoveryId) {
        redisTemplate.opsForSet().remove(PENDING_KEY, discoveryId);
    }

    @Override
    public void putRoute(DiscoveredRoute route) {
        try {
            redisTemplate.opsForValue().set(discoveredRouteKey(route.storageKey()), objectMapper.writeValueAsString(route));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize discovered route " + route.storageKey(), e);
        }
    }

    @Override
    public Optional<DiscoveredRoute> findRoute(String userId, String routeId) {
        return readRoute(DiscoveredRoute.keyOf(userId, routeId));
    }

    @Override
    public void markRoutePending(DiscoveredRoute route) {
        redisTemplate.opsForSet().add(PENDING_ROUTES_KEY, route.storageKey());
    }

    @Override
    public List<DiscoveredRoute> pendingRoutes() {
        Set<Object> members = redisTemplate.opsForSet().members(PENDING_ROUTES_KEY);
        List<DiscoveredRoute> routes = new ArrayList<>();
        if (members == null) {
            return routes;
        }
        for (Object member : members) {
            readRoute(member.toString()).ifPresent(routes::add);
        }
        return routes;
    }

    @Override
    public void clearRoutePending(DiscoveredRoute route) {
        redisTemplate.opsForSet().remove(PENDING_ROUTES_KEY, route.storageKey());
    }

    private Optional<DiscoveredRoute> readRoute(String routeKey) {
        Object value = redisTemplate.opsForValue().get(discoveredRouteKey(routeKey));
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(value.toString(), DiscoveredRoute.class));
        } catch (JsonProcessingException e) {
            log.error("[Redis] readRoute - unreadable route JSON, key: {}, error: {}", routeKey, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private List<Discovery> readAll(Set<Object> keys) {
        List<Discovery> discoveries = new ArrayList<>();
        if (keys == null) {
            return discoveries;
        }
        for (Object key : keys) {
            read(key.toString()).ifPresent(discoveries::add);
        }
        return discoveries;
    }

    private Optional<Discovery> read(String key) {
        Object value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            log.warn("[Redis] read - key indexed but value missing: {}", key);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(value.toString(), Discovery.class));
        } catch (JsonProcessingException e) {
            log.error("[Redis] read - unreadable discovery JSON, key: {}, error: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String idKey(String discoveryId) {
        return KEY_PREFIX + "id:" + discoveryId;
    }

    private static String routeKey(String userId, String routeId) {
        return KEY_PREFIX + "route:" + userId + ":" + routeId;
    }

    private static String discoveredRouteKey(String routeKey) {
        return KEY_PREFIX + "discovered-route:" + routeKey;
    }

    private static String userKey(String userId) {
        return KEY_PREFIX + "user:" + userId;
    }
}
