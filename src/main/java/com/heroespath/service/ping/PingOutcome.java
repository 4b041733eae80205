package com.heroespath.service.ping;

public enum PingOutcome {
    FOUND,
    COOLDOWN,
    NO_CREDITS,
    NO_ENABLED_TYPES, // 크레딧을 쓰지 않는다
    PLACES_UNAVAILABLE // 모든 검색이 실패, 크레딧을 쓰지 않는다
}
