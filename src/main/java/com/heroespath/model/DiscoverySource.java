package com.heroespath.model;

/**
 * 장소를 찾은 경로. ROUTE = 산책 후 경로 검색, PING = 산책 중 ping
 */
public enum DiscoverySource {
    ROUTE,
    PING
}
