package com.heroespath.service.ping;

import com.heroespath.model.StandardPlace;

import java.util.List;

/**
 * 경로 최초 탐색 때 합칠 ping 결과
 * 저장소 장애는 DataAccessException으로 드러난다
 */
public interface PingPlacesSource {

    /**
     * 경로에 저장된 ping 결과의 장소들 (ping 순서, 중복 포함)
     */
    List<StandardPlace> placesForRoute(String userId, String routeId);

    /**
     * 합치기가 끝난 ping 결과 정리
     * @return 삭제된 ping 건수
     */
    long archive(String userId, String routeId);
}
