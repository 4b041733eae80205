package com.heroespath.service.places;

import com.heroespath.model.StandardPlace;

import java.util.List;

/**
 * Places API 한 세대에 대한 어댑터
 * 전송 오류, 2xx가 아닌 응답, 비었거나 깨진 본문은 모두 failure로 돌려준다
 */
public interface PlacesLookupStrategy {

    /** 설정의 전략 순서에 쓰이는 이름 (current, legacy) */
    String generation();

    LookupResult<List<StandardPlace>> nearby(NearbyQuery query);

    LookupResult<StandardPlace> details(String placeId, String language, FieldProfile profile);
}
