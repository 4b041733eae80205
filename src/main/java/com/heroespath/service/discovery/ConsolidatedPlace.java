package com.heroespath.service.discovery;

import com.heroespath.model.DiscoverySource;
import com.heroespath.model.StandardPlace;
import lombok.Value;

import java.util.List;

@Value
public class ConsolidatedPlace {
    StandardPlace place;
    List<DiscoverySource> sources; // 경로 검색이 먼저
}
