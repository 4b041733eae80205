package com.heroespath.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 두 세대의 Places API 응답을 하나로 정규화한 장소 모델
 * placeId가 resolver 결과와 저장된 discovery 사이의 조인 키
 * 선택 필드는 기본값을 넣지 않고 null로 둔다
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StandardPlace {
    public static final String UNKNOWN_TYPE = "unknown";

    private String placeId;
    private String name;
    private String primaryCategory;
    @Builder.Default
    private List<String> types = new ArrayList<>(); // 순서 유지, 비어 있지 않음
    private GeoPoint location;
    private Double rating;
    private Long ratingCount;
    private Integer priceLevel; // 0-4 (Google 기준)
    private String address;
    @Builder.Default
    private List<String> photos = new ArrayList<>(); // 불투명 photo reference
    @Builder.Default
    private List<String> attributions = new ArrayList<>();

    // details-full 프로필에서만 채워짐
    private String website;
    private String phoneNumber;
    private Boolean openNow;
    private List<String> openingHours;
    private String editorialSummary;
    private List<String> reviewSnippets;

    private String sourceSchema; // 어떤 API 세대에서 왔는지

    @JsonIgnore
    public boolean hasValidLocation() {
        return location != null && location.isValid();
    }
}
