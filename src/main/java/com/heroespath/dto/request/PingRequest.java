package com.heroespath.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 산책 중 현재 위치
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PingRequest {
    private Double lat;
    private Double lng;
    private String language = "en";
}
