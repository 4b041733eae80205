package com.heroespath.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SummaryRequest {
    private String summaryData; // 외부에서 생성한 요약 (불투명 JSON 문자열)
}
