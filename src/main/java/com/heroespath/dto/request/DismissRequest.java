package com.heroespath.dto.request;

import com.heroespath.model.DismissDuration;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DismissRequest {
    private DismissDuration duration; // null이면 사용자 숨김 정책
}
