package com.heroespath.dto.request;

import com.heroespath.model.DismissalPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettingsRequest {
    private DismissalPolicy dismissalPolicy;
    private List<String> enabledTypes; // 빈 목록이면 모든 타입을 끈다
    private Double minRating;
}
