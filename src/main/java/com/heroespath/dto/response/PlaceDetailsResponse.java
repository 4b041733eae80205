package com.heroespath.dto.response;

import com.heroespath.model.StandardPlace;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaceDetailsResponse {
    private StandardPlace place;
    private String category;
    private String subtype;
    private List<String> photoUrls;
}
