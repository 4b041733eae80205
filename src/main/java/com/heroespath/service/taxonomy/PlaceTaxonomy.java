package com.heroespath.service.taxonomy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 카테고리 > 서브타입 > Google 타입 태그 고정 테이블
 * 하나의 태그는 정확히 하나의 서브타입에만 속한다
 */
public final class PlaceTaxonomy {

    private static final Map<String, Map<String, List<String>>> TABLE = new LinkedHashMap<>();
    private static final Map<String, String> SUBTYPE_BY_TAG = new HashMap<>();
    private static final Map<String, String> CATEGORY_BY_SUBTYPE = new HashMap<>();

    /**
     * 여러 카테고리에 걸치는 것이 정상인 장소 (복합 건물, 식음료를 겸하는 문화/엔터테인먼트 시설,
     * 다른 서비스를 자주 겸하는 식음료 시설)
     */
    private static final Set<String> MIXED_USE_PRIMARY_TYPES = Set.of(
            // 복합 건물
            "shopping_mall", "department_store", "lodging", "hotel", "motel", "resort_hotel", "inn",
            "airport", "train_station", "convention_center", "community_center",
            // 식음료를 겸하는 문화 시설
            "museum", "art_gallery", "cultural_center", "performing_arts_theater", "concert_hall",
            // 식음료를 겸하는 엔터테인먼트 시설
            "casino", "bowling_alley", "movie_theater", "amusement_park", "stadium", "night_club",
            // 다른 서비스를 겸하는 식음료 시설
            "food_court", "brewery", "winery", "internet_cafe"
    );

    static {
        category("food_drink",
                subtype("restaurant", "restaurant", "american_restaurant", "brazilian_restaurant",
                        "chinese_restaurant", "french_restaurant", "greek_restaurant", "hamburger_restaurant",
                        "indian_restaurant", "indonesian_restaurant", "italian_restaurant", "japanese_restaurant",
                        "korean_restaurant", "lebanese_restaurant", "mediterranean_restaurant",
                        "mexican_restaurant", "middle_eastern_restaurant", "pizza_restaurant", "ramen_restaurant",
                        "seafood_restaurant", "spanish_restaurant", "steak_house", "sushi_restaurant",
                        "thai_restaurant", "turkish_restaurant", "vegan_restaurant", "vegetarian_restaurant",
                        "vietnamese_restaurant", "fast_food_restaurant", "breakfast_restaurant",
                        "brunch_restaurant", "sandwich_shop", "meal_takeaway", "meal_delivery", "food_court"),
                subtype("cafe", "cafe", "coffee_shop", "tea_house", "bakery", "ice_cream_shop", "dessert_shop",
                        "juice_shop", "donut_shop", "bagel_shop", "cafeteria", "internet_cafe"),
                subtype("bar", "bar", "pub", "wine_bar", "brewery", "winery"));
        category("shopping",
                subtype("shopping_center", "shopping_mall", "department_store", "market"),
                subtype("grocery", "grocery_store", "supermarket", "convenience_store", "liquor_store"),
                subtype("retail", "clothing_store", "shoe_store", "book_store", "electronics_store",
                        "furniture_store", "home_goods_store", "jewelry_store", "gift_shop", "hardware_store",
                        "sporting_goods_store", "pet_store", "florist"));
        category("entertainment_culture",
                subtype("museum_gallery", "museum", "art_gallery", "cultural_center", "historical_landmark"),
                subtype("performing_arts", "performing_arts_theater", "concert_hall", "movie_theater",
                        "opera_house"),
                subtype("nightlife", "night_club", "casino", "karaoke", "bowling_alley"),
                subtype("attraction", "tourist_attraction", "amusement_park", "aquarium", "zoo",
                        "visitor_center"));
        category("health_wellness",
                subtype("fitness", "gym", "fitness_center", "yoga_studio"),
                subtype("spa_wellness", "spa", "sauna", "wellness_center", "massage"),
                subtype("medical", "hospital", "doctor", "dentist", "pharmacy", "drugstore", "physiotherapist"));
        category("services_utilities",
                subtype("finance", "bank", "atm", "accounting", "insurance_agency"),
                subtype("automotive", "gas_station", "car_repair", "car_wash", "car_rental", "parking",
                        "electric_vehicle_charging_station"),
                subtype("civic", "post_office", "library", "city_hall", "courthouse", "police", "fire_station",
                        "local_government_office", "embassy", "school", "university", "community_center",
                        "convention_center"),
                subtype("personal_care", "hair_care", "beauty_salon", "barber_shop", "laundry", "nail_salon"));
        category("outdoors_recreation",
                subtype("park", "park", "dog_park", "playground", "garden", "botanical_garden", "national_park",
                        "picnic_ground"),
                subtype("nature", "hiking_area", "campground", "beach", "marina", "natural_feature"),
                subtype("sports", "stadium", "sports_complex", "golf_course", "ski_resort", "athletic_field",
                        "swimming_pool"));
        category("lodging_travel",
                subtype("lodging", "lodging", "hotel", "motel", "hostel", "resort_hotel", "inn",
                        "bed_and_breakfast", "guest_house"),
                subtype("transit", "airport", "train_station", "bus_station", "subway_station",
                        "transit_station", "light_rail_station", "taxi_stand"));
    }

    private PlaceTaxonomy() {
    }

    private static Map.Entry<String, List<String>> subtype(String name, String... tags) {
        return Map.entry(name, List.of(tags));
    }

    @SafeVarargs
    private static void category(String name, Map.Entry<String, List<String>>... subtypes) {
        Map<String, List<String>> bySubtype = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> subtype : subtypes) {
            for (String tag : subtype.getValue()) {
                String previous = SUBTYPE_BY_TAG.putIfAbsent(tag, subtype.getKey());
                if (previous != null) {
                    throw new IllegalStateException("Tag '" + tag + "' listed in both " + previous
                            + " and " + subtype.getKey());
                }
            }
            CATEGORY_BY_SUBTYPE.put(subtype.getKey(), name);
            bySubtype.put(subtype.getKey(), subtype.getValue());
        }
        TABLE.put(name, Collections.unmodifiableMap(bySubtype));
    }

    public static String subtypeOfTag(String tag) {
        return tag == null ? null : SUBTYPE_BY_TAG.get(tag);
    }

    public static String categoryOfSubtype(String subtype) {
        return subtype == null ? null : CATEGORY_BY_SUBTYPE.get(subtype);
    }

    public static String categoryOfTag(String tag) {
        return categoryOfSubtype(subtypeOfTag(tag));
    }

    public static boolean isMixedUsePrimaryType(String tag) {
        return tag != null && MIXED_USE_PRIMARY_TYPES.contains(tag);
    }

    public static boolean isGroupName(String name) {
        return TABLE.containsKey(name) || CATEGORY_BY_SUBTYPE.containsKey(name);
    }

    /**
     * 필터 이름이 허용하는 태그 목록
     * 서브타입 이름이면 그 태그들, 카테고리 이름이면 하위 서브타입 태그 전체,
     * 그 외에는 원시 태그 하나로 본다
     */
    public static List<String> allowedTagsFor(String filter) {
        if (TABLE.containsKey(filter)) {
            List<String> tags = new ArrayList<>();
            TABLE.get(filter).values().forEach(tags::addAll);
            return tags;
        }
        String category = CATEGORY_BY_SUBTYPE.get(filter);
        if (category != null) {
            return TABLE.get(category).get(filter);
        }
        return List.of(filter);
    }

    public static Map<String, Map<String, List<String>>> table() {
        return Collections.unmodifiableMap(TABLE);
    }
}
