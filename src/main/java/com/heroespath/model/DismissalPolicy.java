package com.heroespath.model;

/**
 * 사용자 기본 숨김 정책
 * dismiss 호출에 기간이 없을 때 참조
 */
public enum DismissalPolicy {
    ASK,
    ALWAYS_THIRTY_DAYS,
    ALWAYS_FOREVER;

    /**
     * 정책이 정한 기간. ASK면 null (호출자에게 물어봐야 함)
     */
    public DismissDuration defaultDuration() {
        switch (this) {
            case ALWAYS_THIRTY_DAYS:
                return DismissDuration.TEMPORARY;
            case ALWAYS_FOREVER:
                return DismissDuration.FOREVER;
            default:
                return null;
        }
    }
}
