package com.heroespath.service.places;

/**
 * 전략 한 개의 호출 결과. 실패도 예외가 아닌 값으로 돌려준다
 */
public final class LookupResult<T> {

    private final String generation;
    private final T value;
    private final String error;
    private final boolean emptyAnswer;

    private LookupResult(String generation, T value, String error, boolean emptyAnswer) {
        this.generation = generation;
        this.value = value;
        this.error = error;
        this.emptyAnswer = emptyAnswer;
    }

    public static <T> LookupResult<T> success(String generation, T value) {
        return new LookupResult<>(generation, value, null, false);
    }

    public static <T> LookupResult<T> failure(String generation, String error) {
        return new LookupResult<>(generation, null, error, false);
    }

    /**
     * 응답은 왔지만 결과 필드가 없는 경우 (v1의 0건 응답 "{}").
     * 다음 전략이 있으면 실패로 보고 넘어가고, 마지막 전략이면 emptyValue를 결과로 쓴다
     */
    public static <T> LookupResult<T> emptyAnswer(String generation, T emptyValue, String error) {
        return new LookupResult<>(generation, emptyValue, error, true);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getGeneration() {
        return generation;
    }

    public T getValue() {
        return value;
    }

    public boolean isEmptyAnswer() {
        return emptyAnswer;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? generation + ": ok" : generation + ": " + error;
    }
}
