package com.ryuqq.imagebatch.core.outcome;

/**
 * 항목 처리 결과.
 *
 * <p>Outcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 생성 성공 (종료)</li>
 *   <li>{@link Retry}: 재시도 가능한 실패, backoff 후 다시 시도</li>
 *   <li>{@link Fail}: 영구 실패 또는 재시도 소진 (종료)</li>
 *   <li>{@link Skip}: 결과물이 이미 존재하여 건너뜀 (종료)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려집니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail, Skip {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }

    default boolean isSkip() {
        return this instanceof Skip;
    }

    /**
     * 종료 결과인지 확인.
     *
     * @return Retry가 아닌 경우 true
     */
    default boolean isTerminal() {
        return !isRetry();
    }
}
