package com.ryuqq.imagebatch.core.outcome;

import com.ryuqq.imagebatch.core.model.ImageResult;

/**
 * 성공 결과.
 *
 * @param result 생성 결과
 * @param attempts 성공까지 걸린 시도 횟수 (1 이상)
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record Ok(
    ImageResult result,
    int attempts
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException result가 null이거나 attempts가 양수가 아닌 경우
     */
    public Ok {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}
