package com.ryuqq.imagebatch.core.outcome;

import com.ryuqq.imagebatch.core.model.OutputTarget;

/**
 * 결과물이 이미 존재하여 건너뛴 항목.
 *
 * <p>건너뛴 항목은 어떤 limiter도 획득하지 않으며 생성 협력자를 호출하지 않습니다.</p>
 *
 * @param target 이미 존재하는 결과 위치
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record Skip(OutputTarget target) implements Outcome {

    public Skip {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }
}
