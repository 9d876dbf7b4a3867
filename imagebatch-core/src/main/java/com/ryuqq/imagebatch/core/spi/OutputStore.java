package com.ryuqq.imagebatch.core.spi;

import com.ryuqq.imagebatch.core.model.OutputTarget;

/**
 * 결과물 존재 여부 조회 SPI.
 *
 * <p>skip-existing 처리에만 사용됩니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OutputStore {

    /**
     * 결과물이 이미 존재하는지 확인.
     *
     * @param outputTarget 결과 위치
     * @return 존재하면 true
     */
    boolean exists(OutputTarget outputTarget);
}
