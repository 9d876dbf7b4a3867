package com.ryuqq.imagebatch.core.spi;

import com.ryuqq.imagebatch.core.error.GenerationException;
import com.ryuqq.imagebatch.core.model.ImageConfig;
import com.ryuqq.imagebatch.core.model.ImageResult;
import com.ryuqq.imagebatch.core.model.OutputTarget;

/**
 * 이미지 생성 협력자 SPI.
 *
 * <p>외부 생성 서비스를 호출하고 결과를 outputTarget에 기록합니다.
 * 요청 구성, 응답 디코딩, 파일 쓰기는 모두 구현체의 책임입니다.</p>
 *
 * <p><strong>실패 분류 계약:</strong></p>
 * <ul>
 *   <li>할당량 초과 → {@code ErrorKind.RATE_LIMITED}</li>
 *   <li>일시적 서버 과부하 → {@code ErrorKind.SERVICE_OVERLOADED}</li>
 *   <li>그 밖의 모든 실패 → {@code ErrorKind.OTHER}</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 여러 스레드에서 동시에 호출되므로 thread-safe해야 합니다.
 * 호출은 블로킹일 수 있으며, 호출 스레드는 항목 전용 워커 스레드입니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ImageGenerator {

    /**
     * 이미지 생성.
     *
     * @param prompt 생성 프롬프트
     * @param outputTarget 결과 기록 위치
     * @param config 적용할 생성 설정
     * @return 생성 결과
     * @throws GenerationException 분류된 생성 실패
     * @throws InterruptedException 호출 중 인터럽트 발생 시 (배치 취소)
     */
    ImageResult generate(String prompt, OutputTarget outputTarget, ImageConfig config)
        throws GenerationException, InterruptedException;
}
