package com.ryuqq.imagebatch.core.model;

/**
 * 배치의 단일 생성 요청.
 *
 * <p>제출 이후 변경되지 않으며, 이 항목을 처리하는 RetryOrchestrator만 참조합니다.</p>
 *
 * @param prompt 생성 프롬프트
 * @param outputTarget 결과 기록 위치
 * @param overrideConfig 항목별 설정 (null이면 배치 기본 설정 사용)
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record BatchItem(
    String prompt,
    OutputTarget outputTarget,
    ImageConfig overrideConfig
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException prompt 또는 outputTarget이 유효하지 않은 경우
     */
    public BatchItem {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        if (outputTarget == null) {
            throw new IllegalArgumentException("outputTarget cannot be null");
        }
        // overrideConfig는 null 허용
    }

    /**
     * 항목별 설정 없이 생성.
     *
     * @param prompt 생성 프롬프트
     * @param outputLocation 결과 기록 위치
     * @return BatchItem 인스턴스
     */
    public static BatchItem of(String prompt, String outputLocation) {
        return new BatchItem(prompt, OutputTarget.of(outputLocation), null);
    }

    /**
     * 실제로 적용할 설정 결정.
     *
     * @param defaultConfig 배치 기본 설정
     * @return overrideConfig가 있으면 overrideConfig, 없으면 defaultConfig
     */
    public ImageConfig effectiveConfig(ImageConfig defaultConfig) {
        return overrideConfig != null ? overrideConfig : defaultConfig;
    }
}
