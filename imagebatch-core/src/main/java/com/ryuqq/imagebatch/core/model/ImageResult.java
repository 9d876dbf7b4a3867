package com.ryuqq.imagebatch.core.model;

/**
 * 성공한 생성 호출의 결과.
 *
 * @param target 기록된 위치
 * @param width 이미지 너비 (픽셀)
 * @param height 이미지 높이 (픽셀)
 * @param prompt 사용된 프롬프트
 * @param generationTimeMs 생성 소요 시간 (밀리초)
 * @param model 사용된 모델
 * @param aspectRatio 사용된 종횡비
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record ImageResult(
    OutputTarget target,
    int width,
    int height,
    String prompt,
    long generationTimeMs,
    String model,
    AspectRatio aspectRatio
) {

    public ImageResult {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                "dimensions must be non-negative (current: " + width + "x" + height + ")");
        }
        if (generationTimeMs < 0) {
            throw new IllegalArgumentException(
                "generationTimeMs must be non-negative (current: " + generationTimeMs + ")");
        }
    }
}
