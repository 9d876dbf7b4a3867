package com.ryuqq.imagebatch.core.model;

import java.util.List;

/**
 * 이미지 생성 설정 (불변 record).
 *
 * <p>생성 호출 협력자에게 그대로 전달되며, 코어는 내용을 해석하지 않습니다.</p>
 *
 * @param model 생성 모델 ID
 * @param aspectRatio 종횡비
 * @param responseModalities 응답 모달리티 (예: ["Image"])
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record ImageConfig(
    String model,
    AspectRatio aspectRatio,
    List<String> responseModalities
) {

    public static final String DEFAULT_MODEL = "gemini-2.0-flash-preview-image-generation";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 누락된 경우
     */
    public ImageConfig {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (aspectRatio == null) {
            throw new IllegalArgumentException("aspectRatio cannot be null");
        }
        if (responseModalities == null || responseModalities.isEmpty()) {
            throw new IllegalArgumentException("responseModalities cannot be null or empty");
        }
        responseModalities = List.copyOf(responseModalities);
    }

    /**
     * 기본 설정 생성.
     *
     * <p>기본값: model={@value #DEFAULT_MODEL}, aspectRatio=PORTRAIT, responseModalities=[Image]</p>
     *
     * @return 기본 ImageConfig
     */
    public static ImageConfig defaults() {
        return new ImageConfig(DEFAULT_MODEL, AspectRatio.PORTRAIT, List.of("Image"));
    }

    /**
     * model만 변경한 새 인스턴스 생성.
     */
    public ImageConfig withModel(String model) {
        return new ImageConfig(model, aspectRatio, responseModalities);
    }

    /**
     * aspectRatio만 변경한 새 인스턴스 생성.
     */
    public ImageConfig withAspectRatio(AspectRatio aspectRatio) {
        return new ImageConfig(model, aspectRatio, responseModalities);
    }
}
