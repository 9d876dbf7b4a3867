package com.ryuqq.imagebatch.core.model;

/**
 * 지원하는 이미지 종횡비.
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public enum AspectRatio {

    PORTRAIT("2:3"),
    LANDSCAPE("3:2"),
    SQUARE("1:1"),
    WIDE("16:9"),
    TALL("9:16");

    private final String value;

    AspectRatio(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
