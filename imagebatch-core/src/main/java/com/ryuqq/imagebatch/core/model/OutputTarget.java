package com.ryuqq.imagebatch.core.model;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 생성 결과가 기록될 대상 위치.
 *
 * <p>파일 경로 문자열을 감싸는 값 객체입니다. 실제 존재 여부 판단은
 * {@link com.ryuqq.imagebatch.core.spi.OutputStore}가 담당합니다.</p>
 *
 * @param location 대상 위치 (예: output/batch/dragon.png)
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record OutputTarget(String location) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException location이 null이거나 빈 문자열인 경우
     */
    public OutputTarget {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
    }

    /**
     * OutputTarget 생성.
     *
     * @param location 대상 위치
     * @return OutputTarget 인스턴스
     */
    public static OutputTarget of(String location) {
        return new OutputTarget(location);
    }

    /**
     * Path로부터 OutputTarget 생성.
     *
     * @param path 대상 경로
     * @return OutputTarget 인스턴스
     * @throws IllegalArgumentException path가 null인 경우
     */
    public static OutputTarget of(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        return new OutputTarget(path.toString());
    }

    /**
     * 로그 식별용 이름 (마지막 경로 요소).
     *
     * <p>경로로 해석하지 않고 문자열에서 잘라내므로, 파일 시스템이 거부하는 location에서도 실패하지 않습니다.</p>
     *
     * @return 파일 이름 (마지막 요소가 비어 있으면 location 전체)
     */
    public String name() {
        int end = location.length();
        while (end > 0 && isSeparator(location.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && !isSeparator(location.charAt(start - 1))) {
            start--;
        }
        return start == end ? location : location.substring(start, end);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    public Path toPath() {
        return Paths.get(location);
    }

    @Override
    public String toString() {
        return location;
    }
}
