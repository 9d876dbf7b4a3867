package com.ryuqq.imagebatch.core.error;

/**
 * 생성 호출 실패.
 *
 * <p>전송 계층 신호(HTTP 상태 코드 등)를 {@link ErrorKind}로 분류하는 책임은
 * 예외를 던지는 협력자에게 있습니다. 코어는 메시지 문자열을 해석하지 않습니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public class GenerationException extends Exception {

    private final ErrorKind kind;

    public GenerationException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    /**
     * 생성자.
     *
     * @param kind 실패 종류
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public GenerationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public static GenerationException rateLimited(String message) {
        return new GenerationException(ErrorKind.RATE_LIMITED, message);
    }

    public static GenerationException overloaded(String message) {
        return new GenerationException(ErrorKind.SERVICE_OVERLOADED, message);
    }

    public static GenerationException other(String message, Throwable cause) {
        return new GenerationException(ErrorKind.OTHER, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
