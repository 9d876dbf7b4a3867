package com.ryuqq.imagebatch.application.batch;

import com.ryuqq.imagebatch.core.model.ImageConfig;

import java.util.Map;

/**
 * 배치 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrency: 허용 최대 동시 호출 수 (기본 15)</li>
 *   <li>rpmLimit: 분당 최대 요청 수 (기본 50)</li>
 *   <li>skipExisting: 결과물이 이미 있으면 건너뛰기 (기본 true)</li>
 *   <li>maxRetries: 항목당 최대 시도 횟수 (기본 5)</li>
 *   <li>baseDelayMs: backoff 기본 지연 (기본 2000ms, attempt마다 2배)</li>
 *   <li>maxDelayMs: backoff 최대 지연 (기본 300000ms)</li>
 *   <li>minConcurrency: 동시성 윈도우 하한 (기본 2)</li>
 *   <li>initialConcurrencyCap: 초기 윈도우 상한 (기본 8)</li>
 *   <li>pollIntervalMs: RPM 용량 재확인 간격 (기본 100ms)</li>
 *   <li>defaultImageConfig: 항목별 설정이 없을 때 사용할 생성 설정</li>
 *   <li>maxWorkerThreads: 항목 워커 스레드 상한 (기본 64)</li>
 * </ul>
 *
 * <p><strong>환경 변수 ({@link #fromEnvironment(Map)}):</strong></p>
 * <ul>
 *   <li>MAX_CONCURRENT → maxConcurrency</li>
 *   <li>RPM_LIMIT → rpmLimit</li>
 *   <li>GEMINI_MODEL → defaultImageConfig.model</li>
 * </ul>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 * @param maxConcurrency 허용 최대 동시 호출 수 (1 이상)
 * @param rpmLimit 분당 최대 요청 수 (1 이상)
 * @param skipExisting 결과물 존재 시 건너뛰기 여부
 * @param maxRetries 항목당 최대 시도 횟수 (1 이상)
 * @param baseDelayMs backoff 기본 지연 (밀리초, 양수)
 * @param maxDelayMs backoff 최대 지연 (밀리초, baseDelayMs 이상)
 * @param minConcurrency 동시성 윈도우 하한 (1 이상)
 * @param initialConcurrencyCap 초기 윈도우 상한 (1 이상)
 * @param pollIntervalMs RPM 용량 재확인 간격 (밀리초, 양수)
 * @param defaultImageConfig 기본 생성 설정
 * @param maxWorkerThreads 항목 워커 스레드 상한 (1 이상)
 */
public record BatchConfig(
    int maxConcurrency,
    int rpmLimit,
    boolean skipExisting,
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    int minConcurrency,
    int initialConcurrencyCap,
    long pollIntervalMs,
    ImageConfig defaultImageConfig,
    int maxWorkerThreads
) {

    public static final String ENV_MAX_CONCURRENT = "MAX_CONCURRENT";
    public static final String ENV_RPM_LIMIT = "RPM_LIMIT";
    public static final String ENV_MODEL = "GEMINI_MODEL";

    /**
     * 기본 설정 생성자.
     */
    public BatchConfig() {
        this(15, 50, true, 5, 2000, 300_000, 2, 8, 100, ImageConfig.defaults(), 64);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive (current: " + maxConcurrency + ")");
        }
        if (rpmLimit <= 0) {
            throw new IllegalArgumentException("rpmLimit must be positive (current: " + rpmLimit + ")");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (minConcurrency <= 0) {
            throw new IllegalArgumentException("minConcurrency must be positive (current: " + minConcurrency + ")");
        }
        if (initialConcurrencyCap <= 0) {
            throw new IllegalArgumentException(
                "initialConcurrencyCap must be positive (current: " + initialConcurrencyCap + ")");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
        if (defaultImageConfig == null) {
            throw new IllegalArgumentException("defaultImageConfig cannot be null");
        }
        if (maxWorkerThreads <= 0) {
            throw new IllegalArgumentException("maxWorkerThreads must be positive (current: " + maxWorkerThreads + ")");
        }
    }

    /**
     * 환경 변수에서 설정 로드.
     *
     * <p>값이 없는 변수는 기본값을 사용합니다.</p>
     *
     * @param env 환경 변수 맵
     * @return BatchConfig
     * @throws IllegalArgumentException 숫자가 아닌 값이 지정된 경우
     */
    public static BatchConfig fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        BatchConfig config = new BatchConfig();
        String maxConcurrent = env.get(ENV_MAX_CONCURRENT);
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            config = config.withMaxConcurrency(parseInt(ENV_MAX_CONCURRENT, maxConcurrent));
        }
        String rpmLimit = env.get(ENV_RPM_LIMIT);
        if (rpmLimit != null && !rpmLimit.isBlank()) {
            config = config.withRpmLimit(parseInt(ENV_RPM_LIMIT, rpmLimit));
        }
        String model = env.get(ENV_MODEL);
        if (model != null && !model.isBlank()) {
            config = config.withDefaultImageConfig(config.defaultImageConfig().withModel(model.trim()));
        }
        return config;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer (current: " + value + ")", e);
        }
    }

    /**
     * maxConcurrency만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxConcurrency(int maxConcurrency) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }

    /**
     * rpmLimit만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withRpmLimit(int rpmLimit) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }

    /**
     * skipExisting만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withSkipExisting(boolean skipExisting) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxRetries(int maxRetries) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성 (maxDelayMs는 필요 시 함께 올림).
     */
    public BatchConfig withBaseDelayMs(long baseDelayMs) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs,
            Math.max(maxDelayMs, baseDelayMs), minConcurrency, initialConcurrencyCap, pollIntervalMs,
            defaultImageConfig, maxWorkerThreads);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withPollIntervalMs(long pollIntervalMs) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }

    /**
     * defaultImageConfig만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withDefaultImageConfig(ImageConfig defaultImageConfig) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }

    /**
     * maxWorkerThreads만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxWorkerThreads(int maxWorkerThreads) {
        return new BatchConfig(maxConcurrency, rpmLimit, skipExisting, maxRetries, baseDelayMs, maxDelayMs,
            minConcurrency, initialConcurrencyCap, pollIntervalMs, defaultImageConfig, maxWorkerThreads);
    }
}
