package com.ryuqq.imagebatch.application.batch;

import com.ryuqq.imagebatch.core.model.AspectRatio;
import com.ryuqq.imagebatch.core.model.ImageConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchConfig 테스트.
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
class BatchConfigTest {

    @Test
    @DisplayName("기본 생성자는 문서화된 기본값을 사용한다")
    void 기본값() {
        BatchConfig config = new BatchConfig();

        assertThat(config.maxConcurrency()).isEqualTo(15);
        assertThat(config.rpmLimit()).isEqualTo(50);
        assertThat(config.skipExisting()).isTrue();
        assertThat(config.maxRetries()).isEqualTo(5);
        assertThat(config.baseDelayMs()).isEqualTo(2000);
        assertThat(config.minConcurrency()).isEqualTo(2);
        assertThat(config.initialConcurrencyCap()).isEqualTo(8);
        assertThat(config.pollIntervalMs()).isEqualTo(100);
        assertThat(config.defaultImageConfig()).isEqualTo(ImageConfig.defaults());
    }

    @Test
    void 환경변수에서_로드() {
        Map<String, String> env = Map.of(
            BatchConfig.ENV_MAX_CONCURRENT, "4",
            BatchConfig.ENV_RPM_LIMIT, " 20 ",
            BatchConfig.ENV_MODEL, "custom-image-model"
        );

        BatchConfig config = BatchConfig.fromEnvironment(env);

        assertThat(config.maxConcurrency()).isEqualTo(4);
        assertThat(config.rpmLimit()).isEqualTo(20);
        assertThat(config.defaultImageConfig().model()).isEqualTo("custom-image-model");
        assertThat(config.defaultImageConfig().aspectRatio()).isEqualTo(AspectRatio.PORTRAIT);
    }

    @Test
    void 환경변수가_없으면_기본값() {
        assertThat(BatchConfig.fromEnvironment(Map.of())).isEqualTo(new BatchConfig());
    }

    @Test
    void 숫자가_아닌_환경변수는_예외() {
        assertThatThrownBy(() -> BatchConfig.fromEnvironment(Map.of(BatchConfig.ENV_RPM_LIMIT, "fifty")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("RPM_LIMIT must be an integer");
    }

    @Test
    void 양수가_아닌_값은_예외() {
        BatchConfig config = new BatchConfig();

        assertThatThrownBy(() -> config.withMaxConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxConcurrency must be positive");
        assertThatThrownBy(() -> config.withRpmLimit(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withMaxRetries(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withPollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withBaseDelayMs는_maxDelay를_함께_올린다() {
        BatchConfig config = new BatchConfig().withBaseDelayMs(600_000);

        assertThat(config.baseDelayMs()).isEqualTo(600_000);
        assertThat(config.maxDelayMs()).isEqualTo(600_000);
    }

    @Test
    void with_메서드는_다른_필드를_보존한다() {
        BatchConfig config = new BatchConfig().withSkipExisting(false).withMaxRetries(3);

        assertThat(config.skipExisting()).isFalse();
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.rpmLimit()).isEqualTo(50);
    }
}
