package com.ryuqq.imagebatch.adapter.runner;

import com.ryuqq.imagebatch.application.stats.RunStats;
import com.ryuqq.imagebatch.application.stats.RunStatsCollector;
import com.ryuqq.imagebatch.core.error.ErrorKind;
import com.ryuqq.imagebatch.core.error.GenerationException;
import com.ryuqq.imagebatch.core.model.AspectRatio;
import com.ryuqq.imagebatch.core.model.BatchItem;
import com.ryuqq.imagebatch.core.model.ImageConfig;
import com.ryuqq.imagebatch.core.model.ImageResult;
import com.ryuqq.imagebatch.core.model.OutputTarget;
import com.ryuqq.imagebatch.core.outcome.Fail;
import com.ryuqq.imagebatch.core.outcome.Ok;
import com.ryuqq.imagebatch.core.outcome.Outcome;
import com.ryuqq.imagebatch.core.outcome.Skip;
import com.ryuqq.imagebatch.core.protection.ConcurrencyLimiter;
import com.ryuqq.imagebatch.core.protection.RateLimiter;
import com.ryuqq.imagebatch.core.spi.ImageGenerator;
import com.ryuqq.imagebatch.core.spi.OutputStore;
import com.ryuqq.imagebatch.core.statemachine.ItemState;
import com.ryuqq.imagebatch.testkit.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RetryOrchestrator 유닛 테스트.
 *
 * <ul>
 *   <li>Skip: 기존 결과물이 있으면 limiter를 건드리지 않음</li>
 *   <li>Retry: RATE_LIMITED / SERVICE_OVERLOADED는 지수 backoff 후 재시도</li>
 *   <li>Fail: OTHER는 즉시 실패, 재시도 소진 시 실패</li>
 *   <li>permit 반납: 모든 경로에서 acquire 횟수 = release 횟수</li>
 * </ul>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryOrchestratorTest {

    private static final String PROMPT = "a red fox in snow";
    private static final OutputTarget TARGET = OutputTarget.of("out/fox.png");

    @Mock
    private ConcurrencyLimiter concurrencyLimiter;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private ImageGenerator generator;

    @Mock
    private OutputStore outputStore;

    private RunStatsCollector stats;
    private RecordingSleeper sleeper;
    private BatchItem item;

    @BeforeEach
    void setUp() {
        stats = new RunStatsCollector(1);
        sleeper = RecordingSleeper.recording();
        item = new BatchItem(PROMPT, TARGET, null);
    }

    private BatchContext context(boolean skipExisting) {
        return new BatchContext(
            concurrencyLimiter,
            rateLimiter,
            generator,
            outputStore,
            stats,
            new BackoffCalculator(),
            sleeper,
            5,
            skipExisting,
            ImageConfig.defaults()
        );
    }

    private static ImageResult result() {
        return new ImageResult(TARGET, 832, 1248, PROMPT, 900, ImageConfig.DEFAULT_MODEL, AspectRatio.PORTRAIT);
    }

    // ============================================================
    // 1. Skip
    // ============================================================

    @Test
    void 결과물이_이미_있으면_SKIPPED_limiter_미사용() {
        // given
        when(outputStore.exists(TARGET)).thenReturn(true);
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isEqualTo(new Skip(TARGET));
        assertThat(orchestrator.getState()).isEqualTo(ItemState.SKIPPED);
        assertThat(stats.snapshot()).isEqualTo(new RunStats(1, 0, 0, 1, 0));
        verifyNoInteractions(concurrencyLimiter, rateLimiter, generator);
    }

    @Test
    void skipExisting이_false면_존재_확인을_하지_않는다() throws Exception {
        // given
        when(generator.generate(any(), any(), any())).thenReturn(result());
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(false));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome.isOk()).isTrue();
        verifyNoInteractions(outputStore);
    }

    // ============================================================
    // 2. 재시도
    // ============================================================

    @Test
    void RATE_LIMITED_4회_후_성공() throws Exception {
        // given
        GenerationException limited = GenerationException.rateLimited("429 RESOURCE_EXHAUSTED");
        when(generator.generate(eq(PROMPT), eq(TARGET), any()))
            .thenThrow(limited, limited, limited, limited)
            .thenReturn(result());
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(((Ok) outcome).attempts()).isEqualTo(5);
        assertThat(orchestrator.getState()).isEqualTo(ItemState.SUCCESS);
        assertThat(sleeper.getSleeps()).containsExactly(2000L, 4000L, 8000L, 16000L);
        assertThat(stats.snapshot()).isEqualTo(new RunStats(1, 1, 0, 0, 4));

        verify(concurrencyLimiter, times(4)).reportRateLimited();
        verify(concurrencyLimiter, times(1)).reportSuccess();
        verify(concurrencyLimiter, times(5)).acquire();
        verify(concurrencyLimiter, times(5)).release();
        verify(rateLimiter, times(5)).acquire();
    }

    @Test
    void 동시성_permit을_먼저_얻고_RPM_토큰을_얻는다() throws Exception {
        // given
        when(generator.generate(any(), any(), any())).thenReturn(result());
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        orchestrator.call();

        // then
        InOrder inOrder = inOrder(concurrencyLimiter, rateLimiter, generator);
        inOrder.verify(concurrencyLimiter).acquire();
        inOrder.verify(rateLimiter).acquire();
        inOrder.verify(generator).generate(any(), any(), any());
        inOrder.verify(concurrencyLimiter).reportSuccess();
        inOrder.verify(concurrencyLimiter).release();
    }

    @Test
    void RATE_LIMITED_소진_시_시도마다_rateLimited_집계() throws Exception {
        // given
        when(generator.generate(any(), any(), any())).thenThrow(GenerationException.rateLimited("429"));
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isEqualTo(new Fail(ErrorKind.RATE_LIMITED, "429", 5));
        assertThat(orchestrator.getAttempts()).isEqualTo(5);
        assertThat(stats.snapshot()).isEqualTo(new RunStats(1, 0, 1, 0, 5));
        verify(generator, times(5)).generate(any(), any(), any());
        verify(concurrencyLimiter, times(5)).reportRateLimited();
    }

    @Test
    void SERVICE_OVERLOADED_소진_시_FAILED_동시성_축소_없음() throws Exception {
        // given
        when(generator.generate(any(), any(), any())).thenThrow(GenerationException.overloaded("503 UNAVAILABLE"));
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail fail = (Fail) outcome;
        assertThat(fail.kind()).isEqualTo(ErrorKind.SERVICE_OVERLOADED);
        assertThat(fail.attempts()).isEqualTo(5);
        assertThat(fail.isExhausted()).isTrue();
        assertThat(orchestrator.getState()).isEqualTo(ItemState.FAILED);
        // 마지막 실패 후에도 backoff 대기
        assertThat(sleeper.getSleeps()).containsExactly(2000L, 4000L, 8000L, 16000L, 32000L);
        assertThat(stats.snapshot()).isEqualTo(new RunStats(1, 0, 1, 0, 0));
        verify(concurrencyLimiter, never()).reportRateLimited();
        verify(concurrencyLimiter, never()).reportSuccess();
        verify(concurrencyLimiter, times(5)).release();
    }

    // ============================================================
    // 3. 즉시 실패
    // ============================================================

    @Test
    void OTHER는_재시도_없이_즉시_FAILED() throws Exception {
        // given
        when(generator.generate(any(), any(), any()))
            .thenThrow(GenerationException.other("400 INVALID_ARGUMENT", null));
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isEqualTo(new Fail(ErrorKind.OTHER, "400 INVALID_ARGUMENT", 1));
        assertThat(sleeper.getSleeps()).isEmpty();
        assertThat(stats.snapshot()).isEqualTo(new RunStats(1, 0, 1, 0, 0));
        verify(generator, times(1)).generate(any(), any(), any());
        verify(concurrencyLimiter, times(1)).release();
    }

    @Test
    void 예상치_못한_예외도_OTHER로_분류되고_permit을_반납() throws Exception {
        // given
        when(generator.generate(any(), any(), any())).thenThrow(new IllegalStateException("decoder crashed"));
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isEqualTo(new Fail(ErrorKind.OTHER, "decoder crashed", 1));
        verify(concurrencyLimiter).acquire();
        verify(concurrencyLimiter).release();
    }

    @Test
    void 존재_확인_실패는_시도_없이_FAILED() {
        // given
        when(outputStore.exists(TARGET)).thenThrow(new IllegalStateException("disk unavailable"));
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        assertThat(outcome).isEqualTo(new Fail(ErrorKind.OTHER, "disk unavailable", 0));
        assertThat(orchestrator.getState()).isEqualTo(ItemState.FAILED);
        verifyNoInteractions(concurrencyLimiter, rateLimiter, generator);
    }

    // ============================================================
    // 4. 취소
    // ============================================================

    @Test
    void RPM_대기_중_인터럽트되면_FAILED_permit_반납_플래그_복원() throws Exception {
        // given
        doThrow(new InterruptedException("cancelled")).when(rateLimiter).acquire();
        RetryOrchestrator orchestrator = new RetryOrchestrator(item, context(true));

        // when
        Outcome outcome = orchestrator.call();

        // then
        boolean interrupted = Thread.interrupted();
        assertThat(interrupted).isTrue();
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail) outcome).attempts()).isZero();
        assertThat(orchestrator.getState()).isEqualTo(ItemState.FAILED);
        assertThat(stats.snapshot().failed()).isEqualTo(1);
        verify(concurrencyLimiter).release();
        verifyNoInteractions(generator);
    }

    // ============================================================
    // 5. 설정 / MDC
    // ============================================================

    @Test
    void 항목별_설정이_생성_호출에_전달된다() throws Exception {
        // given
        ImageConfig square = ImageConfig.defaults().withAspectRatio(AspectRatio.SQUARE);
        BatchItem custom = new BatchItem(PROMPT, TARGET, square);
        when(generator.generate(PROMPT, TARGET, square)).thenReturn(result());

        // when
        Outcome outcome = new RetryOrchestrator(custom, context(true)).call();

        // then
        assertThat(outcome.isOk()).isTrue();
        verify(generator).generate(PROMPT, TARGET, square);
    }

    @Test
    void 처리_후_MDC가_정리된다() throws Exception {
        // given
        when(generator.generate(any(), any(), any())).thenReturn(result());

        // when
        new RetryOrchestrator(item, context(false)).call();

        // then
        assertThat(MDC.get(RetryOrchestrator.MDC_ITEM_ID)).isNull();
    }
}
