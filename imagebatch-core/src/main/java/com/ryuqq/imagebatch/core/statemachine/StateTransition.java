package com.ryuqq.imagebatch.core.statemachine;

/**
 * 항목 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → SKIPPED, IN_FLIGHT, FAILED</li>
 *   <li>IN_FLIGHT → SUCCESS, BACKOFF, FAILED</li>
 *   <li>BACKOFF → IN_FLIGHT, FAILED</li>
 * </ul>
 *
 * <p>종료 상태(SUCCESS, FAILED, SKIPPED)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ItemState from, ItemState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == ItemState.SKIPPED || to == ItemState.IN_FLIGHT || to == ItemState.FAILED;
            case IN_FLIGHT -> to == ItemState.SUCCESS || to == ItemState.BACKOFF || to == ItemState.FAILED;
            case BACKOFF -> to == ItemState.IN_FLIGHT || to == ItemState.FAILED;
            case SUCCESS, FAILED, SKIPPED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ItemState transition(ItemState current, ItemState next) {
        validate(current, next);
        return next;
    }
}
