package personal.rail.core.booking.application.service;

import personal.rail.core.booking.application.port.in.BookSeatCommand;
import personal.rail.core.booking.domain.exception.BookingTimeoutException;
import personal.rail.core.booking.domain.model.Train;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 진행 중인 예약 시도 하나의 상태
 *
 * RUNNING -> COMMITTING -> COMMITTED
 * RUNNING -> ABORTED (제한 시간 초과 또는 호출자 취소)
 *
 * COMMITTING 으로 넘어간 뒤에는 중단할 수 없다. 이 경우 호출자가 떠났다면
 * 커밋된 예약을 취소하는 보상 처리가 뒤따른다.
 */
final class BookingAttempt {

    enum State {
        RUNNING,
        COMMITTING,
        COMMITTED,
        ABORTED
    }

    private final String id = UUID.randomUUID().toString();
    private final BookSeatCommand command;
    private final Train train;
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

    BookingAttempt(BookSeatCommand command, Train train) {
        this.command = command;
        this.train = train;
    }

    String id() {
        return id;
    }

    BookSeatCommand command() {
        return command;
    }

    Train train() {
        return train;
    }

    State state() {
        return state.get();
    }

    /**
     * 커밋 전이면 중단
     *
     * @return 이번 호출로 중단되었으면 true
     */
    boolean abort() {
        return state.compareAndSet(State.RUNNING, State.ABORTED);
    }

    /**
     * 트랜잭션 커밋 직전 호출. 이미 중단된 시도면 false.
     */
    boolean beginCommit() {
        return state.compareAndSet(State.RUNNING, State.COMMITTING);
    }

    void committed() {
        state.set(State.COMMITTED);
    }

    /**
     * 중단된 시도면 BookingTimeoutException
     */
    void ensureRunning() {
        if (state.get() == State.ABORTED) {
            throw new BookingTimeoutException(train.id(), command.travelDate(), "attempt aborted by caller");
        }
    }
}
