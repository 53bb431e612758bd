package personal.rail.core.booking.application.port.in;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;
import personal.rail.core.booking.domain.model.SeatPreference;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Book Seat Command
 * 좌석 예약 커맨드
 *
 * @param userId           예약 사용자 ID
 * @param trainId          열차 ID
 * @param travelDate       운행일
 * @param seatPreference   지정 좌석 또는 자동 배정
 * @param idempotencyToken 호출자가 부여한 멱등성 토큰 (선택)
 * @param timeout          호출자 제한 시간 (선택, 없으면 기본값)
 */
public record BookSeatCommand(
        Long userId,
        Long trainId,
        LocalDate travelDate,
        SeatPreference seatPreference,
        String idempotencyToken,
        Duration timeout
) {
    public BookSeatCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (trainId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Train ID cannot be null");
        }
        if (travelDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Travel date cannot be null");
        }
        if (seatPreference == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat preference cannot be null");
        }
        if (idempotencyToken != null && idempotencyToken.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Idempotency token cannot be blank");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Timeout must be positive");
        }
    }

    public static BookSeatCommand of(Long userId, Long trainId, LocalDate travelDate, SeatPreference seatPreference) {
        return new BookSeatCommand(userId, trainId, travelDate, seatPreference, null, null);
    }

    public BookSeatCommand withIdempotencyToken(String token) {
        return new BookSeatCommand(userId, trainId, travelDate, seatPreference, token, timeout);
    }

    public BookSeatCommand withTimeout(Duration newTimeout) {
        return new BookSeatCommand(userId, trainId, travelDate, seatPreference, idempotencyToken, newTimeout);
    }

    public boolean hasIdempotencyToken() {
        return idempotencyToken != null;
    }
}
