package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Idempotency Token Mismatch Exception
 * 같은 멱등성 토큰이 다른 (사용자, 열차, 운행일) 요청에 재사용되었을 때 발생
 */
public class IdempotencyTokenMismatchException extends BusinessException {
    public IdempotencyTokenMismatchException(String token, Long existingBookingId) {
        super(ErrorCode.IDEMPOTENCY_TOKEN_MISMATCH,
                String.format("Idempotency token already used for another request: token=%s, bookingId=%d",
                        token, existingBookingId));
    }
}
