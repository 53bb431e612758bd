package personal.rail.common.exception;

/**
 * 에러 코드 정의
 * 에러 종류(Kind)와 코드, 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(ErrorKind.INVALID_INPUT, "C001", "잘못된 입력값입니다."),
    FORBIDDEN(ErrorKind.FORBIDDEN, "C003", "권한이 없습니다."),

    // User Domain (Uxxx)
    USER_NOT_FOUND(ErrorKind.NOT_FOUND, "U001", "사용자를 찾을 수 없습니다."),

    // Train Domain (Txxx)
    TRAIN_NOT_FOUND(ErrorKind.NOT_FOUND, "T001", "열차를 찾을 수 없습니다."),

    // Booking Domain (Bxxx)
    BOOKING_NOT_FOUND(ErrorKind.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    INVALID_TRAVEL_DATE(ErrorKind.INVALID_DATE, "B002", "지난 날짜는 예약할 수 없습니다."),
    SEAT_OUT_OF_RANGE(ErrorKind.OUT_OF_RANGE, "B003", "열차 좌석 범위를 벗어난 좌석입니다."),
    TRAIN_FULL(ErrorKind.FULL, "B004", "남은 좌석이 없습니다."),
    SEAT_TAKEN(ErrorKind.SEAT_TAKEN, "B005", "이미 선택된 좌석입니다."),
    CONSTRAINT_VIOLATION(ErrorKind.CONSTRAINT_VIOLATION, "B006", "예약 제약 조건 위반이 발생했습니다."),
    PERSISTENCE_FAILED(ErrorKind.PERSISTENCE_FAILED, "B007", "예약 저장에 실패했습니다."),
    BOOKING_TIMEOUT(ErrorKind.TIMEOUT, "B008", "예약 처리 시간이 초과되었습니다."),
    IDEMPOTENCY_TOKEN_MISMATCH(ErrorKind.INVALID_INPUT, "B009", "다른 요청에 사용된 멱등성 토큰입니다.");

    private final ErrorKind kind;
    private final String code;
    private final String message;

    ErrorCode(ErrorKind kind, String code, String message) {
        this.kind = kind;
        this.code = code;
        this.message = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
