package personal.rail.common.exception;

/**
 * 에러 분류
 * 호출자가 재시도/안내 여부를 판단하는 기준
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_INPUT,
    INVALID_DATE,
    OUT_OF_RANGE,
    FULL,
    SEAT_TAKEN,
    FORBIDDEN,
    CONSTRAINT_VIOLATION,
    PERSISTENCE_FAILED,
    TIMEOUT
}
