package personal.rail.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 최상위 클래스
 * 모든 도메인 예외는 ErrorCode를 가진다
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }
}
