package personal.rail.core.user.domain.model;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * User Domain Model
 * 사용자 도메인의 불변 모델 (관리자 여부는 외부 인증 시스템이 관리)
 */
public record User(
        Long id,
        String username,
        String email,
        boolean admin
) {
    public User {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (username == null || username.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Username cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User email cannot be null or blank");
        }
    }
}
