package personal.rail.core.user.application.port.in;

import personal.rail.core.user.domain.model.User;

/**
 * Validate User UseCase (Input Port)
 * 사용자 검증 유스케이스
 */
public interface ValidateUserUseCase {

    /**
     * 사용자 ID로 검증
     * @param userId 사용자 ID
     * @return 사용자 정보
     * @throws personal.rail.core.user.domain.exception.UserNotFoundException 사용자가 존재하지 않을 때
     */
    User validateUser(Long userId);
}
