package personal.rail.core.user.application.port.out;

import personal.rail.core.user.domain.model.User;

import java.util.Optional;

/**
 * User Repository (Output Port)
 * 사용자 저장소 인터페이스 (읽기 전용)
 */
public interface UserRepository {

    /**
     * 사용자 ID로 조회
     * @param userId 사용자 ID
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> findById(Long userId);
}
