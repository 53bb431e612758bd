package personal.rail.core.user.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.rail.core.user.application.port.in.ValidateUserUseCase;
import personal.rail.core.user.application.port.out.UserRepository;
import personal.rail.core.user.domain.exception.UserNotFoundException;
import personal.rail.core.user.domain.model.User;

/**
 * User Application Service
 * 예약 코어가 사용하는 사용자 검증 UseCase 구현
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService implements ValidateUserUseCase {

    private final UserRepository userRepository;

    @Override
    public User validateUser(Long userId) {
        if (userId == null) {
            throw new UserNotFoundException(null);
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found for validation: userId={}", userId);
                    return new UserNotFoundException(userId);
                });
    }
}
