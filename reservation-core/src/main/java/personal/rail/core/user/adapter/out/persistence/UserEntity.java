package personal.rail.core.user.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rail.core.user.domain.model.User;

import java.time.LocalDateTime;

/**
 * User JPA Entity
 * users 테이블 매핑 (비밀번호 컬럼은 인증 시스템 소유라 매핑하지 않음)
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(nullable = false, unique = true, length = 100)
    private String email;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 정적 팩토리 메서드 (테스트 데이터 생성용)
     */
    public static UserEntity of(String username, String email, boolean admin) {
        UserEntity entity = new UserEntity();
        entity.username = username;
        entity.email = email;
        entity.admin = admin;
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public User toDomain() {
        return new User(id, username, email, admin);
    }
}
