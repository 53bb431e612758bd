package personal.rail.core.user.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for User
 */
public interface JpaUserRepository extends JpaRepository<UserEntity, Long> {
}
