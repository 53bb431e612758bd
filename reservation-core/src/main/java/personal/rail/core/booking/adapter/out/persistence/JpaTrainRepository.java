package personal.rail.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for Train
 */
public interface JpaTrainRepository extends JpaRepository<TrainEntity, Long> {

    List<TrainEntity> findBySourceAndDestinationOrderByTrainNumber(String source, String destination);
}
