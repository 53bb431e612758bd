package personal.rail.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rail.core.booking.application.port.out.TrainRepository;
import personal.rail.core.booking.domain.model.Train;

import java.util.List;
import java.util.Optional;

/**
 * Train Persistence Adapter
 * JPA를 사용한 열차 카탈로그 조회 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainPersistenceAdapter implements TrainRepository {

    private final JpaTrainRepository jpaTrainRepository;

    @Override
    public Optional<Train> findById(Long trainId) {
        log.debug("Finding train: trainId={}", trainId);
        return jpaTrainRepository.findById(trainId)
                .map(TrainEntity::toDomain);
    }

    @Override
    public List<Train> findByRoute(String source, String destination) {
        log.debug("Finding trains by route: source={}, destination={}", source, destination);
        return jpaTrainRepository.findBySourceAndDestinationOrderByTrainNumber(source, destination).stream()
                .map(TrainEntity::toDomain)
                .toList();
    }
}
