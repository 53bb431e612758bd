package personal.rail.core.booking.application.port.out;

import personal.rail.core.booking.domain.model.Train;

import java.util.List;
import java.util.Optional;

/**
 * Train Repository (Output Port)
 * 열차 카탈로그 조회 인터페이스 (읽기 전용)
 */
public interface TrainRepository {

    /**
     * 열차 ID로 조회
     *
     * @param trainId 열차 ID
     * @return 열차 정보
     */
    Optional<Train> findById(Long trainId);

    /**
     * 출발지/도착지로 열차 목록 조회
     *
     * @param source      출발지
     * @param destination 도착지
     * @return 노선의 열차 목록 (열차 번호 순)
     */
    List<Train> findByRoute(String source, String destination);
}
