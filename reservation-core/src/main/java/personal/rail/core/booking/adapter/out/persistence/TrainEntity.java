package personal.rail.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rail.core.booking.domain.model.Train;

/**
 * Train JPA Entity
 * 열차 테이블 매핑 (예약 코어에서는 읽기 전용)
 */
@Entity
@Table(name = "trains",
        indexes = @Index(name = "idx_trains_route", columnList = "source, destination"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TrainEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "train_number", nullable = false, unique = true, length = 20)
    private String trainNumber;

    @Column(nullable = false, length = 100)
    private String source;

    @Column(nullable = false, length = 100)
    private String destination;

    @Column(name = "total_seats", nullable = false)
    private Integer totalSeats;

    /**
     * 신규 열차 엔티티 (카탈로그 적재/테스트 용)
     */
    public static TrainEntity of(String trainNumber, String source, String destination, int totalSeats) {
        TrainEntity entity = new TrainEntity();
        entity.trainNumber = trainNumber;
        entity.source = source;
        entity.destination = destination;
        entity.totalSeats = totalSeats;
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Train toDomain() {
        return new Train(id, trainNumber, source, destination, totalSeats);
    }
}
