package personal.rail.core.booking.adapter.out.ledger;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Seat Ledger 설정 Properties
 *
 * 설정 예시:
 * seat-ledger:
 *   claim-store: redis # memory | redis
 *   redis-key-prefix: seat
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "seat-ledger")
public class SeatLedgerProperties {

    /**
     * 좌석 선점 저장소
     * - memory: 프로세스 내부 (로컬 개발, 단일 인스턴스)
     * - redis: Redis (다중 인스턴스)
     */
    private String claimStore = "memory";

    /**
     * Redis 키 접두어 (여러 서비스가 같은 Redis 를 쓸 때 구분용)
     */
    private String redisKeyPrefix = "seat";
}
