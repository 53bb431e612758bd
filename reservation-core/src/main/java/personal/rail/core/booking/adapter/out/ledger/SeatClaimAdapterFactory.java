package personal.rail.core.booking.adapter.out.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.rail.core.booking.application.port.out.SeatClaimRepository;

import java.time.Clock;

/**
 * Seat Claim Adapter Factory
 * 설정에 따라 적절한 SeatClaimRepository 구현체를 생성
 *
 * 설정:
 * - seat-ledger.claim-store=memory → InMemorySeatClaimAdapter (기본값)
 * - seat-ledger.claim-store=redis → RedisSeatClaimAdapter
 */
@Slf4j
@Configuration
public class SeatClaimAdapterFactory {

    /**
     * seat-ledger.claim-store=memory 또는 설정이 없는 경우 (기본값)
     */
    @Bean
    @ConditionalOnProperty(name = "seat-ledger.claim-store", havingValue = "memory", matchIfMissing = true)
    public SeatClaimRepository inMemorySeatClaimAdapter(Clock clock, SeatLedgerProperties properties) {
        log.info("Creating InMemorySeatClaimAdapter - claim store: {}, seat claims are local to this process",
                properties.getClaimStore());
        return new InMemorySeatClaimAdapter(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "seat-ledger.claim-store", havingValue = "redis")
    public SeatClaimRepository redisSeatClaimAdapter(
            StringRedisTemplate redisTemplate,
            SeatLedgerProperties properties) {

        log.info("Creating RedisSeatClaimAdapter - claim store: {}, key prefix: {}",
                properties.getClaimStore(), properties.getRedisKeyPrefix());
        return new RedisSeatClaimAdapter(redisTemplate, properties.getRedisKeyPrefix());
    }
}
