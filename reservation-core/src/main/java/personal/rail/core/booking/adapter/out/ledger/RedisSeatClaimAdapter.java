package personal.rail.core.booking.adapter.out.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import personal.rail.core.booking.application.port.out.SeatClaimRepository;
import personal.rail.core.booking.domain.exception.BookingPersistenceException;
import personal.rail.core.booking.domain.model.LedgerKey;
import personal.rail.core.booking.domain.model.SeatClaim;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Redis Seat Claim Adapter
 * Redis SET NX PX 기반 좌석 선점 구현체 (다중 인스턴스)
 *
 * 키 구조 (prefix 기본값: seat):
 * - {prefix}:claim:{trainId:date}:seat -> owner (TTL)
 * - {prefix}:claims:{trainId:date}     -> 선점 좌석 번호 Set (조회용 인덱스)
 *
 * Hash Tag 로 같은 (열차, 운행일)의 키가 같은 노드에 저장되므로 Lua Script 를 Redis Cluster 에서도 실행할 수 있다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisSeatClaimAdapter implements SeatClaimRepository {

    // 선점 + 인덱스 등록을 원자적으로 수행
    private static final RedisScript<Long> CLAIM_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('set', KEYS[1], ARGV[1], 'NX', 'PX', ARGV[2]) then
                redis.call('sadd', KEYS[2], ARGV[3])
                redis.call('pexpire', KEYS[2], ARGV[2])
                return 1
            end
            return 0
            """, Long.class);

    // 본인 소유인 경우만 삭제
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                redis.call('del', KEYS[1])
                redis.call('srem', KEYS[2], ARGV[2])
                return 1
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    @Override
    public boolean tryClaim(SeatClaim claim, Duration ttl) {
        String claimKey = claimKey(claim.key(), claim.seatNumber());

        try {
            Long claimed = redisTemplate.execute(
                    CLAIM_SCRIPT,
                    List.of(claimKey, indexKey(claim.key())),
                    claim.owner(),
                    String.valueOf(ttl.toMillis()),
                    String.valueOf(claim.seatNumber()));

            boolean result = claimed != null && claimed == 1L;
            log.debug("[RedisClaim] Claim attempt: key={}, owner={}, success={}", claimKey, claim.owner(), result);
            return result;

        } catch (DataAccessException e) {
            log.error("[RedisClaim] Failed to claim seat: key={}", claimKey, e);
            throw new BookingPersistenceException("seat claim store unavailable", e);
        }
    }

    @Override
    public boolean release(SeatClaim claim) {
        String claimKey = claimKey(claim.key(), claim.seatNumber());

        try {
            Long released = redisTemplate.execute(
                    RELEASE_SCRIPT,
                    List.of(claimKey, indexKey(claim.key())),
                    claim.owner(),
                    String.valueOf(claim.seatNumber()));

            boolean result = released != null && released == 1L;
            if (!result) {
                log.debug("[RedisClaim] Claim not released (not owner or expired): key={}, owner={}",
                        claimKey, claim.owner());
            }
            return result;

        } catch (DataAccessException e) {
            // TTL 이 지나면 자동 해제된다
            log.error("[RedisClaim] Failed to release seat claim: key={}, owner={}", claimKey, claim.owner(), e);
            return false;
        }
    }

    @Override
    public Set<Integer> claimedSeats(LedgerKey key) {
        String indexKey = indexKey(key);

        try {
            Set<String> members = redisTemplate.opsForSet().members(indexKey);
            if (members == null || members.isEmpty()) {
                return Set.of();
            }

            List<String> seats = new ArrayList<>(members);
            List<String> claimKeys = seats.stream()
                    .map(seat -> claimKey(key, Integer.parseInt(seat)))
                    .toList();
            List<String> owners = redisTemplate.opsForValue().multiGet(claimKeys);

            Set<Integer> claimed = new HashSet<>();
            List<String> stale = new ArrayList<>();
            for (int i = 0; i < seats.size(); i++) {
                if (owners != null && owners.get(i) != null) {
                    claimed.add(Integer.valueOf(seats.get(i)));
                } else {
                    stale.add(seats.get(i));
                }
            }

            // 만료된 선점 인덱스 정리
            if (!stale.isEmpty()) {
                redisTemplate.opsForSet().remove(indexKey, stale.toArray());
            }
            return claimed;

        } catch (DataAccessException e) {
            log.error("[RedisClaim] Failed to read claimed seats: key={}", indexKey, e);
            throw new BookingPersistenceException("seat claim store unavailable", e);
        }
    }

    private String claimKey(LedgerKey key, int seatNumber) {
        return keyPrefix + ":claim:" + tag(key) + ":" + seatNumber;
    }

    private String indexKey(LedgerKey key) {
        return keyPrefix + ":claims:" + tag(key);
    }

    private static String tag(LedgerKey key) {
        return "{" + key.asString() + "}";
    }
}
