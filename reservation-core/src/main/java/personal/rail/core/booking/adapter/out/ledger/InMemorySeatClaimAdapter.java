package personal.rail.core.booking.adapter.out.ledger;

import lombok.extern.slf4j.Slf4j;
import personal.rail.core.booking.application.port.out.SeatClaimRepository;
import personal.rail.core.booking.domain.model.LedgerKey;
import personal.rail.core.booking.domain.model.SeatClaim;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-Memory Seat Claim Adapter
 * 단일 프로세스용 좌석 선점 저장소
 *
 * (열차, 운행일)마다 별도의 락을 사용하므로 서로 다른 열차/운행일의 선점은 서로를 막지 않는다.
 *
 * 사용 환경:
 * - 로컬 개발, 테스트, 단일 인스턴스 배포
 */
@Slf4j
public class InMemorySeatClaimAdapter implements SeatClaimRepository {

    private final Map<LedgerKey, Arena> arenas = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySeatClaimAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryClaim(SeatClaim claim, Duration ttl) {
        Arena arena = arenas.computeIfAbsent(claim.key(), key -> new Arena());
        Instant now = clock.instant();

        arena.lock.lock();
        try {
            Marker current = arena.markers.get(claim.seatNumber());
            if (current != null && !current.isExpired(now)) {
                log.debug("[InMemoryClaim] Seat already claimed: key={}, seat={}, owner={}",
                        claim.key().asString(), claim.seatNumber(), current.owner());
                return false;
            }
            arena.markers.put(claim.seatNumber(), new Marker(claim.owner(), now.plus(ttl)));
            return true;
        } finally {
            arena.lock.unlock();
        }
    }

    @Override
    public boolean release(SeatClaim claim) {
        Arena arena = arenas.get(claim.key());
        if (arena == null) {
            return false;
        }

        arena.lock.lock();
        try {
            Marker current = arena.markers.get(claim.seatNumber());
            if (current == null || !current.owner().equals(claim.owner())) {
                return false;
            }
            arena.markers.remove(claim.seatNumber());
            return true;
        } finally {
            arena.lock.unlock();
        }
    }

    @Override
    public Set<Integer> claimedSeats(LedgerKey key) {
        Arena arena = arenas.get(key);
        if (arena == null) {
            return Set.of();
        }
        Instant now = clock.instant();

        arena.lock.lock();
        try {
            arena.markers.values().removeIf(marker -> marker.isExpired(now));
            return arena.markers.keySet().stream().collect(Collectors.toUnmodifiableSet());
        } finally {
            arena.lock.unlock();
        }
    }

    private static final class Arena {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<Integer, Marker> markers = new HashMap<>();
    }

    private record Marker(String owner, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
