package personal.rail.core.booking.application.port.out;

import personal.rail.core.booking.domain.model.LedgerKey;
import personal.rail.core.booking.domain.model.SeatClaim;

import java.time.Duration;
import java.util.Set;

/**
 * Seat Claim Repository (Output Port)
 * 좌석 선점 마커 저장소 - 좌석 배정의 유일한 상호 배제 지점
 * 같은 (열차, 운행일, 좌석)에 대한 동시 tryClaim 중 정확히 하나만 성공해야 한다
 */
public interface SeatClaimRepository {

    /**
     * 좌석 선점 시도
     * Fail-Fast: 선점 실패 시 대기하지 않고 즉시 false 반환
     *
     * @param claim 선점 정보 (key, seatNumber, owner)
     * @param ttl   선점 유지 시간 (프로세스 장애 시 자동 해제)
     * @return true: 선점 성공, false: 이미 다른 시도가 선점
     */
    boolean tryClaim(SeatClaim claim, Duration ttl);

    /**
     * 좌석 선점 해제 (소유자 검증 후 삭제)
     *
     * @param claim 선점 정보
     * @return 실제로 해제했으면 true, 소유자가 아니거나 이미 해제/만료되었으면 false
     */
    boolean release(SeatClaim claim);

    /**
     * (열차, 운행일)에 현재 선점된 좌석 번호
     *
     * @param key (열차, 운행일)
     * @return 선점된 좌석 번호 (만료된 선점 제외)
     */
    Set<Integer> claimedSeats(LedgerKey key);
}
