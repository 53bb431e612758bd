package personal.rail.core.booking.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Seat Availability
 * (열차, 운행일)의 좌석 점유 현황 스냅샷
 * 비트 i 가 켜져 있으면 좌석 i 가 점유된 상태 (1-based)
 */
public final class SeatAvailability {

    private final LedgerKey key;
    private final int totalSeats;
    private final BitSet occupied;

    private SeatAvailability(LedgerKey key, int totalSeats, BitSet occupied) {
        this.key = key;
        this.totalSeats = totalSeats;
        this.occupied = occupied;
    }

    /**
     * 점유 좌석 목록으로부터 스냅샷 생성
     * 정원 범위를 벗어난 좌석 번호는 무시한다
     */
    public static SeatAvailability of(Train train, LocalDate travelDate, Iterable<Integer> occupiedSeats) {
        BitSet bits = new BitSet(train.totalSeats() + 1);
        for (Integer seat : occupiedSeats) {
            if (seat != null && train.hasSeat(seat)) {
                bits.set(seat);
            }
        }
        return new SeatAvailability(LedgerKey.of(train.id(), travelDate), train.totalSeats(), bits);
    }

    public LedgerKey key() {
        return key;
    }

    public int totalSeats() {
        return totalSeats;
    }

    public boolean isFree(int seatNumber) {
        return seatNumber >= 1 && seatNumber <= totalSeats && !occupied.get(seatNumber);
    }

    public int occupiedCount() {
        return occupied.cardinality();
    }

    public int freeCount() {
        return totalSeats - occupied.cardinality();
    }

    public boolean isFull() {
        return freeCount() == 0;
    }

    /**
     * 가장 낮은 번호의 빈 좌석
     */
    public OptionalInt lowestFree() {
        int seat = occupied.nextClearBit(1);
        return seat <= totalSeats ? OptionalInt.of(seat) : OptionalInt.empty();
    }

    /**
     * 빈 좌석 번호 (오름차순)
     */
    public List<Integer> freeSeats() {
        List<Integer> seats = new ArrayList<>(freeCount());
        for (int seat = occupied.nextClearBit(1); seat <= totalSeats; seat = occupied.nextClearBit(seat + 1)) {
            seats.add(seat);
        }
        return Collections.unmodifiableList(seats);
    }

    @Override
    public String toString() {
        return "SeatAvailability{key=" + key.asString() + ", free=" + freeCount() + "/" + totalSeats + "}";
    }
}
