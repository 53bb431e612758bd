package personal.rail.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.rail.core.booking.domain.model.Booking;
import personal.rail.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑
 *
 * active_marker: ACTIVE 이면 TRUE, CANCELLED 이면 NULL.
 * Unique 인덱스가 NULL 을 서로 다른 값으로 취급하므로 유효 예약에만 좌석 중복 제약이 걸린다.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_bookings_train_seat_date",
                        columnNames = {"train_id", "seat_number", "booking_date", "active_marker"}),
                @UniqueConstraint(
                        name = "uk_bookings_idempotency_token",
                        columnNames = {"idempotency_token"})
        },
        indexes = @Index(name = "idx_bookings_train_date_status", columnList = "train_id, booking_date, status"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "train_id", nullable = false)
    private Long trainId;

    @Column(name = "seat_number", nullable = false)
    private Integer seatNumber;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "active_marker")
    private Boolean activeMarker;

    @Column(name = "idempotency_token", length = 100)
    private String idempotencyToken;

    @Column(name = "claim_token", length = 64)
    private String claimToken;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.userId = booking.userId();
        entity.trainId = booking.trainId();
        entity.seatNumber = booking.seatNumber();
        entity.bookingDate = booking.travelDate();
        entity.status = booking.status();
        entity.activeMarker = booking.isActive() ? Boolean.TRUE : null;
        entity.idempotencyToken = booking.idempotencyToken();
        entity.claimToken = booking.claimToken();
        entity.createdAt = booking.createdAt();
        entity.cancelledAt = booking.cancelledAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Booking toDomain() {
        return new Booking(id, userId, trainId, seatNumber, bookingDate, status,
                idempotencyToken, claimToken, createdAt, cancelledAt);
    }
}
