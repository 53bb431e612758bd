package personal.rail.core.booking.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Reservation 설정 Properties
 * application.yml의 reservation.* 설정을 바인딩
 */
@Validated
@ConfigurationProperties(prefix = "reservation")
public record ReservationProperties(
        @Valid @NotNull Booking booking,
        @Valid @NotNull Executor executor
) {
    public record Booking(
            @NotNull Duration defaultTimeout,  // 호출자가 timeout 을 주지 않았을 때
            @NotNull Duration claimTtl,        // 좌석 선점 마커 유지 시간
            @Min(1) int maxAssignAttempts      // 자동 배정 재시도 상한
    ) {}

    public record Executor(
            @Min(1) int corePoolSize,
            @Min(1) int maxPoolSize,
            @Min(0) int queueCapacity,
            @NotBlank String threadNamePrefix
    ) {}
}
