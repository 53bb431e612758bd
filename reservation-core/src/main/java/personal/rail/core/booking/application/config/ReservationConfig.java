package personal.rail.core.booking.application.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import personal.rail.core.booking.domain.service.LowestSeatFirstPolicy;
import personal.rail.core.booking.domain.service.SeatAssignmentPolicy;

import java.time.Clock;

/**
 * Reservation Configuration
 * 예약 엔진 실행기, 시계, 좌석 배정 정책 빈 설정
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ReservationProperties.class)
public class ReservationConfig {

    /**
     * 운행일 검증용 시계 (테스트에서 고정 시계로 교체 가능)
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 자동 배정 정책 (기본: 가장 낮은 번호의 빈 좌석)
     */
    @Bean
    @ConditionalOnMissingBean
    public SeatAssignmentPolicy seatAssignmentPolicy() {
        return new LowestSeatFirstPolicy();
    }

    /**
     * 예약 시도 전용 실행기
     * 호출 스레드는 제한 시간까지만 기다리고, 선점/저장은 이 풀에서 수행된다
     */
    @Bean(name = "bookingExecutor")
    public ThreadPoolTaskExecutor bookingExecutor(ReservationProperties properties) {
        ReservationProperties.Executor config = properties.executor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.corePoolSize());
        executor.setMaxPoolSize(config.maxPoolSize());
        executor.setQueueCapacity(config.queueCapacity());
        executor.setThreadNamePrefix(config.threadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Booking executor initialized: core={}, max={}, queue={}",
                config.corePoolSize(), config.maxPoolSize(), config.queueCapacity());
        return executor;
    }
}
