package personal.rail.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Reservation Core Application
 * 열차 좌석 원장, 충돌 처리, 예약 엔진을 포함하는 예약 코어
 */
@SpringBootApplication
public class ReservationCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationCoreApplication.class, args);
    }
}
