package personal.rail.core.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * H2 + In-Memory 좌석 선점 저장소로 유스케이스를 직접 호출한다
 */
@CucumberContextConfiguration
@SpringBootTest
@ActiveProfiles("test")
@Import(ReservationTestAdapter.class)
public class CucumberSpringConfiguration {
}
