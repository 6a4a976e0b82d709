package personal.bookly.core.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot 통합 설정
 * H2(MySQL 모드) + Flyway 스키마, Redis/Kafka 신호는 메모리 구현으로 대체
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({TestSignalConfig.class, BooklyTestFixture.class, BooklyHttpAdapter.class, ScenarioContext.class})
public class CucumberSpringConfiguration {
}
