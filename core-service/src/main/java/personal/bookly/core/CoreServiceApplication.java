package personal.bookly.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Core Service Application
 * 테넌트 설정, 가용 슬롯 계산, 예약 트랜잭션, 멤버십 원장을 포함하는 예약 엔진
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.bookly.core",
        "personal.bookly.common"  // common 모듈의 GlobalExceptionHandler, CorsConfig 스캔
    }
)
public class CoreServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoreServiceApplication.class, args);
    }
}
