package personal.bookly.core.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;
import org.springframework.context.annotation.ScopedProxyMode;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * 시나리오 내 Step 클래스 간 상태 공유
 * 시나리오마다 새 인스턴스가 만들어진다
 */
@Getter
@Setter
@ScenarioScope(proxyMode = ScopedProxyMode.NO)
public class ScenarioContext {

    private String tenantSlug;
    private Long tenantId;
    private ZoneId zoneId;
    private Long serviceId;
    private Long staffId;
    private Long planId;

    private Response lastResponse;
    private Long lastBookingId;
    private Long lastCustomerId;
    private Long membershipId;

    private final List<Response> bookingResponses = new ArrayList<>();
}
