package personal.bookly.core.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.bookly.core.acceptance.support.BooklyTestFixture;
import personal.bookly.core.acceptance.support.ScenarioContext;

import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 배경 데이터 준비 및 공통 응답 검증 Step
 */
@Slf4j
@RequiredArgsConstructor
public class SetupSteps {

    private static final int MONDAY = 1;

    private final BooklyTestFixture fixture;
    private final ScenarioContext context;

    @Given("{string} 시간대의 {string} 테넌트가 매일 {string} 부터 {string} 까지 영업한다")
    public void 테넌트가_매일_영업한다(String timezone, String slug, String open, String close) {
        log.info(">>> Given: 테넌트 설정 - slug={}, timezone={}", slug, timezone);
        fixture.clearAllData();

        Long tenantId = fixture.createTenant(slug, timezone);
        fixture.openEveryDay(tenantId, LocalTime.parse(open), LocalTime.parse(close));

        context.setTenantSlug(slug);
        context.setTenantId(tenantId);
        context.setZoneId(ZoneId.of(timezone));
    }

    @And("{int}분 소요, {int}분 간격의 스태프 필수 서비스가 있다")
    public void 스태프_필수_서비스가_있다(int durationMinutes, int intervalMinutes) {
        context.setServiceId(fixture.createStaffRequiredService(
                context.getTenantId(), "Haircut", durationMinutes, intervalMinutes));
    }

    @And("월요일 {string} 부터 {string} 까지 근무하는 스태프가 있다")
    public void 월요일_근무_스태프가_있다(String start, String end) {
        Long staffId = fixture.createStaff(context.getTenantId(), "Ann");
        fixture.addWeeklyBlock(context.getTenantId(), staffId, MONDAY,
                LocalTime.parse(start).toSecondOfDay() / 60, LocalTime.parse(end).toSecondOfDay() / 60);
        context.setStaffId(staffId);
    }

    @And("{int}분이 포함된 이용권 플랜이 있다")
    public void 이용권_플랜이_있다(int includedMinutes) {
        context.setPlanId(fixture.createMinutesPlan(context.getTenantId(), "Monthly", includedMinutes));
    }

    @Then("응답 코드는 {int} 이다")
    public void 응답_코드는_이다(int statusCode) {
        assertThat(context.getLastResponse().statusCode())
                .as("response body: %s", context.getLastResponse().asString())
                .isEqualTo(statusCode);
    }

    @And("에러 코드는 {string} 이다")
    public void 에러_코드는_이다(String code) {
        assertThat(context.getLastResponse().jsonPath().getString("code")).isEqualTo(code);
    }
}
