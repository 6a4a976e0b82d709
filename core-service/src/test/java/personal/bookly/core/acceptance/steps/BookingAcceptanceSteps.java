package personal.bookly.core.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.bookly.core.acceptance.support.BooklyHttpAdapter;
import personal.bookly.core.acceptance.support.BooklyTestFixture;
import personal.bookly.core.acceptance.support.ScenarioContext;
import personal.bookly.core.acceptance.support.TestSignalConfig.RecordingBookingEventPort;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 가용성 조회 / 예약 생성 / 상태 변경 Step
 */
@Slf4j
@RequiredArgsConstructor
public class BookingAcceptanceSteps {

    private final BooklyHttpAdapter httpAdapter;
    private final BooklyTestFixture fixture;
    private final ScenarioContext context;
    private final RecordingBookingEventPort bookingEventPort;

    private Long firstBookingId;

    @Given("고객 {string} 이 {string} 에 예약했다")
    public void 고객이_예약했다(String email, String localStart) {
        log.info(">>> Given: 기존 예약 생성 - email={}, start={}", email, localStart);
        Response response = requestBooking(email, localStart, null);

        assertThat(response.statusCode()).as(response.asString()).isEqualTo(201);
        remember(response);
    }

    @When("고객 {string} 이 멱등 키 {string} 로 {string} 예약을 요청한다")
    public void 멱등_키로_예약을_요청한다(String email, String idempotencyKey, String localStart) {
        Response response = requestBooking(email, localStart, idempotencyKey);
        context.setLastResponse(response);
        if (response.statusCode() == 201) {
            firstBookingId = response.jsonPath().getLong("booking.id");
        }
    }

    @When("고객 {int}명이 동시에 {string} 예약을 요청한다")
    public void 고객들이_동시에_예약을_요청한다(int count, String localStart) throws InterruptedException {
        log.info(">>> When: {}명의 동시 예약 요청 - start={}", count, localStart);
        context.getBookingResponses().addAll(
                runConcurrently(count, i -> requestBooking("concurrent-" + i + "@example.com", localStart, null)));
    }

    @When("고객 {string} 이 멱등 키 {string} 로 {string} 예약을 {int}번 동시에 요청한다")
    public void 같은_멱등_키로_동시에_요청한다(String email, String idempotencyKey, String localStart, int count)
            throws InterruptedException {
        log.info(">>> When: 같은 멱등 키로 {}건 동시 요청 - key={}, start={}", count, idempotencyKey, localStart);
        context.getBookingResponses().addAll(
                runConcurrently(count, i -> requestBooking(email, localStart, idempotencyKey)));
    }

    @Then("예약 {int}건만 생성되고 나머지는 같은 예약을 replay 로 재반환한다")
    public void 나머지는_replay_이다(int created) {
        List<Response> responses = context.getBookingResponses();
        List<Integer> statuses = responses.stream().map(Response::statusCode).toList();
        log.info(">>> Then: 동시 멱등 요청 결과 - statuses={}", statuses);

        assertThat(statuses).filteredOn(status -> status == 201).hasSize(created);
        assertThat(statuses).filteredOn(status -> status != 201).containsOnly(200);
        assertThat(responses).allSatisfy(response ->
                assertThat(response.jsonPath().getBoolean("replay")).isEqualTo(response.statusCode() == 200));
        assertThat(responses.stream().map(response -> response.jsonPath().getLong("booking.id")).distinct())
                .hasSize(1);
    }

    @Then("예약 {int}건만 생성되고 나머지는 409 로 거절된다")
    public void 한_건만_생성된다(int created) {
        List<Integer> statuses = context.getBookingResponses().stream().map(Response::statusCode).toList();
        log.info(">>> Then: 동시 예약 결과 - statuses={}", statuses);

        assertThat(statuses).filteredOn(status -> status == 201).hasSize(created);
        assertThat(statuses).filteredOn(status -> status != 201).containsOnly(409);
    }

    @And("{string} 에 점유 중인 예약은 {int}건이다")
    public void 점유_중인_예약_수(String localStart, int expected) {
        assertThat(fixture.countOccupyingBookings(context.getTenantId(), toOffset(localStart).toInstant()))
                .isEqualTo(expected);
    }

    @And("재요청 응답은 replay 이고 예약 번호가 처음과 같다")
    public void 재요청은_replay_이다() {
        Response response = context.getLastResponse();
        assertThat(response.jsonPath().getBoolean("replay")).isTrue();
        assertThat(response.jsonPath().getLong("booking.id")).isEqualTo(firstBookingId);
    }

    @When("{string} 의 예약 가능 시간을 조회한다")
    public void 예약_가능_시간을_조회한다(String date) {
        context.setLastResponse(httpAdapter.getAvailability(
                context.getTenantSlug(), context.getServiceId(), LocalDate.parse(date), context.getStaffId()));
    }

    @And("슬롯 {string} 은 예약 가능하다")
    public void 슬롯은_예약_가능하다(String time) {
        assertThat(slot(time).get("available")).isEqualTo(true);
    }

    @And("슬롯 {string} 은 예약 불가하다")
    public void 슬롯은_예약_불가하다(String time) {
        assertThat(slot(time).get("available")).isEqualTo(false);
    }

    @And("슬롯은 {string} 부터 {string} 까지 {int}개다")
    public void 슬롯_범위(String first, String last, int count) {
        List<String> times = context.getLastResponse().jsonPath().getList("slots.time", String.class);
        assertThat(times).hasSize(count);
        assertThat(times.get(0)).isEqualTo(first);
        assertThat(times.get(times.size() - 1)).isEqualTo(last);
    }

    @And("가용성 기준은 {string} 이고 일정 출처는 {string} 이다")
    public void 가용성_메타(String basis, String scheduleSource) {
        Response response = context.getLastResponse();
        assertThat(response.jsonPath().getString("meta.availability_basis")).isEqualTo(basis);
        assertThat(response.jsonPath().getString("meta.schedule_source")).isEqualTo(scheduleSource);
        assertThat(response.jsonPath().getString("meta.reason")).isNull();
    }

    @And("슬롯 목록은 비어 있고 사유는 {string} 이다")
    public void 빈_슬롯과_사유(String reason) {
        Response response = context.getLastResponse();
        assertThat(response.jsonPath().getList("slots")).isEmpty();
        assertThat(response.jsonPath().getString("meta.reason")).isEqualTo(reason);
    }

    @When("마지막 예약을 {string} 로 변경한다")
    public void 마지막_예약_상태_변경(String status) {
        context.setLastResponse(httpAdapter.changeStatus(context.getTenantSlug(), context.getLastBookingId(), status));
    }

    @And("마지막 예약에 대한 변경 이벤트가 {int}건 발행되었다")
    public void 변경_이벤트_수(int count) {
        assertThat(bookingEventPort.eventsFor(context.getLastBookingId())).hasSize(count);
    }

    @And("테넌트 하트비트가 기록되어 있다")
    public void 하트비트가_기록되어_있다() {
        Response response = httpAdapter.getHeartbeat(context.getTenantSlug());
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("lastBookingChangeAt")).isNotNull();
    }

    private Response requestBooking(String email, String localStart, String idempotencyKey) {
        return httpAdapter.createBooking(context.getTenantSlug(), email, context.getServiceId(),
                context.getStaffId(), toOffset(localStart), idempotencyKey);
    }

    private void remember(Response response) {
        context.setLastResponse(response);
        context.setLastBookingId(response.jsonPath().getLong("booking.id"));
        context.setLastCustomerId(response.jsonPath().getLong("booking.customerId"));
    }

    private Map<String, Object> slot(String time) {
        List<Map<String, Object>> slots = context.getLastResponse().jsonPath().getList("slots");
        return slots.stream()
                .filter(slot -> time.equals(slot.get("time")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("slot not found: " + time));
    }

    private OffsetDateTime toOffset(String localStart) {
        return LocalDateTime.parse(localStart).atZone(context.getZoneId()).toOffsetDateTime();
    }

    private List<Response> runConcurrently(int count, IntFunction<Response> request) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(count);
        CountDownLatch startGate = new CountDownLatch(1);
        List<CompletableFuture<Response>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < count; i++) {
                int index = i;
                futures.add(CompletableFuture.supplyAsync(() -> {
                    awaitQuietly(startGate);
                    return request.apply(index);
                }, executor));
            }
            startGate.countDown();
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } finally {
            executor.shutdown();
            executor.awaitTermination(30, TimeUnit.SECONDS);
        }

        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
