package personal.bookly.core.membership.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.bookly.core.membership.application.port.in.ConsumeMembershipUseCase;
import personal.bookly.core.membership.application.port.in.ConsumeNextCommand;
import personal.bookly.core.membership.application.port.in.ManageMembershipUseCase;
import personal.bookly.core.membership.application.port.in.SubscribeMembershipCommand;
import personal.bookly.core.membership.application.port.in.SubscribeMembershipUseCase;
import personal.bookly.core.membership.domain.exception.NoEligibleEntitlementException;
import personal.bookly.core.membership.domain.model.ConsumeOutcome;
import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.MembershipStatus;
import personal.bookly.core.membership.domain.model.SubscribeOutcome;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CustomerMembershipController.class)
@DisplayName("Customer Membership API 단위 테스트")
class CustomerMembershipControllerTest {

    private static final Instant NOW = Instant.parse("2030-01-07T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConsumeMembershipUseCase consumeMembershipUseCase;
    @MockBean
    private SubscribeMembershipUseCase subscribeMembershipUseCase;
    @MockBean
    private ManageMembershipUseCase manageMembershipUseCase;

    @Test
    @DisplayName("consume-next 성공 시 잔액과 alreadyDebited=false 반환")
    void consumeNext() throws Exception {
        // Given
        given(consumeMembershipUseCase.consumeNext(any(ConsumeNextCommand.class)))
                .willReturn(new ConsumeOutcome(membership(300, 0), false));

        // When & Then
        mockMvc.perform(post("/api/v1/customer-memberships/consume-next").param("tenant", "salon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\": 7, \"bookingId\": 500, \"minutesToDebit\": 60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyDebited").value(false))
                .andExpect(jsonPath("$.bookingId").value(500))
                .andExpect(jsonPath("$.customerMembershipId").value(3))
                .andExpect(jsonPath("$.membership.minutesRemaining").value(300))
                .andExpect(jsonPath("$.membership.status").value("active"));

        verify(consumeMembershipUseCase).consumeNext(argThat(command ->
                command.minutesToDebit() == 60 && command.usesToDebit() == 0 && command.bookingId() == 500L));
    }

    @Test
    @DisplayName("bookingId 누락은 400")
    void consumeNextWithoutBooking() throws Exception {
        mockMvc.perform(post("/api/v1/customer-memberships/consume-next").param("tenant", "salon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\": 7, \"minutesToDebit\": 60}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bookingId is required (must be a real booking id)."));

        verifyNoInteractions(consumeMembershipUseCase);
    }

    @Test
    @DisplayName("차감량이 모두 0이면 400")
    void consumeNextNothingToDebit() throws Exception {
        mockMvc.perform(post("/api/v1/customer-memberships/consume-next").param("tenant", "salon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\": 7, \"bookingId\": 500}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Nothing to debit."));
    }

    @Test
    @DisplayName("조건을 만족하는 이용권이 없으면 409")
    void consumeNextNoEntitlement() throws Exception {
        // Given
        given(consumeMembershipUseCase.consumeNext(any(ConsumeNextCommand.class)))
                .willThrow(new NoEligibleEntitlementException());

        // When & Then
        mockMvc.perform(post("/api/v1/customer-memberships/consume-next").param("tenant", "salon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\": 7, \"bookingId\": 500, \"usesToDebit\": 1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("M001"));
    }

    @Test
    @DisplayName("신규 구독은 201, 기존 유효 이용권은 200")
    void subscribe() throws Exception {
        // Given
        given(subscribeMembershipUseCase.subscribe(any(SubscribeMembershipCommand.class)))
                .willReturn(new SubscribeOutcome(membership(600, 10), false))
                .willReturn(new SubscribeOutcome(membership(600, 10), true));

        // When & Then
        mockMvc.perform(post("/api/v1/customer-memberships/subscribe").param("tenant", "salon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\": 7, \"membershipPlanId\": 2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.alreadyActive").value(false))
                .andExpect(jsonPath("$.data.membership.usesRemaining").value(10));

        mockMvc.perform(post("/api/v1/customer-memberships/subscribe").param("tenant", "salon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\": 7, \"membershipPlanId\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.alreadyActive").value(true));
    }

    private CustomerMembership membership(long minutes, long uses) {
        return new CustomerMembership(3L, 1L, 7L, 2L, MembershipStatus.ACTIVE, NOW, null, minutes, uses, NOW);
    }
}
