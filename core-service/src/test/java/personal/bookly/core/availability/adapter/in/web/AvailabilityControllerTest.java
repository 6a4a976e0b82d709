package personal.bookly.core.availability.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import personal.bookly.core.availability.application.port.in.AvailabilityQuery;
import personal.bookly.core.availability.application.port.in.GetAvailabilityUseCase;
import personal.bookly.core.availability.domain.model.AvailabilityMeta;
import personal.bookly.core.availability.domain.model.AvailabilityReason;
import personal.bookly.core.availability.domain.model.DayAvailability;
import personal.bookly.core.availability.domain.model.ScheduleSource;
import personal.bookly.core.availability.domain.model.Slot;
import personal.bookly.core.catalog.domain.model.AvailabilityBasis;
import personal.bookly.core.tenant.domain.exception.TenantNotFoundException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AvailabilityController.class)
@DisplayName("Availability API 단위 테스트")
class AvailabilityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetAvailabilityUseCase getAvailabilityUseCase;

    @Test
    @DisplayName("슬롯과 메타를 snake_case 로 응답")
    void returnsSlotsInSnakeCase() throws Exception {
        // Given
        AvailabilityMeta meta = new AvailabilityMeta(60, 30, 2, AvailabilityBasis.STAFF, null,
                ScheduleSource.STAFF_SCHEDULE);
        given(getAvailabilityUseCase.getAvailability(any(AvailabilityQuery.class))).willReturn(new DayAvailability(
                List.of(new Slot(540, true, 2, 1, 0), new Slot(570, false, 2, 0, 1)), meta));

        // When & Then
        mockMvc.perform(get("/api/v1/availability")
                        .param("tenant", "salon")
                        .param("service", "10")
                        .param("date", "2030-01-07")
                        .param("staff", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slots[0].time").value("09:00"))
                .andExpect(jsonPath("$.slots[0].label").value("9:00 AM"))
                .andExpect(jsonPath("$.slots[0].available").value(true))
                .andExpect(jsonPath("$.slots[0].overlaps").value(1))
                .andExpect(jsonPath("$.slots[1].blackout_hits").value(1))
                .andExpect(jsonPath("$.meta.duration_minutes").value(60))
                .andExpect(jsonPath("$.meta.slot_interval_minutes").value(30))
                .andExpect(jsonPath("$.meta.max_parallel_bookings").value(2))
                .andExpect(jsonPath("$.meta.availability_basis").value("staff"))
                .andExpect(jsonPath("$.meta.schedule_source").value("staff_schedule"))
                .andExpect(jsonPath("$.meta.reason").doesNotExist());
    }

    @Test
    @DisplayName("의도적으로 빈 결과는 200 + reason")
    void emptyWithReason() throws Exception {
        // Given
        AvailabilityMeta meta = new AvailabilityMeta(60, 60, 1, AvailabilityBasis.NONE,
                AvailabilityReason.TENANT_CLOSED, ScheduleSource.TENANT_HOURS);
        given(getAvailabilityUseCase.getAvailability(any(AvailabilityQuery.class)))
                .willReturn(DayAvailability.empty(meta));

        // When & Then
        mockMvc.perform(get("/api/v1/availability")
                        .param("tenant", "salon")
                        .param("service", "10")
                        .param("date", "2030-01-07"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slots").isEmpty())
                .andExpect(jsonPath("$.meta.reason").value("tenant_closed"));
    }

    @Test
    @DisplayName("날짜 형식이 잘못되면 400")
    void invalidDate() throws Exception {
        mockMvc.perform(get("/api/v1/availability")
                        .param("tenant", "salon")
                        .param("service", "10")
                        .param("date", "07/01/2030"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("서비스 파라미터가 없으면 400")
    void missingService() throws Exception {
        mockMvc.perform(get("/api/v1/availability")
                        .param("tenant", "salon")
                        .param("date", "2030-01-07"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing required parameter: service"));
    }

    @Test
    @DisplayName("없는 테넌트는 404")
    void unknownTenant() throws Exception {
        // Given
        given(getAvailabilityUseCase.getAvailability(any(AvailabilityQuery.class)))
                .willThrow(new TenantNotFoundException("nope"));

        // When & Then
        mockMvc.perform(get("/api/v1/availability")
                        .param("tenant", "nope")
                        .param("service", "10")
                        .param("date", "2030-01-07"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("T001"));
    }
}
