package personal.bookly.core.acceptance.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import personal.bookly.core.booking.adapter.out.persistence.JpaBookingRepository;
import personal.bookly.core.booking.domain.model.BookingStatus;

import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 인수 테스트 데이터 준비
 * 카탈로그(서비스/스태프/플랜)는 별도 관리 화면 소관이라 API가 없으므로 직접 삽입한다
 */
@Slf4j
public class BooklyTestFixture {

    private static final String[] TABLES_IN_DELETE_ORDER = {
            "membership_ledger", "bookings", "customer_memberships", "membership_plans", "customers",
            "staff_schedule_overrides", "staff_weekly_schedules", "blackouts", "tenant_hours",
            "services", "staff", "resources", "tenants"
    };

    private final JdbcTemplate jdbcTemplate;
    private final JpaBookingRepository jpaBookingRepository;

    public BooklyTestFixture(JdbcTemplate jdbcTemplate, JpaBookingRepository jpaBookingRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.jpaBookingRepository = jpaBookingRepository;
    }

    /**
     * 모든 테스트 데이터 초기화 (시나리오 시작 시)
     */
    public void clearAllData() {
        for (String table : TABLES_IN_DELETE_ORDER) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
        log.debug(">>> Fixture: all tables cleared");
    }

    public Long createTenant(String slug, String timezone) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("slug", slug);
        row.put("timezone", timezone);
        row.put("currency", "KRW");
        row.put("require_phone", false);
        row.put("created_at", Timestamp.from(Instant.now()));
        return insert("tenants", row);
    }

    /**
     * 0(일)..6(토) 모든 요일을 같은 영업시간으로 설정
     */
    public void openEveryDay(Long tenantId, LocalTime open, LocalTime close) {
        for (int day = 0; day < 7; day++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("tenant_id", tenantId);
            row.put("day_of_week", day);
            row.put("open_time", Time.valueOf(open));
            row.put("close_time", Time.valueOf(close));
            row.put("is_closed", false);
            insert("tenant_hours", row);
        }
    }

    public Long createStaffRequiredService(Long tenantId, String name, int durationMinutes, int intervalMinutes) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("tenant_id", tenantId);
        row.put("name", name);
        row.put("duration_minutes", durationMinutes);
        row.put("slot_interval_minutes", intervalMinutes);
        row.put("max_parallel_bookings", 1);
        row.put("requires_staff", true);
        row.put("requires_resource", false);
        row.put("requires_confirmation", false);
        row.put("allow_membership", true);
        row.put("is_active", true);
        return insert("services", row);
    }

    public Long createStaff(Long tenantId, String name) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("tenant_id", tenantId);
        row.put("name", name);
        row.put("is_active", true);
        return insert("staff", row);
    }

    public void addWeeklyBlock(Long tenantId, Long staffId, int weekday, int startMinute, int endMinute) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("tenant_id", tenantId);
        row.put("staff_id", staffId);
        row.put("weekday", weekday);
        row.put("start_minute", startMinute);
        row.put("end_minute", endMinute);
        insert("staff_weekly_schedules", row);
    }

    public Long createMinutesPlan(Long tenantId, String name, int includedMinutes) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("tenant_id", tenantId);
        row.put("name", name);
        row.put("included_minutes", includedMinutes);
        row.put("included_uses", 0);
        row.put("validity_days", 30);
        row.put("is_active", true);
        return insert("membership_plans", row);
    }

    /**
     * 해당 시각에 시작하는 점유 상태(pending/confirmed) 예약 수
     */
    public long countOccupyingBookings(Long tenantId, Instant startTime) {
        return jpaBookingRepository.findAll().stream()
                .filter(b -> b.getTenantId().equals(tenantId))
                .filter(b -> b.getStartTime().equals(startTime))
                .filter(b -> BookingStatus.OCCUPYING.contains(b.getStatus()))
                .count();
    }

    public int countLedgerEntries(Long membershipId, String entryType) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM membership_ledger WHERE customer_membership_id = ? AND entry_type = ?",
                Integer.class, membershipId, entryType);
        return count == null ? 0 : count;
    }

    private Long insert(String table, Map<String, Object> row) {
        return new SimpleJdbcInsert(jdbcTemplate)
                .withTableName(table)
                .usingColumns(row.keySet().toArray(String[]::new))
                .usingGeneratedKeyColumns("id")
                .executeAndReturnKey(row)
                .longValue();
    }
}
