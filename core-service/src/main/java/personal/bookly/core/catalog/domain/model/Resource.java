package personal.bookly.core.catalog.domain.model;

/**
 * Resource Domain Model
 * 예약 대상 공간/장비 (룸, 코트, 의자 등)
 */
public record Resource(Long id, Long tenantId, String name, boolean active) {
}
