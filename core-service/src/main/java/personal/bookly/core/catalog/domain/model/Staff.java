package personal.bookly.core.catalog.domain.model;

/**
 * Staff Domain Model
 */
public record Staff(Long id, Long tenantId, String name, boolean active) {
}
