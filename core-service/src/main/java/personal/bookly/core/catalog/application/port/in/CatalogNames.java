package personal.bookly.core.catalog.application.port.in;

/**
 * 서비스/스태프/리소스 표시 이름 (없으면 null)
 */
public record CatalogNames(String serviceName, String staffName, String resourceName) {
}
