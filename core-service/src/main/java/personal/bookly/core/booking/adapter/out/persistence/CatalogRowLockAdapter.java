package personal.bookly.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bookly.core.booking.application.port.out.BookingLockPort;
import personal.bookly.core.catalog.application.port.out.ResourceRepository;
import personal.bookly.core.catalog.application.port.out.ServiceCatalogRepository;
import personal.bookly.core.catalog.application.port.out.StaffRepository;
import personal.bookly.core.catalog.domain.exception.ResourceNotFoundException;
import personal.bookly.core.catalog.domain.exception.ServiceNotFoundException;
import personal.bookly.core.catalog.domain.exception.StaffNotFoundException;

/**
 * Catalog Row Lock Adapter
 * 카탈로그 행을 잠금 기준(anchor)으로 사용하는 BookingLockPort 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogRowLockAdapter implements BookingLockPort {

    private final StaffRepository staffRepository;
    private final ResourceRepository resourceRepository;
    private final ServiceCatalogRepository serviceCatalogRepository;

    @Override
    public void lockStaff(Long tenantId, Long staffId) {
        staffRepository.findByIdForUpdate(staffId)
                .filter(staff -> tenantId.equals(staff.tenantId()))
                .orElseThrow(() -> new StaffNotFoundException(staffId));
        log.debug("Staff anchor locked: tenantId={}, staffId={}", tenantId, staffId);
    }

    @Override
    public void lockResource(Long tenantId, Long resourceId) {
        resourceRepository.findByIdForUpdate(resourceId)
                .filter(resource -> tenantId.equals(resource.tenantId()))
                .orElseThrow(() -> new ResourceNotFoundException(resourceId));
        log.debug("Resource anchor locked: tenantId={}, resourceId={}", tenantId, resourceId);
    }

    @Override
    public void lockService(Long tenantId, Long serviceId) {
        serviceCatalogRepository.findByIdForUpdate(serviceId)
                .filter(service -> tenantId.equals(service.tenantId()))
                .orElseThrow(() -> new ServiceNotFoundException(serviceId));
        log.debug("Service anchor locked: tenantId={}, serviceId={}", tenantId, serviceId);
    }
}
