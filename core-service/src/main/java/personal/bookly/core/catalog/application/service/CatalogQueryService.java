package personal.bookly.core.catalog.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.catalog.application.port.in.CatalogNames;
import personal.bookly.core.catalog.application.port.in.GetCatalogUseCase;
import personal.bookly.core.catalog.application.port.out.ResourceRepository;
import personal.bookly.core.catalog.application.port.out.ServiceCatalogRepository;
import personal.bookly.core.catalog.application.port.out.StaffRepository;
import personal.bookly.core.catalog.domain.exception.ResourceNotFoundException;
import personal.bookly.core.catalog.domain.exception.ServiceNotFoundException;
import personal.bookly.core.catalog.domain.exception.StaffNotFoundException;
import personal.bookly.core.catalog.domain.model.BookableService;
import personal.bookly.core.catalog.domain.model.Resource;
import personal.bookly.core.catalog.domain.model.Staff;

/**
 * Catalog Query Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogQueryService implements GetCatalogUseCase {

    private final ServiceCatalogRepository serviceCatalogRepository;
    private final StaffRepository staffRepository;
    private final ResourceRepository resourceRepository;

    @Override
    public BookableService getService(Long tenantId, Long serviceId) {
        return serviceCatalogRepository.findByIdAndTenantId(serviceId, tenantId)
                .filter(BookableService::active)
                .orElseThrow(() -> {
                    log.warn("Service not found: tenantId={}, serviceId={}", tenantId, serviceId);
                    return new ServiceNotFoundException(serviceId);
                });
    }

    @Override
    public Staff getStaff(Long tenantId, Long staffId) {
        return staffRepository.findByIdAndTenantId(staffId, tenantId)
                .orElseThrow(() -> {
                    log.warn("Staff not found: tenantId={}, staffId={}", tenantId, staffId);
                    return new StaffNotFoundException(staffId);
                });
    }

    @Override
    public Resource getResource(Long tenantId, Long resourceId) {
        return resourceRepository.findByIdAndTenantId(resourceId, tenantId)
                .orElseThrow(() -> {
                    log.warn("Resource not found: tenantId={}, resourceId={}", tenantId, resourceId);
                    return new ResourceNotFoundException(resourceId);
                });
    }

    @Override
    public CatalogNames findNames(Long tenantId, Long serviceId, Long staffId, Long resourceId) {
        String serviceName = serviceId == null ? null : serviceCatalogRepository.findByIdAndTenantId(serviceId, tenantId)
                .map(BookableService::name).orElse(null);
        String staffName = staffId == null ? null : staffRepository.findByIdAndTenantId(staffId, tenantId)
                .map(Staff::name).orElse(null);
        String resourceName = resourceId == null ? null : resourceRepository.findByIdAndTenantId(resourceId, tenantId)
                .map(Resource::name).orElse(null);
        return new CatalogNames(serviceName, staffName, resourceName);
    }
}
