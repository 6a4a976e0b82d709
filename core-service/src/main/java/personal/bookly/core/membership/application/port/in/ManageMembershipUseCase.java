package personal.bookly.core.membership.application.port.in;

import personal.bookly.core.membership.domain.model.CustomerMembership;
import personal.bookly.core.membership.domain.model.MembershipLedgerEntry;

import java.util.List;

/**
 * Manage Membership UseCase (Input Port)
 * 이용권 조회, 원장 조회, 보관 처리
 */
public interface ManageMembershipUseCase {

    List<CustomerMembership> listByCustomer(String tenantSlug, Long customerId);

    /**
     * 최신순 원장 (최대 200건)
     */
    List<MembershipLedgerEntry> getLedger(String tenantSlug, Long membershipId);

    CustomerMembership archive(String tenantSlug, Long membershipId);
}
