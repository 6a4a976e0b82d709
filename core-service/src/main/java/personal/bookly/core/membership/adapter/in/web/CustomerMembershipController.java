package personal.bookly.core.membership.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bookly.common.web.ApiResponse;
import personal.bookly.core.membership.adapter.in.web.dto.ConsumeNextRequest;
import personal.bookly.core.membership.adapter.in.web.dto.ConsumeNextResponse;
import personal.bookly.core.membership.adapter.in.web.dto.CustomerMembershipResponse;
import personal.bookly.core.membership.adapter.in.web.dto.LedgerEntryResponse;
import personal.bookly.core.membership.adapter.in.web.dto.SubscribeMembershipRequest;
import personal.bookly.core.membership.adapter.in.web.dto.SubscribeMembershipResponse;
import personal.bookly.core.membership.application.port.in.ConsumeMembershipUseCase;
import personal.bookly.core.membership.application.port.in.ManageMembershipUseCase;
import personal.bookly.core.membership.application.port.in.SubscribeMembershipUseCase;
import personal.bookly.core.membership.domain.model.ConsumeOutcome;
import personal.bookly.core.membership.domain.model.SubscribeOutcome;

import java.util.List;

/**
 * Customer Membership API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/customer-memberships")
@RequiredArgsConstructor
public class CustomerMembershipController {

    private final ConsumeMembershipUseCase consumeMembershipUseCase;
    private final SubscribeMembershipUseCase subscribeMembershipUseCase;
    private final ManageMembershipUseCase manageMembershipUseCase;

    /**
     * 이용권 차감 (예약당 1회)
     * POST /api/v1/customer-memberships/consume-next?tenant={slug}
     */
    @PostMapping("/consume-next")
    public ResponseEntity<ConsumeNextResponse> consumeNext(
            @RequestParam("tenant") String tenant,
            @Valid @RequestBody ConsumeNextRequest request
    ) {
        log.info("Consume next membership: tenant={}, customerId={}, bookingId={}, minutes={}, uses={}",
                tenant, request.customerId(), request.bookingId(), request.minutesToDebit(), request.usesToDebit());

        ConsumeOutcome outcome = consumeMembershipUseCase.consumeNext(request.toCommand(tenant));

        return ResponseEntity.ok(ConsumeNextResponse.from(outcome, request.bookingId()));
    }

    @PostMapping("/subscribe")
    public ResponseEntity<ApiResponse<SubscribeMembershipResponse>> subscribe(
            @RequestParam("tenant") String tenant,
            @Valid @RequestBody SubscribeMembershipRequest request
    ) {
        log.info("Subscribe membership: tenant={}, customerId={}, planId={}",
                tenant, request.customerId(), request.membershipPlanId());

        SubscribeOutcome outcome = subscribeMembershipUseCase.subscribe(request.toCommand(tenant));
        HttpStatus status = outcome.alreadyActive() ? HttpStatus.OK : HttpStatus.CREATED;

        return ResponseEntity.status(status)
                .body(ApiResponse.success("Membership subscribed", SubscribeMembershipResponse.from(outcome)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<CustomerMembershipResponse>>> list(
            @RequestParam("tenant") String tenant,
            @RequestParam("customerId") Long customerId
    ) {
        List<CustomerMembershipResponse> response = manageMembershipUseCase.listByCustomer(tenant, customerId).stream()
                .map(CustomerMembershipResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Memberships", response));
    }

    @GetMapping("/{membershipId}/ledger")
    public ResponseEntity<ApiResponse<List<LedgerEntryResponse>>> ledger(
            @RequestParam("tenant") String tenant,
            @PathVariable Long membershipId
    ) {
        List<LedgerEntryResponse> response = manageMembershipUseCase.getLedger(tenant, membershipId).stream()
                .map(LedgerEntryResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Membership ledger", response));
    }

    @PatchMapping("/{membershipId}/archive")
    public ResponseEntity<ApiResponse<CustomerMembershipResponse>> archive(
            @RequestParam("tenant") String tenant,
            @PathVariable Long membershipId
    ) {
        log.info("Archive membership: tenant={}, membershipId={}", tenant, membershipId);

        CustomerMembershipResponse response = CustomerMembershipResponse.from(
                manageMembershipUseCase.archive(tenant, membershipId));

        return ResponseEntity.ok(ApiResponse.success("Membership archived", response));
    }
}
