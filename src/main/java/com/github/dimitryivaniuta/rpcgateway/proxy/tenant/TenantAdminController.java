package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import com.github.dimitryivaniuta.rpcgateway.proxy.plan.PlanType;
import com.github.dimitryivaniuta.rpcgateway.proxy.support.TokenMasking;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/tenants")
public class TenantAdminController {

    private final TenantAccountRepository tenantRepo;
    private final TenantTokenService tokenService;
    private final TenantAdmissionService admissionService;

    // ---------- DTOs ----------
    public record CreateTenantRequest(
            @NotBlank @Size(max = 32) String plan,
            @Size(max = 255) String address
    ) {}

    public record CreateTenantResponse(
            String token,        // returned ONCE
            String plan,
            Instant createdAt
    ) {}

    public record TenantUsageResponse(
            String token,        // masked
            String plan,
            long currentMonthRequests,
            Long monthlyLimit,   // null = unbounded
            Instant monthResetAt,
            Instant createdAt
    ) {}

    public record ChangePlanRequest(@NotBlank @Size(max = 32) String plan) {}

    // ---------- endpoints ----------

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Transactional
    public CreateTenantResponse createTenant(@Valid @RequestBody CreateTenantRequest req) {
        PlanType plan = requirePlan(req.plan());

        TenantAccount saved = tenantRepo.save(TenantAccount.builder()
                .token(tokenService.generateToken())
                .plan(plan.id())
                .currentMonthRequests(0)
                .address(req.address())
                .build());

        // a NOT_FOUND actor may be cached for this token
        admissionService.invalidate(saved.getToken());
        log.info("Provisioned tenant {} on plan {}", TokenMasking.mask(saved.getToken()), plan.id());
        return new CreateTenantResponse(saved.getToken(), saved.getPlan(), saved.getCreatedAt());
    }

    @GetMapping
    public List<TenantUsageResponse> listTenants() {
        return tenantRepo.findAll().stream().map(this::toUsageResponse).toList();
    }

    @GetMapping("/{token}")
    public TenantUsageResponse getTenant(@PathVariable String token) {
        return toUsageResponse(find(token));
    }

    @PutMapping("/{token}/plan")
    @Transactional
    public TenantUsageResponse changePlan(@PathVariable String token, @Valid @RequestBody ChangePlanRequest req) {
        PlanType plan = requirePlan(req.plan());
        TenantAccount account = find(token);
        account.setPlan(plan.id());
        TenantAccount saved = tenantRepo.save(account);
        admissionService.invalidate(token);
        return toUsageResponse(saved);
    }

    // ---------- mapping ----------
    private TenantAccount find(String token) {
        return tenantRepo.findById(token)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tenant not found"));
    }

    private static PlanType requirePlan(String id) {
        return PlanType.fromId(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown plan: " + id));
    }

    private TenantUsageResponse toUsageResponse(TenantAccount t) {
        Long limit = PlanType.fromId(t.getPlan()).orElse(PlanType.HOBBYIST).monthlyLimit();
        return new TenantUsageResponse(
                TokenMasking.mask(t.getToken()),
                t.getPlan(),
                t.getCurrentMonthRequests(),
                limit,
                t.getMonthResetAt(),
                t.getCreatedAt()
        );
    }
}
