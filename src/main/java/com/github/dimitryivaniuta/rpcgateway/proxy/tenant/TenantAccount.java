package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "tenant_account")
public class TenantAccount {

    /** Opaque bearer token; issued once and never rotated in place. */
    @Id
    @Column(name = "token", nullable = false, updatable = false, length = 128)
    private String token;

    @Column(name = "plan", nullable = false, length = 32)
    @Builder.Default
    private String plan = "hobbyist";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "current_month_requests", nullable = false)
    private long currentMonthRequests;

    @Column(name = "month_reset_at", nullable = false)
    private Instant monthResetAt;

    @Column(name = "address", length = 255)
    private String address;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (monthResetAt == null) monthResetAt = now;
    }
}
