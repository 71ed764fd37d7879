package com.github.dimitryivaniuta.rpcgateway.proxy.tenant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface TenantAccountRepository extends JpaRepository<TenantAccount, String> {

    /**
     * Forward-only usage write: a snapshot older than the stored row (earlier month, or same month
     * with a smaller counter) matches no row and is ignored.
     */
    @Modifying
    @Transactional
    @Query("""
        update TenantAccount t
           set t.currentMonthRequests = :requests,
               t.monthResetAt = :resetAt
         where t.token = :token
           and (t.monthResetAt < :resetAt
                or (t.monthResetAt = :resetAt and t.currentMonthRequests <= :requests))
        """)
    int updateUsage(@Param("token") String token,
                    @Param("requests") long requests,
                    @Param("resetAt") Instant resetAt);
}
