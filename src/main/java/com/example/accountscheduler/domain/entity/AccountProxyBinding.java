package com.example.accountscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Sticky proxy of an account, maintained by the account directory.
 * Read-only from the scheduler's side.
 */
@Entity
@Table(name = "account_proxy_bindings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountProxyBinding {

    @Id
    @Column(name = "account_id", length = 100)
    private String accountId;

    @Column(name = "proxy_id", nullable = false, length = 100)
    private String proxyId;

    @Column(name = "bound_at", nullable = false)
    private Instant boundAt;
}
