package com.example.accountscheduler.domain.entity;

import com.example.accountscheduler.domain.enums.Platform;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class RateWindowId implements Serializable {

    @Column(name = "account_id", length = 100)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", length = 30)
    private Platform platform;
}
