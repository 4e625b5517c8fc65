package com.example.accountscheduler.service;

import com.example.accountscheduler.domain.entity.AccountProxyBinding;
import com.example.accountscheduler.domain.repository.AccountProxyBindingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Read-only view of the external account directory. Accounts and proxies are joined by id only.
 */
@Service
@RequiredArgsConstructor
public class AccountDirectory {

    private final AccountProxyBindingRepository bindingRepository;

    /**
     * Sticky proxy bound to the account, if any
     */
    @Transactional(readOnly = true)
    public Optional<String> proxyFor(String accountId) {
        return bindingRepository.findById(accountId).map(AccountProxyBinding::getProxyId);
    }
}
