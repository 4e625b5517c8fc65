package com.example.accountscheduler.domain.repository;

import com.example.accountscheduler.domain.entity.AccountProxyBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountProxyBindingRepository extends JpaRepository<AccountProxyBinding, String> {
}
