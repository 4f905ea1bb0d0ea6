package com.flagship.transaction_engine.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findByAccountId(String accountId);

    boolean existsByAccountId(String accountId);

    boolean existsByPhone(String phone);

    List<AccountEntity> findAllByOrderByIdAsc();
}
