package com.ledgersync.repository.jpa;

import com.ledgersync.entity.AccountInfoEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the account_info table, keyed by broker. */
@Repository
public interface AccountInfoJpaRepository extends JpaRepository<AccountInfoEntity, String> {}
