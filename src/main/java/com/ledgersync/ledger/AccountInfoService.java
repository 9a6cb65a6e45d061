package com.ledgersync.ledger;

import com.ledgersync.domain.model.AccountInfo;
import com.ledgersync.entity.AccountInfoEntity;
import com.ledgersync.mapper.AccountInfoMapper;
import com.ledgersync.repository.jpa.AccountInfoJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Last reported account value per broker; one row per broker, overwritten in place. */
@Service
public class AccountInfoService {

    private static final Logger log = LoggerFactory.getLogger(AccountInfoService.class);

    private final AccountInfoJpaRepository accountInfoJpaRepository;
    private final AccountInfoMapper accountInfoMapper = Mappers.getMapper(AccountInfoMapper.class);

    public AccountInfoService(AccountInfoJpaRepository accountInfoJpaRepository) {
        this.accountInfoJpaRepository = accountInfoJpaRepository;
    }

    public AccountInfo upsert(String broker, BigDecimal value, LocalDateTime updatedAt) {
        AccountInfoEntity entity = accountInfoJpaRepository
                .findById(broker)
                .orElseGet(() -> AccountInfoEntity.builder().broker(broker).build());
        entity.setValue(value);
        entity.setUpdatedAt(updatedAt);
        log.debug("Account value for {} set to {}", broker, value);
        return accountInfoMapper.toDomain(accountInfoJpaRepository.save(entity));
    }

    public Optional<AccountInfo> get(String broker) {
        return accountInfoJpaRepository.findById(broker).map(accountInfoMapper::toDomain);
    }
}
