package com.ledgersync.mapper;

import com.ledgersync.domain.model.Balance;
import com.ledgersync.entity.BalanceEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper between Balance domain model and BalanceEntity. Ids are database-assigned. */
@Mapper
public interface BalanceMapper {

    @Mapping(target = "id", ignore = true)
    BalanceEntity toEntity(Balance balance);

    Balance toDomain(BalanceEntity entity);

    List<Balance> toDomainList(List<BalanceEntity> entities);

    List<BalanceEntity> toEntityList(List<Balance> balances);
}
