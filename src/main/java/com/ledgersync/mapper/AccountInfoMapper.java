package com.ledgersync.mapper;

import com.ledgersync.domain.model.AccountInfo;
import com.ledgersync.entity.AccountInfoEntity;
import org.mapstruct.Mapper;

@Mapper
public interface AccountInfoMapper {

    AccountInfoEntity toEntity(AccountInfo accountInfo);

    AccountInfo toDomain(AccountInfoEntity entity);
}
