package com.ledgersync.mapper;

import com.ledgersync.domain.model.Trade;
import com.ledgersync.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between Trade domain model and TradeEntity. */
@Mapper
public interface TradeMapper {

    TradeEntity toEntity(Trade trade);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);
}
