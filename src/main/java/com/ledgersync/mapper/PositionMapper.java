package com.ledgersync.mapper;

import com.ledgersync.domain.model.Position;
import com.ledgersync.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

/**
 * MapStruct mapper between Position domain model and PositionEntity.
 *
 * <p>{@link #updateEntity} copies mutable fields onto a managed entity so JPA dirty checking
 * writes them; the key columns (id, broker, symbol) are never overwritten.
 */
@Mapper
public interface PositionMapper {

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "broker", ignore = true)
    @Mapping(target = "symbol", ignore = true)
    void updateEntity(Position position, @MappingTarget PositionEntity entity);
}
