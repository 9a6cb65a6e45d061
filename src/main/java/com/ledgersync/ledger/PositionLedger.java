package com.ledgersync.ledger;

import com.ledgersync.domain.model.Position;
import com.ledgersync.entity.PositionEntity;
import com.ledgersync.exception.ResourceNotFoundException;
import com.ledgersync.mapper.PositionMapper;
import com.ledgersync.repository.jpa.PositionJpaRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Domain-level access to ledger positions.
 *
 * <p>Callers own the transaction: reconciliation and valuation each wrap a whole batch of
 * writes in one unit of work.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final PositionJpaRepository positionJpaRepository;
    private final PositionMapper positionMapper = Mappers.getMapper(PositionMapper.class);

    public PositionLedger(PositionJpaRepository positionJpaRepository) {
        this.positionJpaRepository = positionJpaRepository;
    }

    public List<Position> findByBroker(String broker) {
        return positionMapper.toDomainList(positionJpaRepository.findByBroker(broker));
    }

    public List<Position> findAll() {
        return positionMapper.toDomainList(positionJpaRepository.findAll());
    }

    public Optional<Position> find(String broker, String symbol, String strategy) {
        return positionJpaRepository
                .findByBrokerAndSymbolAndStrategy(broker, symbol, strategy)
                .map(positionMapper::toDomain);
    }

    /** Distinct strategies holding positions at the broker, uncategorized excluded. */
    public List<String> findStrategies(String broker) {
        return positionJpaRepository.findDistinctStrategies(broker, Position.UNCATEGORIZED);
    }

    /** Inserts a new row, assigning an id when the position has none. */
    public Position insert(Position position) {
        if (position.getId() == null) {
            position.setId(UUID.randomUUID().toString());
        }
        PositionEntity saved = positionJpaRepository.save(positionMapper.toEntity(position));
        log.debug("Inserted position {} {} [{}] qty={}", saved.getBroker(), saved.getSymbol(), saved.getStrategy(), saved.getQuantity());
        return positionMapper.toDomain(saved);
    }

    /** Copies the mutable fields of {@code position} onto its stored row. */
    public Position update(Position position) {
        PositionEntity entity = positionJpaRepository
                .findById(position.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Position", position.getId()));
        positionMapper.updateEntity(position, entity);
        return positionMapper.toDomain(positionJpaRepository.save(entity));
    }

    public void updateAll(Collection<Position> positions) {
        List<PositionEntity> entities = new ArrayList<>(positions.size());
        for (Position position : positions) {
            PositionEntity entity = positionJpaRepository
                    .findById(position.getId())
                    .orElseThrow(() -> new ResourceNotFoundException("Position", position.getId()));
            positionMapper.updateEntity(position, entity);
            entities.add(entity);
        }
        positionJpaRepository.saveAll(entities);
    }

    public void delete(Position position) {
        positionJpaRepository.deleteById(position.getId());
        log.debug("Deleted position {} {} [{}]", position.getBroker(), position.getSymbol(), position.getStrategy());
    }
}
