package com.ledgersync.pnl;

import com.ledgersync.domain.enums.TradeStatus;
import com.ledgersync.domain.model.Trade;
import com.ledgersync.entity.TradeEntity;
import com.ledgersync.exception.BusinessException;
import com.ledgersync.exception.ResourceNotFoundException;
import com.ledgersync.mapper.TradeMapper;
import com.ledgersync.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trade lifecycle: OPEN -> FILLED | CANCELLED, each trade transitioning exactly once.
 *
 * <p>Realized P/L is computed when the trade is filled, against the position as it stands
 * at that moment, and is never recomputed afterwards.
 */
@Service
public class TradeService {

    private static final Logger log = LoggerFactory.getLogger(TradeService.class);

    private final TradeJpaRepository tradeJpaRepository;
    private final ProfitLossCalculator profitLossCalculator;
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    public TradeService(TradeJpaRepository tradeJpaRepository, ProfitLossCalculator profitLossCalculator) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.profitLossCalculator = profitLossCalculator;
    }

    @Transactional
    public Trade recordTrade(Trade trade) {
        if (trade.getQuantity() == null || trade.getQuantity().signum() <= 0) {
            throw new BusinessException("Trade quantity must be positive", Map.of("symbol", String.valueOf(trade.getSymbol())));
        }
        if (trade.getId() == null) {
            trade.setId(UUID.randomUUID().toString());
        }
        trade.setStatus(TradeStatus.OPEN);
        trade.setProfitLoss(null);
        trade.setClosedAt(null);
        if (trade.getCreatedAt() == null) {
            trade.setCreatedAt(LocalDateTime.now());
        }
        Trade saved = tradeMapper.toDomain(tradeJpaRepository.save(tradeMapper.toEntity(trade)));
        log.info(
                "Trade recorded: id={}, {} {} x {} [{}] at {}",
                saved.getId(),
                saved.getSide(),
                saved.getQuantity(),
                saved.getSymbol(),
                saved.getStrategy(),
                saved.getBroker());
        return saved;
    }

    /**
     * Marks an open trade filled and stores its realized P/L (null when none applies).
     *
     * @param executedPrice fill price; when null the price already on the trade is used
     * @throws ResourceNotFoundException when the trade does not exist
     * @throws BusinessException when the trade is not open
     */
    @Transactional
    public Trade markFilled(String tradeId, BigDecimal executedPrice) {
        TradeEntity entity = findOpen(tradeId);
        if (executedPrice != null) {
            entity.setExecutedPrice(executedPrice);
        }
        Trade trade = tradeMapper.toDomain(entity);
        BigDecimal profitLoss = profitLossCalculator.profitLoss(trade).orElse(null);

        entity.setStatus(TradeStatus.FILLED);
        entity.setProfitLoss(profitLoss);
        entity.setClosedAt(LocalDateTime.now());
        Trade filled = tradeMapper.toDomain(tradeJpaRepository.save(entity));
        log.info("Trade {} filled at {}: profit/loss={}", tradeId, filled.getExecutedPrice(), profitLoss);
        return filled;
    }

    /**
     * @throws ResourceNotFoundException when the trade does not exist
     * @throws BusinessException when the trade is not open
     */
    @Transactional
    public Trade markCancelled(String tradeId) {
        TradeEntity entity = findOpen(tradeId);
        entity.setStatus(TradeStatus.CANCELLED);
        entity.setClosedAt(LocalDateTime.now());
        Trade cancelled = tradeMapper.toDomain(tradeJpaRepository.save(entity));
        log.info("Trade {} cancelled", tradeId);
        return cancelled;
    }

    public Optional<Trade> getTrade(String tradeId) {
        Optional<Trade> trade = tradeJpaRepository.findById(tradeId).map(tradeMapper::toDomain);
        if (trade.isEmpty()) {
            log.warn("Trade not found: {}", tradeId);
        }
        return trade;
    }

    public List<Trade> getOpenTrades() {
        return tradeMapper.toDomainList(tradeJpaRepository.findByStatus(TradeStatus.OPEN));
    }

    public List<Trade> getAllTrades() {
        return tradeMapper.toDomainList(tradeJpaRepository.findAll());
    }

    public List<Trade> getTrades(String broker, String strategy) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByBrokerAndStrategy(broker, strategy));
    }

    /** Stored realized P/L; empty for unknown trades and trades without one. */
    public Optional<BigDecimal> getProfitLoss(String tradeId) {
        return getTrade(tradeId).map(Trade::getProfitLoss);
    }

    private TradeEntity findOpen(String tradeId) {
        TradeEntity entity =
                tradeJpaRepository.findById(tradeId).orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
        if (entity.getStatus() != TradeStatus.OPEN) {
            throw new BusinessException(
                    "Trade " + tradeId + " is already " + entity.getStatus(),
                    Map.of("tradeId", tradeId, "status", entity.getStatus().name()));
        }
        return entity;
    }
}
