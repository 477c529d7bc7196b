package com.prediction.market.trading.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.Money;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.exception.InsufficientSharesException;
import com.prediction.market.trading.exception.InvalidTradeSizeException;
import com.prediction.market.trading.exception.PositionNotFoundException;
import com.prediction.market.trading.repositories.PositionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holdings per (user, market, side) with weighted-average entry price.
 *
 * A holding that drops below the dust epsilon is deleted rather than kept as a
 * near-zero row. Realized P&L is reported to the caller; the wallet is never touched here.
 */
@Slf4j
@RequiredArgsConstructor
public class PositionBook {

    private final PositionRepository positionRepository;
    private final Clock clock;
    private final BigDecimal epsilon;

    public Position credit(String userId, String marketId, Outcome side, BigDecimal shares, BigDecimal fillPrice) {
        if (shares == null || shares.signum() <= 0) {
            throw new InvalidTradeSizeException("shares", shares);
        }
        Instant now = clock.instant();
        String id = Position.idFor(userId, marketId, side);
        Position position = positionRepository.findById(id).orElse(null);

        if (position == null) {
            position = Position.builder()
                .id(id)
                .userId(userId)
                .marketId(marketId)
                .side(side)
                .shares(shares)
                .avgPrice(fillPrice.setScale(Money.SCALE, Money.ROUNDING_MODE))
                .createdAt(now)
                .updatedAt(now)
                .build();
        } else {
            BigDecimal held = position.getShares();
            BigDecimal total = held.add(shares);
            BigDecimal cost = position.getAvgPrice().multiply(held).add(fillPrice.multiply(shares));
            position.setShares(total);
            position.setAvgPrice(cost.divide(total, Money.SCALE, Money.ROUNDING_MODE));
            position.setUpdatedAt(now);
        }

        Position saved = positionRepository.save(position);
        log.debug("Position credited: id={}, shares={}, avgPrice={}", id, saved.getShares(), saved.getAvgPrice());
        return saved;
    }

    /**
     * @throws PositionNotFoundException if the user holds nothing on that side
     * @throws InsufficientSharesException if {@code shares} exceeds the holding
     */
    public PositionDebit debit(String userId, String marketId, Outcome side, BigDecimal shares, BigDecimal fillPrice) {
        if (shares == null || shares.signum() <= 0) {
            throw new InvalidTradeSizeException("shares", shares);
        }
        Position position = position(userId, marketId, side)
            .orElseThrow(() -> new PositionNotFoundException(userId, marketId, side));
        BigDecimal held = position.getShares();
        if (shares.compareTo(held) > 0) {
            throw new InsufficientSharesException(userId, marketId, side, shares, held);
        }

        BigDecimal remaining = held.subtract(shares);
        BigDecimal pnl = fillPrice.subtract(position.getAvgPrice()).multiply(shares)
            .setScale(Money.SCALE, RoundingMode.HALF_EVEN);
        boolean closed = remaining.compareTo(epsilon) < 0;

        if (closed) {
            positionRepository.delete(position);
            remaining = BigDecimal.ZERO.setScale(Money.SCALE);
        } else {
            position.setShares(remaining);
            position.setUpdatedAt(clock.instant());
            positionRepository.save(position);
        }

        log.debug("Position debited: id={}, sold={}, remaining={}, closed={}", position.getId(), shares, remaining, closed);
        return PositionDebit.builder()
            .side(side)
            .sharesSold(shares)
            .avgPrice(position.getAvgPrice())
            .realizedPnl(pnl)
            .remainingShares(remaining)
            .closed(closed)
            .build();
    }

    public Optional<Position> position(String userId, String marketId, Outcome side) {
        return positionRepository.findById(Position.idFor(userId, marketId, side));
    }

    public List<Position> openPositions(String userId, String marketId) {
        return positionRepository.findByUserIdAndMarketId(userId, marketId);
    }

    public List<Position> positionsOf(String userId) {
        return positionRepository.findByUserId(userId);
    }
}
