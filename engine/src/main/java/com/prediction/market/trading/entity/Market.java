package com.prediction.market.trading.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import com.prediction.market.trading.engine.MarketPool;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A single binary-outcome pool.
 *
 * yesPool + noPool always equals liquidity; the YES price is yesPool / liquidity.
 * Pool fields are written by MarketLedger only.
 */
@Document(collection = "markets")
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Market {
    @Id
    private String id;

    private String question;
    private BigDecimal yesPool;
    private BigDecimal noPool;
    private BigDecimal liquidity;   // seed + net buys - gross sells
    private BigDecimal liquidityB;  // curve depth
    private boolean resolved;
    private Boolean resolution;     // null until resolved
    private Instant endDate;
    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isExpiredAt(Instant now) {
        return endDate != null && !now.isBefore(endDate);
    }

    public MarketPool toPool() {
        return new MarketPool(yesPool, noPool, liquidityB, version);
    }

    public Market copy() {
        return toBuilder().build();
    }
}
