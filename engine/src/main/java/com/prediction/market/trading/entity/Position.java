package com.prediction.market.trading.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One user's holding of one side of one market.
 * At most one row exists per (userId, marketId, side); empty holdings are deleted.
 */
@Document(collection = "positions")
@CompoundIndex(name = "user_market_side_idx", def = "{'userId':1,'marketId':1,'side':1}", unique = true)
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Position {
    @Id
    private String id;

    private String userId;
    private String marketId;
    private Outcome side;
    private BigDecimal shares;
    private BigDecimal avgPrice;
    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public static String idFor(String userId, String marketId, Outcome side) {
        return userId + ":" + marketId + ":" + side.name();
    }

    public Position copy() {
        return toBuilder().build();
    }
}
