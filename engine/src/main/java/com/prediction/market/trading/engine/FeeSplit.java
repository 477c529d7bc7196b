package com.prediction.market.trading.engine;

import com.prediction.market.trading.entity.Money;

import lombok.Builder;
import lombok.Value;

/**
 * How a gross amount divides between the trade, the referrer and the platform.
 * {@code netAmount + feeCharged == gross} and {@code referrerShare + platformShare == feeCharged}.
 */
@Value
@Builder
public class FeeSplit {
    Money grossAmount;
    Money feeCharged;
    Money netAmount;
    Money referrerShare;
    Money platformShare;

    public boolean hasReferrerShare() {
        return referrerShare.isPositive();
    }
}
