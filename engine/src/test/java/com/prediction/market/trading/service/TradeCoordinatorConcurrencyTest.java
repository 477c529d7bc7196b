package com.prediction.market.trading.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.trading.dto.BuyReceipt;
import com.prediction.market.trading.entity.Market;
import com.prediction.market.trading.entity.Outcome;
import com.prediction.market.trading.entity.QuestionStatus;
import com.prediction.market.trading.exception.InsufficientFundsException;
import com.prediction.market.trading.support.TradingFixture;

class TradeCoordinatorConcurrencyTest {

    private final TradingFixture fixture = new TradingFixture();
    private final ExecutorService clients = Executors.newFixedThreadPool(10);

    @AfterEach
    void tearDown() throws InterruptedException {
        clients.shutdownNow();
        clients.awaitTermination(5, TimeUnit.SECONDS);
        fixture.close();
    }

    @Test
    void concurrentBuysOnOneMarket_allSettleAndConserveLiquidity() throws Exception {
        fixture.openQuestion("m1");
        for (int i = 0; i < 10; i++) {
            fixture.account("user-" + i, "1000");
        }
        CountDownLatch start = new CountDownLatch(1);

        List<Future<BuyReceipt>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String userId = "user-" + i;
            Outcome side = i % 2 == 0 ? Outcome.YES : Outcome.NO;
            results.add(clients.submit(() -> {
                start.await();
                return fixture.coordinator.buy(userId, "m1", side, new BigDecimal("50"));
            }));
        }
        start.countDown();

        List<BuyReceipt> receipts = new ArrayList<>();
        for (Future<BuyReceipt> result : results) {
            receipts.add(result.get(10, TimeUnit.SECONDS));
        }

        Market market = fixture.markets.findById("m1").orElseThrow();
        assertThat(market.getLiquidity()).isEqualByComparingTo("1490");
        assertThat(market.getYesPool().add(market.getNoPool())).isEqualByComparingTo("1490");
        assertThat(market.getVersion()).isEqualTo(9L);
        for (int i = 0; i < 10; i++) {
            String userId = "user-" + i;
            BuyReceipt receipt = receipts.get(i);
            assertThat(fixture.balance(userId)).isEqualByComparingTo("950");
            assertThat(fixture.positionBook.position(userId, "m1", receipt.getSide()))
                .get()
                .satisfies(position -> assertThat(position.getShares()).isEqualByComparingTo(receipt.getShares()));
        }
    }

    @Test
    void sameWalletAcrossTwoMarkets_cannotOverspend() throws Exception {
        fixture.openQuestion("m1");
        fixture.question("m2", 2, QuestionStatus.ACTIVE, TradingFixture.NOW.plus(7, ChronoUnit.DAYS));
        fixture.account("alice", "100");
        CountDownLatch start = new CountDownLatch(1);

        List<Future<BuyReceipt>> results = new ArrayList<>();
        for (String marketId : List.of("m1", "m2")) {
            results.add(clients.submit(() -> {
                start.await();
                return fixture.coordinator.buy("alice", marketId, Outcome.YES, new BigDecimal("60"));
            }));
        }
        start.countDown();

        int settled = 0;
        int refused = 0;
        for (Future<BuyReceipt> result : results) {
            try {
                result.get(10, TimeUnit.SECONDS);
                settled++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(InsufficientFundsException.class);
                refused++;
            }
        }

        assertThat(settled).isEqualTo(1);
        assertThat(refused).isEqualTo(1);
        assertThat(fixture.balance("alice")).isEqualByComparingTo("40");
        assertThat(fixture.positionBook.positionsOf("alice")).hasSize(1);
        assertThat(fixture.markets.findAll()).hasSize(1);
    }
}
