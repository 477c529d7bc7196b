package com.prediction.market.trading.repositories.mongo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.core.MongoTemplate;

import com.prediction.market.trading.entity.WalletAccount;
import com.prediction.market.trading.repositories.WalletRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MongoWalletRepository implements WalletRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<WalletAccount> findById(String userId) {
        return Optional.ofNullable(mongoTemplate.findById(userId, WalletAccount.class));
    }

    @Override
    public List<WalletAccount> findAll() {
        return mongoTemplate.findAll(WalletAccount.class);
    }

    @Override
    public WalletAccount save(WalletAccount account) {
        return MongoConflicts.translate("WalletAccount", account.getUserId(), () -> mongoTemplate.save(account));
    }
}
