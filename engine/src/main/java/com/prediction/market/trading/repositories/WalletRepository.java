package com.prediction.market.trading.repositories;

import java.util.List;
import java.util.Optional;

import com.prediction.market.trading.entity.WalletAccount;

public interface WalletRepository {

    Optional<WalletAccount> findById(String userId);

    List<WalletAccount> findAll();

    WalletAccount save(WalletAccount account);
}
