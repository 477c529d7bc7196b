package com.prediction.market.trading.repositories.mongo;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import java.util.List;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import com.prediction.market.trading.entity.BalanceTransaction;
import com.prediction.market.trading.repositories.BalanceTransactionRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MongoBalanceTransactionRepository implements BalanceTransactionRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public BalanceTransaction insert(BalanceTransaction transaction) {
        return MongoConflicts.translate("BalanceTransaction", transaction.getId(),
            () -> mongoTemplate.insert(transaction));
    }

    @Override
    public List<BalanceTransaction> findByUserIdOrderByCreatedAtDesc(String userId) {
        Query query = Query.query(where("userId").is(userId)).with(Sort.by(Sort.Direction.DESC, "createdAt"));
        return mongoTemplate.find(query, BalanceTransaction.class);
    }

    @Override
    public List<BalanceTransaction> findByRelatedId(String relatedId) {
        return mongoTemplate.find(Query.query(where("relatedId").is(relatedId)), BalanceTransaction.class);
    }
}
