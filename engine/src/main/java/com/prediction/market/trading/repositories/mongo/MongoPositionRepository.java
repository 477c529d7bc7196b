package com.prediction.market.trading.repositories.mongo;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import com.mongodb.client.result.DeleteResult;
import com.prediction.market.trading.entity.Position;
import com.prediction.market.trading.exception.ConcurrencyConflictException;
import com.prediction.market.trading.repositories.PositionRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MongoPositionRepository implements PositionRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Position> findById(String positionId) {
        return Optional.ofNullable(mongoTemplate.findById(positionId, Position.class));
    }

    @Override
    public List<Position> findByUserIdAndMarketId(String userId, String marketId) {
        return mongoTemplate.find(Query.query(where("userId").is(userId).and("marketId").is(marketId)), Position.class);
    }

    @Override
    public List<Position> findByUserId(String userId) {
        return mongoTemplate.find(Query.query(where("userId").is(userId)), Position.class);
    }

    @Override
    public Position save(Position position) {
        return MongoConflicts.translate("Position", position.getId(), () -> mongoTemplate.save(position));
    }

    /**
     * Version-checked delete: removes the row only if nobody wrote it since it was read.
     */
    @Override
    public void delete(Position position) {
        Query query = Query.query(where("_id").is(position.getId()).and("version").is(position.getVersion()));
        DeleteResult result = MongoConflicts.translate("Position", position.getId(),
            () -> mongoTemplate.remove(query, Position.class));
        if (result.getDeletedCount() == 0) {
            throw new ConcurrencyConflictException("Position", position.getId(), position.getVersion(), "changed or absent");
        }
    }
}
