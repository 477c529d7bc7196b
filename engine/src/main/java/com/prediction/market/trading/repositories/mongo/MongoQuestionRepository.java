package com.prediction.market.trading.repositories.mongo;

import static org.springframework.data.mongodb.core.query.Criteria.where;

import java.util.Optional;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import com.prediction.market.trading.entity.Question;
import com.prediction.market.trading.repositories.QuestionRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MongoQuestionRepository implements QuestionRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Question> findById(String questionId) {
        return Optional.ofNullable(mongoTemplate.findById(questionId, Question.class));
    }

    @Override
    public Optional<Question> findLatestByQuestionNumber(int questionNumber) {
        Query query = Query.query(where("questionNumber").is(questionNumber))
            .with(Sort.by(Sort.Direction.DESC, "createdDate"))
            .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, Question.class));
    }
}
