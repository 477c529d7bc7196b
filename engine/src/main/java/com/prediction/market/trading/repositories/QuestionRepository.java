package com.prediction.market.trading.repositories;

import java.util.Optional;

import com.prediction.market.trading.entity.Question;

/**
 * Read-only access to the questions markets are opened against.
 */
public interface QuestionRepository {

    Optional<Question> findById(String questionId);

    /**
     * Several questions may share a number over time; the most recently created wins.
     */
    Optional<Question> findLatestByQuestionNumber(int questionNumber);
}
