package com.prediction.market.trading.store;

import java.util.Comparator;
import java.util.Optional;

import com.prediction.market.trading.entity.Question;
import com.prediction.market.trading.repositories.QuestionRepository;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemoryQuestionRepository implements QuestionRepository {

    private final InMemoryLedgerStore store;

    @Override
    public Optional<Question> findById(String questionId) {
        return Optional.ofNullable(store.questions().get(questionId));
    }

    @Override
    public Optional<Question> findLatestByQuestionNumber(int questionNumber) {
        return store.questions().values().stream()
            .filter(q -> q.getQuestionNumber() == questionNumber)
            .max(Comparator.comparing(Question::getCreatedDate, Comparator.nullsFirst(Comparator.naturalOrder())));
    }
}
