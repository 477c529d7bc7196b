package com.prediction.market.trading.entity;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A question a market can be opened against. Read-only for the engine; the first
 * trade on an ACTIVE, unexpired question materializes its market.
 */
@Document(collection = "questions")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Question {
    @Id
    private String id;

    @Indexed
    private int questionNumber;

    private String text;
    private QuestionStatus status;
    private Instant resolutionDate;
    private Instant createdDate;

    public boolean isActive() {
        return status == QuestionStatus.ACTIVE;
    }
}
