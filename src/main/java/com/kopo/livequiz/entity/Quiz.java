package com.kopo.livequiz.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * 방 생성 시 한 번 만들어지고 이후 변경되지 않는 문제 세트.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Quiz {
    private String quizTitle;
    private List<QuizQuestion> questions;

    public int size() {
        return questions == null ? 0 : questions.size();
    }
}
