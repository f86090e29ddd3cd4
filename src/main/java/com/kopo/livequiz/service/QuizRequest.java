package com.kopo.livequiz.service;

import com.kopo.livequiz.entity.Difficulty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuizRequest {
    private String prompt;
    // 업로드한 PDF 에서 뽑은 본문. 있으면 prompt 대신 이 내용으로 출제한다.
    private String sourceText;
    private int numQuestions;
    private Difficulty difficulty;
}
