package com.kopo.livequiz.service;

import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.exception.QuizGenerationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuizGenerationServiceTest {

    @Mock
    private QuizSource quizSource;

    @Mock
    private PdfTextExtractor pdfTextExtractor;

    @InjectMocks
    private QuizGenerationService quizGenerationService;

    private final MockQuizFactory mockQuizFactory = new MockQuizFactory();

    @Test
    void appliesDefaultsForMissingPromptAndCount() {
        when(quizSource.generate(any())).thenReturn(mockQuizFactory.createQuiz("x", 5));

        quizGenerationService.generateQuiz("  ", null, Difficulty.MEDIUM);

        ArgumentCaptor<QuizRequest> request = ArgumentCaptor.forClass(QuizRequest.class);
        verify(quizSource).generate(request.capture());
        assertThat(request.getValue().getPrompt()).isEqualTo(QuizGenerationService.DEFAULT_PROMPT);
        assertThat(request.getValue().getNumQuestions()).isEqualTo(5);
        assertThat(request.getValue().getSourceText()).isNull();
    }

    @Test
    void rejectsOutOfRangeQuestionCount() {
        assertThatThrownBy(() -> quizGenerationService.generateQuiz("Cats", 0, Difficulty.EASY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> quizGenerationService.generateQuiz("Cats", 11, Difficulty.EASY))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(quizSource);
    }

    @Test
    void passesExtractedPdfTextToSource() {
        MockMultipartFile pdf = new MockMultipartFile("file", "notes.pdf", "application/pdf", new byte[]{1, 2, 3});
        when(pdfTextExtractor.extract(pdf)).thenReturn("Cells divide by mitosis.");
        when(quizSource.generate(any())).thenReturn(mockQuizFactory.createQuiz("Cells", 2));

        Quiz quiz = quizGenerationService.generateQuiz("Cells", 2, Difficulty.HARD, pdf);

        ArgumentCaptor<QuizRequest> request = ArgumentCaptor.forClass(QuizRequest.class);
        verify(quizSource).generate(request.capture());
        assertThat(request.getValue().getSourceText()).isEqualTo("Cells divide by mitosis.");
        assertThat(request.getValue().getDifficulty()).isEqualTo(Difficulty.HARD);
        assertThat(quiz.size()).isEqualTo(2);
    }

    @Test
    void rejectsQuizWithWrongQuestionCount() {
        when(quizSource.generate(any())).thenReturn(mockQuizFactory.createQuiz("Cats", 2));

        assertThatThrownBy(() -> quizGenerationService.generateQuiz("Cats", 3, Difficulty.EASY))
                .isInstanceOf(QuizGenerationException.class);
    }
}
