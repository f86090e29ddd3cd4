package com.kopo.livequiz.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@Component
public class PdfTextExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PdfTextExtractor.class);

    // Gemini 요청 크기 제한
    static final int MAX_TEXT_LENGTH = 30000;

    public String extract(MultipartFile pdf) {
        logger.info("PDF 텍스트 추출 시작: {} ({} bytes)", pdf.getOriginalFilename(), pdf.getSize());
        try (InputStream in = pdf.getInputStream()) {
            return extract(in);
        } catch (IOException e) {
            logger.error("PDF 텍스트 추출 실패: {}", e.getMessage(), e);
            throw new IllegalArgumentException("Could not read the uploaded PDF: " + e.getMessage(), e);
        }
    }

    String extract(InputStream in) throws IOException {
        try (PDDocument document = PDDocument.load(in)) {
            PDFTextStripper pdfStripper = new PDFTextStripper();
            String text = pdfStripper.getText(document).trim();
            if (text.length() > MAX_TEXT_LENGTH) {
                text = text.substring(0, MAX_TEXT_LENGTH);
                logger.warn("PDF 내용이 너무 길어 {}자로 제한되었습니다.", MAX_TEXT_LENGTH);
            }
            logger.info("PDF 텍스트 추출 완료. 추출 길이: {}자", text.length());
            return text;
        }
    }
}
