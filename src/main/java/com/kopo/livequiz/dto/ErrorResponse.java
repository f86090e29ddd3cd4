package com.kopo.livequiz.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오류 응답. detail 필드는 기존 클라이언트가 그대로 화면에 보여준다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String error;
    private String detail;
}
