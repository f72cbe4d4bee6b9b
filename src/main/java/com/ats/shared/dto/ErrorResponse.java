package com.ats.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 統一錯誤回應格式
 *
 * code 為穩定的錯誤代碼（見 ErrorCode），前端與供應商重送邏輯以它判斷，
 * 不要依賴 message 文字。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /** 錯誤類型（簡短描述） */
    private String error;

    /** 穩定錯誤代碼 */
    private String code;

    /** 詳細錯誤訊息 */
    private String message;
}
