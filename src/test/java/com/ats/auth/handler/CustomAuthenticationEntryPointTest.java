package com.ats.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.*;
import org.springframework.security.authentication.BadCredentialsException;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * CustomAuthenticationEntryPoint 單元測試
 *
 * 覆蓋：401 回傳格式
 */
class CustomAuthenticationEntryPointTest {

    private CustomAuthenticationEntryPoint entryPoint;

    @BeforeEach
    void setUp() {
        entryPoint = new CustomAuthenticationEntryPoint(new ObjectMapper());
    }

    @Test
    @DisplayName("回傳 401 + JSON 格式")
    void returns401Json() throws Exception {
        HttpServletRequest request = mock(HttpServletRequest.class);
        HttpServletResponse response = mock(HttpServletResponse.class);
        StringWriter sw = new StringWriter();
        when(response.getWriter()).thenReturn(new PrintWriter(sw));
        when(request.getRequestURI()).thenReturn("/subscriptions/checkout");

        entryPoint.commence(request, response,
                new BadCredentialsException("Full authentication is required"));

        verify(response).setStatus(401);
        verify(response).setContentType("application/json");
        assertThat(sw.toString()).contains("401").contains("Bearer Token");
    }
}
