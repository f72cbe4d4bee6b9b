package com.ats.shared.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 共用 OkHttpClient
 *
 * 金流 API 與通知服務共用同一個連線池。
 * callTimeout 是每次外部呼叫的硬性上限，避免 webhook 請求被供應商拖住。
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient okHttpClient(
            @Value("${http.client.connect-timeout-seconds:5}") long connectTimeout,
            @Value("${http.client.read-timeout-seconds:15}") long readTimeout,
            @Value("${http.client.call-timeout-seconds:30}") long callTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout, TimeUnit.SECONDS)
                .readTimeout(readTimeout, TimeUnit.SECONDS)
                .callTimeout(callTimeout, TimeUnit.SECONDS)
                .build();
    }
}
