package com.ats.payment.config;

import com.ats.payment.gateway.PaymentGateway;
import com.ats.payment.gateway.PaymentGatewayFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 啟動時綁定唯一的金流供應商，設定錯誤或缺憑證會讓應用啟動失敗
 */
@Configuration
public class PaymentGatewayConfig {

    @Bean
    public PaymentGateway paymentGateway(PaymentGatewayFactory factory) {
        return factory.create();
    }
}
