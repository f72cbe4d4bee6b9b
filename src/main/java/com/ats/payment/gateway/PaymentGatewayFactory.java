package com.ats.payment.gateway;

import com.ats.payment.config.LemonSqueezyConfig;
import com.ats.payment.config.PaymentConfig;
import com.ats.payment.gateway.lemonsqueezy.LemonSqueezyPaymentGateway;
import com.ats.payment.model.PaymentProvider;
import com.ats.shared.exception.BadRequestException;
import com.ats.shared.exception.ErrorCode;
import com.ats.shared.exception.InternalServerErrorException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 金流供應商工廠
 *
 * 依 payment.provider 建立對應的 {@link PaymentGateway}。
 * - 未知名稱 → BadRequest
 * - 已知但尚未實作（stripe / paddle / paypal）→ InternalServerError
 */
@Slf4j
@Component
public class PaymentGatewayFactory {

    private final PaymentConfig paymentConfig;
    private final LemonSqueezyConfig lemonSqueezyConfig;
    private final OkHttpClient httpClient;

    public PaymentGatewayFactory(PaymentConfig paymentConfig,
                                 LemonSqueezyConfig lemonSqueezyConfig,
                                 OkHttpClient httpClient) {
        this.paymentConfig = paymentConfig;
        this.lemonSqueezyConfig = lemonSqueezyConfig;
        this.httpClient = httpClient;
    }

    /**
     * 依設定檔建立供應商實作
     */
    public PaymentGateway create() {
        return create(paymentConfig.getProvider());
    }

    public PaymentGateway create(String providerName) {
        PaymentProvider provider = resolve(providerName);
        log.info("綁定金流供應商: provider={}", provider.getDisplayName());

        return switch (provider) {
            case LEMONSQUEEZY -> new LemonSqueezyPaymentGateway(
                    httpClient, lemonSqueezyConfig, paymentConfig.getSuccessUrl());
            case STRIPE, PADDLE, PAYPAL -> throw new InternalServerErrorException(
                    ErrorCode.PROVIDER_NOT_IMPLEMENTED,
                    provider.getDisplayName() + " payment gateway not implemented yet");
        };
    }

    public List<String> getSupportedProviders() {
        return PaymentProvider.configNames();
    }

    /**
     * 目前設定的供應商（正規化後）
     */
    public PaymentProvider getActiveProvider() {
        return resolve(paymentConfig.getProvider());
    }

    private PaymentProvider resolve(String providerName) {
        return PaymentProvider.fromConfigName(providerName)
                .orElseThrow(() -> new BadRequestException(
                        ErrorCode.UNKNOWN_PROVIDER,
                        "Invalid payment provider in configuration: " + providerName
                                + ". Supported providers: " + String.join(", ", getSupportedProviders())));
    }
}
