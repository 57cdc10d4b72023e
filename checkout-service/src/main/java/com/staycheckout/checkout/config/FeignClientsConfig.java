package com.staycheckout.checkout.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Kept off the application class so web-layer test slices do not try to build Feign clients.
 */
@Configuration
@EnableFeignClients(basePackages = "com.staycheckout.checkout.client")
public class FeignClientsConfig {
}
