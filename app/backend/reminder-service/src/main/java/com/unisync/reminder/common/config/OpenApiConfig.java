package com.unisync.reminder.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 설정
 */
@Configuration
public class OpenApiConfig {

    @Value("${springdoc.server.url:/}")
    private String serverUrl;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Reminder Service API")
                        .version("1.0.0")
                        .description("사용자별 리마인더(날짜 + 메모) 관리 API"))
                .servers(List.of(
                        new Server()
                                .url(serverUrl)
                                .description("Reminder Service")
                ));
    }
}
