package com.xksgroup.downloadtracker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {

        Server localDev = new Server()
                .url("http://localhost:3001")
                .description("Développement local");

        return new OpenAPI()
                .info(new Info()
                        .title("API Download Tracker")
                        .version("v1")
                        .description("Documentation de l'API du suivi des téléchargements (file d'attente, historique, affiches)"))
                .servers(List.of(localDev));
    }
}
