package com.example.authservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI for the auth endpoints. Access tokens are documented as an HTTP bearer scheme;
 * refresh tokens travel in request bodies.
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "Bearer Authentication";

    @Bean
    public OpenAPI authServiceOpenAPI(@Value("${jwt.issuer:auth-service}") String issuer) {
        SecurityScheme accessToken = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("RS256 access token issued by " + issuer
                        + "; public key at /.well-known/jwks.json");

        return new OpenAPI()
                .info(new Info()
                        .title("Auth Service API")
                        .version("1.0")
                        .description("Password login, RS256 access tokens and rotating refresh tokens"))
                .addTagsItem(new Tag().name("Auth").description("Registration, login and token lifecycle"))
                .addTagsItem(new Tag().name("Keys").description("Verification key set"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, accessToken));
    }
}
