package com.entity.linking.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Entity Linking API",
                version = "1.0.0",
                description = "Contact matching on phone, e-mail and name signals, symmetric entity links " +
                        "between memories, todos, projects, contacts and threads, and automatic linking " +
                        "of inbound messages to their sender and related work items.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
@SecurityScheme(
        securitySchemeName = "bearer",
        type = SecuritySchemeType.HTTP,
        scheme = "bearer",
        description = "Bearer token, forwarded to the backend stores."
)
public class LinkingApplication extends Application {
}
