package com.example.annotation.config;

import com.example.annotation.security.resolver.CallerContextArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * WebFlux configuration for custom argument resolvers.
 *
 * <p>Registers the {@link CallerContextArgumentResolver} to enable
 * injection of {@link com.example.annotation.security.context.CallerContext} into controller methods.</p>
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebFluxConfigurer {

    private final CallerContextArgumentResolver callerContextArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(callerContextArgumentResolver);
    }
}
