package com.studyspots.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

// Serves files written by the local blob store.
@Configuration
@RequiredArgsConstructor
public class StorageWebConfig implements WebMvcConfigurer {

    private final StudySpotsProperties properties;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        StudySpotsProperties.Storage storage = properties.getStorage();
        String location = Paths.get(storage.getRoot()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler(storage.getPublicPath() + "/**")
            .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
