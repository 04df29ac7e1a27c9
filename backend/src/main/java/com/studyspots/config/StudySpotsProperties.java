package com.studyspots.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "studyspots")
public class StudySpotsProperties {

    private final Pagination pagination = new Pagination();
    private final Storage storage = new Storage();
    private final Bookmarks bookmarks = new Bookmarks();
    private final Cors cors = new Cors();

    @Data
    public static class Pagination {
        private int defaultLimit = 100;
        private int maxLimit = 1000;
    }

    @Data
    public static class Storage {
        /** Directory that backs the local blob store. */
        private String root = "uploads";
        /** URL path under which stored files are served by this application. */
        private String publicPath = "/static";
        private String publicBaseUrl = "http://localhost:8000/static";
        private List<String> allowedContentTypes = new ArrayList<>(
            List.of("image/jpeg", "image/png", "image/gif", "image/webp"));
    }

    @Data
    public static class Bookmarks {
        /** Number of lock stripes guarding bookmark (user, cafe) pairs. */
        private int lockStripes = 64;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
