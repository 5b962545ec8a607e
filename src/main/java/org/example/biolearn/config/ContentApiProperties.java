package org.example.biolearn.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "content")
public class ContentApiProperties {

    private Quiz quiz = new Quiz();
    private Health health = new Health();
    private Store store = new Store();
    private Seed seed = new Seed();
    private Cors cors = new Cors();

    public Quiz getQuiz() {
        return quiz;
    }

    public void setQuiz(Quiz quiz) {
        this.quiz = quiz == null ? new Quiz() : quiz;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health == null ? new Health() : health;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store == null ? new Store() : store;
    }

    public Seed getSeed() {
        return seed;
    }

    public void setSeed(Seed seed) {
        this.seed = seed == null ? new Seed() : seed;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors == null ? new Cors() : cors;
    }

    public static class Quiz {
        private int defaultLimit = 20;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }
    }

    public static class Health {
        private int maxCollections = 10;

        public int getMaxCollections() {
            return maxCollections;
        }

        public void setMaxCollections(int maxCollections) {
            this.maxCollections = maxCollections;
        }
    }

    public static class Store {
        private boolean ensureIndexes = true;

        public boolean isEnsureIndexes() {
            return ensureIndexes;
        }

        public void setEnsureIndexes(boolean ensureIndexes) {
            this.ensureIndexes = ensureIndexes;
        }
    }

    public static class Seed {
        private boolean onStartup = false;

        public boolean isOnStartup() {
            return onStartup;
        }

        public void setOnStartup(boolean onStartup) {
            this.onStartup = onStartup;
        }
    }

    public static class Cors {
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
        private boolean allowCredentials = true;

        public List<String> getAllowedOriginPatterns() {
            return allowedOriginPatterns;
        }

        public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
            this.allowedOriginPatterns = allowedOriginPatterns == null ? new ArrayList<>() : allowedOriginPatterns;
        }

        public boolean isAllowCredentials() {
            return allowCredentials;
        }

        public void setAllowCredentials(boolean allowCredentials) {
            this.allowCredentials = allowCredentials;
        }
    }
}
