package com.jdc.recipe_manager.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app")
@Getter @Setter
public class RecipeManagerProperties {

    private Admin admin = new Admin();
    private Stats stats = new Stats();
    private Recipes recipes = new Recipes();
    private Schema schema = new Schema();

    @Getter @Setter
    public static class Admin {
        /** Blank disables admin self-registration. */
        private String passphrase = "";
    }

    @Getter @Setter
    public static class Stats {
        private int recentDays = 7;
        private int topUsers = 5;
    }

    @Getter @Setter
    public static class Recipes {
        /** Row cap for the browse listing. */
        private int defaultLimit = 1000;
        /** Row cap for the recent and most-viewed listings. */
        private int listLimit = 10;
    }

    @Getter @Setter
    public static class Schema {
        private boolean enabled = true;
        /** Selects classpath:schema/schema-{platform}.sql. */
        private String platform = "h2";
    }
}
