package com.rally.leaguesync;

import com.rally.leaguesync.cli.ImportCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeagueSyncApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LeagueSyncApplication.class);
        String env = ImportCommandLineRunner.envOption(args);
        if (env != null) app.setAdditionalProfiles(env);
        boolean cli = ImportCommandLineRunner.isCommandInvocation(args);
        // One-shot import runs don't need the admin endpoints
        if (cli) app.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext ctx = app.run(args);
        if (cli) System.exit(SpringApplication.exit(ctx));
    }
}
