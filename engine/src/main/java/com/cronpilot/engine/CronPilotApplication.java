package com.cronpilot.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point.
 *
 * With no arguments (or only --spring options) the engine starts as a web
 * service with the polling loop active:
 *   java -jar cronpilot-engine.jar
 *
 * With a command it runs once as a CLI, without the web server or the loop:
 *   java -jar cronpilot-engine.jar add jobs/news.yaml
 *   java -jar cronpilot-engine.jar run-now news --input topic=ai
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CronPilotApplication {

    public static void main(String[] args) {
        if (isCliInvocation(args)) {
            SpringApplication app = new SpringApplication(CronPilotApplication.class);
            app.setWebApplicationType(WebApplicationType.NONE);
            app.setAdditionalProfiles("cli");
            System.exit(SpringApplication.exit(app.run(args)));
        }
        SpringApplication.run(CronPilotApplication.class, args);
    }

    static boolean isCliInvocation(String[] args) {
        return args.length > 0 && !args[0].startsWith("--");
    }
}
