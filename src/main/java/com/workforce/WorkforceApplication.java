package com.workforce;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

/**
 * Entry point for both the one-shot CLI ({@code workforce chat ...}) and the HTTP service ({@code workforce serve}).
 */
@SpringBootApplication
public class WorkforceApplication {

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(WorkforceApplication.class);

        if (serveMode) {
            // Enable web server for the run API + SSE event streams
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server, the picocli banner replaces Spring's
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            // CLI app: exit with the command's code once the run has finished
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
        // In serve mode, the embedded web server keeps the JVM alive
    }

    /**
     * The subcommand is the first argument that is not an option, so a goal such as
     * {@code chat "serve the new menu"} stays a CLI run.
     */
    static boolean isServeMode(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("-"))
                .findFirst()
                .map("serve"::equals)
                .orElse(false);
    }
}
