package com.flowsmith;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Flowsmith entry point. {@code flowsmith serve} keeps the process alive behind
 * the HTTP API under {@code /api/v1/workflows} and {@code /api/v1/plugins};
 * {@code generate}, {@code compile} and {@code plugins} run once without a web
 * server and exit with the command's status.
 */
@SpringBootApplication
public class FlowsmithApplication {

    static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        boolean serve = isServe(args);
        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(FlowsmithApplication.class)
                .properties(launchProperties(serve))
                .run(args);
        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    public static boolean isServe(String... args) {
        return args != null && Arrays.asList(args).contains(SERVE_COMMAND);
    }

    static String[] launchProperties(boolean serve) {
        return new String[] {
                "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                "spring.main.banner-mode=off"
        };
    }
}
