package com.slipway;

import com.slipway.dispatch.cli.ServeCommand;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Map;

/**
 * Entry point. {@code slipway serve} runs the webhook and status server; every other
 * command runs once without a web server and exits with the command's exit code.
 */
@SpringBootApplication
public class SlipwayApplication {

    public static void main(String[] args) {
        args = launchArgs(args, System.getenv());
        boolean serveMode = ServeCommand.requested(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(SlipwayApplication.class)
                .properties("spring.main.banner-mode=off",
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"));

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }

    /**
     * Pushes reach Slipway only through the server, so a platform launch with no arguments
     * (Cloud Foundry's {@code VCAP_APPLICATION}, or {@code SLIPWAY_SERVE=true}) means serve.
     */
    static String[] launchArgs(String[] args, Map<String, String> env) {
        if (args.length > 0) {
            return args;
        }
        if (env.containsKey("VCAP_APPLICATION") || "true".equalsIgnoreCase(env.get("SLIPWAY_SERVE"))) {
            return new String[]{"serve"};
        }
        return args;
    }
}
