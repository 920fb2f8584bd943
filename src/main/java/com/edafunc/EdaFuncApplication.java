package com.edafunc;

import com.edafunc.examples.LoggingFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point of an event function.
 *
 * A function's own main method hands its handler to {@link #run(Object, String...)}:
 *
 *   public static void main(String[] args) {
 *       EdaFuncApplication.run((SimpleHandler) event -> log.info("got {}", event.getId()), args);
 *   }
 *
 * The process exits with 0 after a clean shutdown and 1 when the engine fails.
 * On SIGINT/SIGTERM the shutdown hooks drain the engine; once the context is
 * closed the JVM is halted with the engine's exit code, since System.exit
 * would block behind the running hooks and leave the signal's status.
 */
@SpringBootApplication
@Slf4j
public class EdaFuncApplication {

    /** Bean name under which the function's handler is registered. */
    public static final String HANDLER_BEAN = "eventHandler";

    public static void main(String[] args) {
        run(new LoggingFunction(), args);
    }

    public static void run(Object handler, String... args) {
        int exitCode = start(handler, args);
        if (shutdownInProgress()) {
            Runtime.getRuntime().halt(exitCode);
        }
        System.exit(exitCode);
    }

    static int start(Object handler, String... args) {
        SpringApplication application = new SpringApplication(EdaFuncApplication.class);
        application.addInitializers(context -> context.getBeanFactory().registerSingleton(HANDLER_BEAN, handler));
        try {
            ConfigurableApplicationContext context = application.run(args);
            if (shutdownInProgress()) {
                // the engine already drained; wait for the hook to finish closing the context
                context.close();
                return 0;
            }
            return SpringApplication.exit(context);
        } catch (RuntimeException e) {
            log.error("Event function terminated: {}", e.getMessage());
            return 1;
        }
    }

    /** True while the JVM runs its shutdown hooks. */
    static boolean shutdownInProgress() {
        Thread hook = new Thread(() -> { });
        try {
            Runtime.getRuntime().addShutdownHook(hook);
            Runtime.getRuntime().removeShutdownHook(hook);
            return false;
        } catch (IllegalStateException e) {
            return true;
        }
    }
}
