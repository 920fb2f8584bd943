package com.edafunc.examples;

import com.edafunc.EdaFuncApplication;
import com.edafunc.handler.SimpleHandler;
import com.edafunc.model.Event;
import lombok.extern.slf4j.Slf4j;

/**
 * Minimal function: logs every event it receives.
 */
@Slf4j
public class LoggingFunction implements SimpleHandler {

    public static void main(String[] args) {
        EdaFuncApplication.run(new LoggingFunction(), args);
    }

    @Override
    public void handle(Event event) {
        log.info("Received event: id={}, type={}, source={}", event.getId(), event.getType(), event.getSource());
    }
}
