package com.edafunc.handler;

import com.edafunc.model.Event;
import com.edafunc.model.HandlerOutcome;
import lombok.Getter;

/**
 * Presents either handler shape to the engine as one uniform call.
 *
 * The shape is detected once, at construction, from the handler's type
 * (never from what it returns at runtime):
 *   SimpleHandler  → no exception = ACK, exception = FAILURE
 *   OutputHandler  → exception = FAILURE (output ignored),
 *                    event returned = ACK_WITH_OUTPUT, null = ACK
 *
 * Anything else is rejected with {@link HandlerShapeException}. No class
 * can implement both interfaces, since their methods differ only in return type.
 */
public final class HandlerAdapter {

    @Getter
    private final HandlerShape shape;
    private final SimpleHandler simpleHandler;
    private final OutputHandler outputHandler;

    private HandlerAdapter(HandlerShape shape, SimpleHandler simpleHandler, OutputHandler outputHandler) {
        this.shape = shape;
        this.simpleHandler = simpleHandler;
        this.outputHandler = outputHandler;
    }

    public static HandlerAdapter of(Object handler) {
        if (handler == null) {
            throw new HandlerShapeException("Handler must not be null");
        }
        if (handler instanceof SimpleHandler simple) {
            return new HandlerAdapter(HandlerShape.SIMPLE, simple, null);
        }
        if (handler instanceof OutputHandler output) {
            return new HandlerAdapter(HandlerShape.OUTPUT, null, output);
        }
        throw new HandlerShapeException("Handler " + handler.getClass().getName()
                + " must implement SimpleHandler (Event -> void) or OutputHandler (Event -> Event)");
    }

    public boolean producesOutput() {
        return shape == HandlerShape.OUTPUT;
    }

    /**
     * Invokes the handler synchronously. Exceptions and errors thrown by the
     * handler (an AssertionError, a StackOverflowError) become FAILURE
     * outcomes. Only VirtualMachineErrors other than stack overflow propagate.
     */
    public HandlerOutcome invoke(Event event) {
        try {
            return switch (shape) {
                case SIMPLE -> {
                    simpleHandler.handle(event);
                    yield HandlerOutcome.ack();
                }
                case OUTPUT -> {
                    Event output = outputHandler.handle(event);
                    yield output == null ? HandlerOutcome.ack() : HandlerOutcome.ackWithOutput(output);
                }
            };
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return HandlerOutcome.failure(e);
        } catch (StackOverflowError e) {
            return HandlerOutcome.failure(e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            return HandlerOutcome.failure(e);
        }
    }
}
