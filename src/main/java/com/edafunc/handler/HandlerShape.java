package com.edafunc.handler;

/**
 * The two accepted handler shapes.
 */
public enum HandlerShape {
    /** {@link SimpleHandler}: event in, nothing out. */
    SIMPLE,
    /** {@link OutputHandler}: event in, optional event out. */
    OUTPUT
}
