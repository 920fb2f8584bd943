package com.edafunc.core;

/**
 * Materializes a decision backend. Called exactly once per engine, so a
 * backend that cannot be created fails startup like any other setup error.
 */
@FunctionalInterface
public interface CoreFactory {

    Core create() throws CoreException;
}
