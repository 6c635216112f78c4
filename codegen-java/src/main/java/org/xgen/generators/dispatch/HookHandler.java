package org.xgen.generators.dispatch;

@FunctionalInterface
public interface HookHandler {

    void apply(Object... args) throws GenerationException;
}
