package com.marco.orchestrator.registry;

public class ModuleNotFoundException extends RuntimeException {
    public ModuleNotFoundException(String name) {
        super("No module registered with name: '" + name + "'");
    }
}
