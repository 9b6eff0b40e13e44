package com.github.salilvnair.dialogengine.engine.step;

public record InitProperty(String property, PropertyType type) implements DialogStep {

    public enum PropertyType {
        ARRAY,
        OBJECT
    }

    public static InitProperty array(String property) {
        return new InitProperty(property, PropertyType.ARRAY);
    }

    public static InitProperty object(String property) {
        return new InitProperty(property, PropertyType.OBJECT);
    }

    @Override
    public StepKind kind() {
        return StepKind.INIT_PROPERTY;
    }
}
