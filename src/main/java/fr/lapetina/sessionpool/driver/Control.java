package fr.lapetina.sessionpool.driver;

import java.util.Objects;

/**
 * Descriptor of one control on the target surface.
 *
 * @param name     logical name used in logs and errors
 * @param selector driver-specific locator
 */
public record Control(String name, String selector) {
    public Control {
        Objects.requireNonNull(name, "Control name is required");
        Objects.requireNonNull(selector, "Control selector is required");
    }

    @Override
    public String toString() {
        return name;
    }
}
