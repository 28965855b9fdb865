package io.kestra.plugin.groupby.message;

import java.util.Map;

/**
 * A message identifier plus its substitution arguments. Rendering the text is left to the host.
 */
public record I18nMessage(String id, Map<String, Object> arguments) {
    public I18nMessage {
        arguments = Map.copyOf(arguments);
    }

    public static I18nMessage of(String id) {
        return new I18nMessage(id, Map.of());
    }
}
