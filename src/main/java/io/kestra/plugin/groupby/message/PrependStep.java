package io.kestra.plugin.groupby.message;

import java.util.Map;

/**
 * Suggests inserting the step {@code moduleSlug}, configured with {@code params}, before this one.
 */
public record PrependStep(String moduleSlug, Map<String, Object> params) {
    public PrependStep {
        params = Map.copyOf(params);
    }
}
