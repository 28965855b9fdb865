package io.kestra.plugin.groupby.message;

import java.util.List;

/**
 * A message for the user, with the fixes they may apply. Never executed here.
 */
public record RenderError(I18nMessage message, List<QuickFix> quickFixes) {
    public RenderError {
        quickFixes = List.copyOf(quickFixes);
    }

    public static RenderError of(I18nMessage message) {
        return new RenderError(message, List.of());
    }
}
